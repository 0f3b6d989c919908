package org.javai.chitalishta.intent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Factory methods wiring the classifiers and the router at application start-up.
 *
 * <pre>{@code
 * KeywordIntentClassifier rules = new KeywordIntentClassifier();
 * IntentClassifier external = IntentClassifiers.llm(chatClient, "gpt-4.1-mini").orFallback(rules);
 * HybridRouter router = new HybridRouter(rules, external);
 * }</pre>
 */
public final class IntentClassifiers {

	private static final Logger logger = LoggerFactory.getLogger(IntentClassifiers.class);

	private IntentClassifiers() {
	}

	/**
	 * Attempts to build an LLM classifier.
	 *
	 * @param chatClient the chat client, or null when no model is configured
	 * @param modelId optional model identifier for logging
	 */
	public static ClassifierCreation llm(ChatClient chatClient, String modelId) {
		if (chatClient == null) {
			return new ClassifierCreation.Unavailable("No chat client configured");
		}
		return new ClassifierCreation.Created(new LlmIntentClassifier(chatClient, modelId));
	}

	/**
	 * Builds a router from the default Bulgarian keyword classifier and an LLM classifier,
	 * substituting the keyword classifier for the LLM when none is available.
	 */
	public static HybridRouter hybridRouter(ChatClient chatClient, String modelId) {
		KeywordIntentClassifier rules = new KeywordIntentClassifier();
		ClassifierCreation creation = llm(chatClient, modelId);
		if (creation instanceof ClassifierCreation.Unavailable unavailable) {
			logger.warn("LLM intent classifier unavailable ({}); falling back to rule-based classification",
					unavailable.reason());
		}
		return new HybridRouter(rules, creation.orFallback(rules));
	}
}
