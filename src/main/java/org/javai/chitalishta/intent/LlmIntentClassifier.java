package org.javai.chitalishta.intent;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Intent classifier backed by a chat model.
 *
 * <p>The model is instructed in Bulgarian to answer with a JSON object
 * {@code {"intent", "confidence", "reason"}}; the reply is read by
 * {@link LlmIntentResponseParser}. Matched signals are always empty since the model gives
 * a free-text reason instead.</p>
 *
 * <p>A failing model call surfaces as {@link LlmClassificationException}. Wrap the classifier
 * or use {@link IntentClassifiers} when a degraded fallback is wanted.</p>
 */
public class LlmIntentClassifier implements IntentClassifier {

	private static final Logger logger = LoggerFactory.getLogger(LlmIntentClassifier.class);

	static final String SYSTEM_PROMPT = """
			Ти си класификатор на потребителски заявки за система за данни за читалища.
			Класифицирай всяка заявка в една от следните категории:
			1) 'sql' – когато потребителят иска числа, статистики, агрегати, брой, средно, максимум,
			   минимум, проценти, разпределения, таблици, списъци, "топ" класации и др.
			2) 'rag' – когато потребителят иска описателна текстова информация, обяснения,
			   история, контекст, "какво е", "как се", "защо", "разкажи" и др.
			3) 'hybrid' – когато заявката ясно комбинира и двете: иска и числа/статистика,
			   и описателен текст (напр. "Колко читалища има и разкажи за тях").

			Винаги връщай валиден JSON обект със следната структура:
			{
			  "intent": "sql" | "rag" | "hybrid",
			  "confidence": число между 0.0 и 1.0,
			  "reason": "кратко обяснение на български (1–2 изречения)"
			}

			Правила за confidence:
			  * 0.8–1.0, ако си силно уверен
			  * 0.5–0.8, ако си умерено уверен
			  * под 0.5, ако заявката е неясна или гранична

			Бъди стриктен и не измисляй други стойности за intent.
			""";

	private final ChatClient chatClient;
	private final String modelId;
	private final LlmIntentResponseParser parser;

	public LlmIntentClassifier(ChatClient chatClient) {
		this(chatClient, null);
	}

	/**
	 * @param chatClient the Spring AI chat client used for every classification
	 * @param modelId optional identifier used in log messages (e.g. "gpt-4.1-mini")
	 */
	public LlmIntentClassifier(ChatClient chatClient, String modelId) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.modelId = modelId;
		this.parser = new LlmIntentResponseParser();
	}

	@Override
	public ClassificationResult classify(String query) {
		Objects.requireNonNull(query, "query must not be null");
		if (query.isBlank()) {
			return new ClassificationResult(QueryIntent.RAG, 0.0,
					"Празна заявка - използва се RAG по подразбиране (LLM класификатор).");
		}

		String content;
		try {
			content = chatClient.prompt()
					.system(SYSTEM_PROMPT)
					.user(userMessage(query))
					.call()
					.content();
		} catch (RuntimeException e) {
			throw new LlmClassificationException(
					"Intent classification call failed" + (modelId != null ? " for model " + modelId : ""), e);
		}

		LlmIntentReply reply = parser.parse(content);
		logger.debug("LLM classification (model={}): intent={} confidence={}",
				modelId, reply.intent(), reply.confidence());
		return new ClassificationResult(reply.intent(), reply.confidence(), reply.reason());
	}

	static String userMessage(String query) {
		return "Класифицирай следната заявка и върни само валиден JSON:\n\nЗаявка: \"%s\"\n".formatted(query);
	}
}
