package org.javai.chitalishta.intent;

import java.util.Objects;

/**
 * Stands in for the LLM classifier when no model is available, delegating to a rule-based
 * classifier and marking every explanation accordingly.
 */
public class FallbackIntentClassifier implements IntentClassifier {

	static final String FALLBACK_NOTE = "(Използван е rule-based класификатор поради недостъпност на LLM)";

	private final IntentClassifier delegate;

	public FallbackIntentClassifier(IntentClassifier delegate) {
		this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
	}

	@Override
	public ClassificationResult classify(String query) {
		ClassificationResult result = delegate.classify(query);
		return result.withExplanation(result.explanation() + " " + FALLBACK_NOTE);
	}
}
