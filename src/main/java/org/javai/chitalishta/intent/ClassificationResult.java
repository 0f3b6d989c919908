package org.javai.chitalishta.intent;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of classifying a single query.
 *
 * <p>The same shape is used for the output of each individual classifier and for the
 * fused decision returned by {@link HybridRouter}, so downstream code has one contract
 * regardless of whether fusion happened.</p>
 *
 * @param intent the selected execution path
 * @param confidence confidence in {@code [0.0, 1.0]}
 * @param matchedSignals evidence in discovery order (may be empty, never null)
 * @param explanation human-readable justification, in the language of the query
 */
public record ClassificationResult(
		QueryIntent intent,
		double confidence,
		List<String> matchedSignals,
		String explanation
) {

	public ClassificationResult {
		Objects.requireNonNull(intent, "intent must not be null");
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0.0, 1.0], got " + confidence);
		}
		if (explanation == null || explanation.isBlank()) {
			throw new IllegalArgumentException("explanation must not be blank");
		}
		matchedSignals = matchedSignals != null ? List.copyOf(matchedSignals) : List.of();
	}

	public ClassificationResult(QueryIntent intent, double confidence, String explanation) {
		this(intent, confidence, List.of(), explanation);
	}

	/**
	 * Returns a copy with a different explanation, keeping every other component.
	 */
	public ClassificationResult withExplanation(String newExplanation) {
		return new ClassificationResult(intent, confidence, matchedSignals, newExplanation);
	}
}
