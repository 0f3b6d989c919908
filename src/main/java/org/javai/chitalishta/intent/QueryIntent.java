package org.javai.chitalishta.intent;

import java.util.Locale;
import java.util.Optional;

/**
 * Execution path a user query should take.
 */
public enum QueryIntent {

	/** Numeric, aggregation and statistical questions answered from the database. */
	SQL("sql"),
	/** Descriptive questions answered by retrieval over indexed documents. */
	RAG("rag"),
	/** Questions that need both numbers and descriptive context. */
	HYBRID("hybrid");

	private final String value;

	QueryIntent(String value) {
		this.value = value;
	}

	/**
	 * @return the lower-case wire name used in LLM replies and explanations
	 */
	public String value() {
		return value;
	}

	/**
	 * Looks up an intent by its wire name, ignoring case and surrounding whitespace.
	 */
	public static Optional<QueryIntent> fromValue(String candidate) {
		if (candidate == null || candidate.isBlank()) {
			return Optional.empty();
		}
		String normalized = candidate.trim().toLowerCase(Locale.ROOT);
		for (QueryIntent intent : values()) {
			if (intent.value.equals(normalized)) {
				return Optional.of(intent);
			}
		}
		return Optional.empty();
	}
}
