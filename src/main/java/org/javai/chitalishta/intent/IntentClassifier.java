package org.javai.chitalishta.intent;

/**
 * Classifies a natural-language query into a {@link QueryIntent}.
 *
 * <p>Implementations must return {@link QueryIntent#RAG} with confidence {@code 0.0} for
 * an empty or blank query, and keep confidence within {@code [0.0, 1.0]}.</p>
 */
@FunctionalInterface
public interface IntentClassifier {

	/**
	 * @param query the user query, possibly empty (never null)
	 * @return the classification, never null
	 */
	ClassificationResult classify(String query);
}
