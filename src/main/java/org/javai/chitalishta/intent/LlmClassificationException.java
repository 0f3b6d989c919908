package org.javai.chitalishta.intent;

/**
 * Thrown when the LLM behind {@link LlmIntentClassifier} cannot be reached or fails to answer.
 */
public class LlmClassificationException extends RuntimeException {

	public LlmClassificationException(String message, Throwable cause) {
		super(message, cause);
	}
}
