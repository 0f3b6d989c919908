package org.javai.chitalishta.intent;

/**
 * Structured reply the LLM classifier is instructed to produce.
 *
 * @param intent the detected intent
 * @param confidence confidence clamped to {@code [0.0, 1.0]}
 * @param reason short Bulgarian explanation
 */
public record LlmIntentReply(QueryIntent intent, double confidence, String reason) {
}
