package org.javai.chitalishta.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw text of an LLM reply into an {@link LlmIntentReply}.
 *
 * <p>Models do not always return clean JSON. The parser looks for the first object that
 * mentions {@code "intent"}, then for any object, and as a last resort extracts the three
 * fields with regular expressions. It never fails: unknown intents become
 * {@link QueryIntent#RAG} and a missing confidence becomes {@value #DEFAULT_CONFIDENCE}.</p>
 */
public class LlmIntentResponseParser {

	private static final Logger logger = LoggerFactory.getLogger(LlmIntentResponseParser.class);

	static final double DEFAULT_CONFIDENCE = 0.5;
	static final String MISSING_REASON = "Няма обяснение предоставено.";
	static final String UNPARSEABLE_REASON = "Неуспешно парсиране на отговора.";

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

	private static final Pattern INTENT_OBJECT = Pattern.compile("\\{[^{}]*\"intent\"[^{}]*}", Pattern.DOTALL);
	private static final Pattern ANY_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);
	private static final Pattern INTENT_FIELD = Pattern.compile("\"intent\"\\s*:\\s*\"([^\"]+)\"");
	private static final Pattern CONFIDENCE_FIELD = Pattern.compile("\"confidence\"\\s*:\\s*([0-9.]+)");
	private static final Pattern REASON_FIELD = Pattern.compile("\"reason\"\\s*:\\s*\"([^\"]+)\"");

	public LlmIntentReply parse(String content) {
		String text = content != null ? content : "";
		String candidate = extractJsonObject(text);
		try {
			JsonNode node = JSON_MAPPER.readTree(candidate);
			if (node != null && node.isObject()) {
				return fromJson(node);
			}
		} catch (JsonProcessingException e) {
			logger.debug("LLM reply is not valid JSON, falling back to field extraction: {}", e.getOriginalMessage());
		}
		return fromFields(text);
	}

	private static String extractJsonObject(String text) {
		Matcher intentObject = INTENT_OBJECT.matcher(text);
		if (intentObject.find()) {
			return intentObject.group();
		}
		Matcher anyObject = ANY_OBJECT.matcher(text);
		if (anyObject.find()) {
			return anyObject.group();
		}
		return text;
	}

	private static LlmIntentReply fromJson(JsonNode node) {
		QueryIntent intent = QueryIntent.fromValue(node.path("intent").asText("rag")).orElse(QueryIntent.RAG);
		double confidence = clamp(node.path("confidence").asDouble(DEFAULT_CONFIDENCE));
		String reason = node.path("reason").asText("");
		return new LlmIntentReply(intent, confidence, reason.isBlank() ? MISSING_REASON : reason);
	}

	private static LlmIntentReply fromFields(String text) {
		Matcher intentMatch = INTENT_FIELD.matcher(text);
		Matcher confidenceMatch = CONFIDENCE_FIELD.matcher(text);
		Matcher reasonMatch = REASON_FIELD.matcher(text);

		QueryIntent intent = intentMatch.find()
				? QueryIntent.fromValue(intentMatch.group(1)).orElse(QueryIntent.RAG)
				: QueryIntent.RAG;
		double confidence = DEFAULT_CONFIDENCE;
		if (confidenceMatch.find()) {
			try {
				confidence = Double.parseDouble(confidenceMatch.group(1));
			} catch (NumberFormatException e) {
				logger.debug("Ignoring malformed confidence '{}'", confidenceMatch.group(1));
			}
		}
		String reason = reasonMatch.find() ? reasonMatch.group(1) : UNPARSEABLE_REASON;
		return new LlmIntentReply(intent, clamp(confidence), reason.isBlank() ? UNPARSEABLE_REASON : reason);
	}

	private static double clamp(double confidence) {
		if (Double.isNaN(confidence)) {
			return DEFAULT_CONFIDENCE;
		}
		return Math.max(0.0, Math.min(1.0, confidence));
	}
}
