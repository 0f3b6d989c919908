package org.javai.chitalishta.intent;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LlmIntentResponseParser")
class LlmIntentResponseParserTest {

	private final LlmIntentResponseParser parser = new LlmIntentResponseParser();

	@Test
	void parsesCleanJson() {
		LlmIntentReply reply = parser.parse("{\"intent\": \"hybrid\", \"confidence\": 0.8, \"reason\": \"И двете.\"}");

		assertThat(reply).isEqualTo(new LlmIntentReply(QueryIntent.HYBRID, 0.8, "И двете."));
	}

	@Test
	@DisplayName("Finds the object inside a fenced markdown reply")
	void parsesFencedJson() {
		LlmIntentReply reply = parser.parse("""
				Ето отговора:
				```json
				{"intent": "SQL", "confidence": 0.9, "reason": "Статистика."}
				```
				""");

		assertThat(reply.intent()).isEqualTo(QueryIntent.SQL);
		assertThat(reply.confidence()).isEqualTo(0.9);
	}

	@Test
	void unknownIntentBecomesRag() {
		LlmIntentReply reply = parser.parse("{\"intent\": \"table\", \"confidence\": 0.9, \"reason\": \"x\"}");

		assertThat(reply.intent()).isEqualTo(QueryIntent.RAG);
	}

	@Test
	void confidenceIsClamped() {
		assertThat(parser.parse("{\"intent\": \"sql\", \"confidence\": 1.7, \"reason\": \"x\"}").confidence())
				.isEqualTo(1.0);
		assertThat(parser.parse("{\"intent\": \"sql\", \"confidence\": -2, \"reason\": \"x\"}").confidence())
				.isEqualTo(0.0);
	}

	@Test
	void missingFieldsGetDefaults() {
		LlmIntentReply reply = parser.parse("{\"intent\": \"rag\"}");

		assertThat(reply.confidence()).isEqualTo(LlmIntentResponseParser.DEFAULT_CONFIDENCE);
		assertThat(reply.reason()).isEqualTo(LlmIntentResponseParser.MISSING_REASON);
	}

	@Test
	@DisplayName("Truncated JSON is read field by field")
	void truncatedJson() {
		LlmIntentReply reply = parser.parse("{\"intent\": \"hybrid\", \"confidence\": 0.7, \"reason\": \"и двете\"");

		assertThat(reply).isEqualTo(new LlmIntentReply(QueryIntent.HYBRID, 0.7, "и двете"));
	}

	@Test
	void freeTextDegradesToDefaults() {
		LlmIntentReply reply = parser.parse("no json here");

		assertThat(reply).isEqualTo(new LlmIntentReply(QueryIntent.RAG, 0.5, LlmIntentResponseParser.UNPARSEABLE_REASON));
	}

	@Test
	void nullReply() {
		assertThat(parser.parse(null).intent()).isEqualTo(QueryIntent.RAG);
	}
}
