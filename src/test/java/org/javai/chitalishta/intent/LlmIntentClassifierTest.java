package org.javai.chitalishta.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

/**
 * All tests use mocked ChatClients - no real LLM calls are made.
 */
class LlmIntentClassifierTest {

	private static ChatClient mockClientReturning(String content) {
		ChatClient client = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(client.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(content);
		return client;
	}

	@Test
	void classifiesFromJsonReply() {
		ChatClient client = mockClientReturning("""
				{"intent": "sql", "confidence": 0.92, "reason": "Заявката иска брой."}
				""");

		ClassificationResult result = new LlmIntentClassifier(client, "gpt-4.1-mini").classify("Колко читалища има?");

		assertThat(result.intent()).isEqualTo(QueryIntent.SQL);
		assertThat(result.confidence()).isEqualTo(0.92);
		assertThat(result.explanation()).isEqualTo("Заявката иска брой.");
		assertThat(result.matchedSignals()).isEmpty();
	}

	@Test
	void blankQueryDoesNotCallModel() {
		ChatClient client = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);

		ClassificationResult result = new LlmIntentClassifier(client).classify("  ");

		assertThat(result.intent()).isEqualTo(QueryIntent.RAG);
		assertThat(result.confidence()).isZero();
		verifyNoInteractions(client);
	}

	@Test
	void unparseableReplyDegradesToRag() {
		ChatClient client = mockClientReturning("I think this is about numbers.");

		ClassificationResult result = new LlmIntentClassifier(client).classify("Колко читалища има?");

		assertThat(result.intent()).isEqualTo(QueryIntent.RAG);
		assertThat(result.confidence()).isEqualTo(LlmIntentResponseParser.DEFAULT_CONFIDENCE);
		assertThat(result.explanation()).isEqualTo(LlmIntentResponseParser.UNPARSEABLE_REASON);
	}

	@Test
	void modelFailureIsWrapped() {
		ChatClient client = mock(ChatClient.class);
		IllegalStateException failure = new IllegalStateException("connection refused");
		when(client.prompt()).thenThrow(failure);

		assertThatThrownBy(() -> new LlmIntentClassifier(client, "gpt-4.1-mini").classify("Колко читалища има?"))
				.isInstanceOf(LlmClassificationException.class)
				.hasMessageContaining("gpt-4.1-mini")
				.hasCause(failure);
	}

	@Test
	void userMessageQuotesQuery() {
		assertThat(LlmIntentClassifier.userMessage("Колко?")).contains("Заявка: \"Колко?\"");
	}
}
