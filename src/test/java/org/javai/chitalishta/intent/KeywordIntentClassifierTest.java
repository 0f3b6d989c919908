package org.javai.chitalishta.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("KeywordIntentClassifier")
class KeywordIntentClassifierTest {

	private final KeywordIntentClassifier classifier = new KeywordIntentClassifier();

	@Nested
	@DisplayName("Bulgarian lexicon")
	class BulgarianLexicon {

		@Test
		@DisplayName("Three SQL keywords in a short query give SQL at the confidence cap")
		void sqlOnlyQuery() {
			ClassificationResult result = classifier.classify("Колко брой общо");

			assertThat(result.intent()).isEqualTo(QueryIntent.SQL);
			assertThat(result.confidence()).isEqualTo(0.95);
			assertThat(result.matchedSignals()).containsExactly("SQL: колко", "SQL: брой", "SQL: общо");
			assertThat(result.explanation()).contains("само SQL");
		}

		@Test
		@DisplayName("Descriptive request gives RAG")
		void ragOnlyQuery() {
			ClassificationResult result = classifier.classify("Разкажи историята");

			assertThat(result.intent()).isEqualTo(QueryIntent.RAG);
			assertThat(result.confidence()).isEqualTo(0.95);
			assertThat(result.matchedSignals()).contains("RAG: разкажи", "RAG: история");
			assertThat(result.matchedSignals()).noneMatch(s -> s.startsWith("SQL:"));
		}

		@Test
		@DisplayName("Both families joined by a connective give HYBRID at the average score")
		void connectiveMakesHybrid() {
			ClassificationResult result = classifier.classify("Колко читалища има и разкажи за тях");

			// 7 words: sql = 1/3 * 0.8, rag = 2/3 * 0.8
			assertThat(result.intent()).isEqualTo(QueryIntent.HYBRID);
			assertThat(result.confidence()).isCloseTo(0.4, within(1e-9));
			assertThat(result.matchedSignals()).contains("SQL: колко", "RAG: разкажи");
		}

		@Test
		@DisplayName("No keyword falls back to low-confidence RAG")
		void noMatch() {
			ClassificationResult result = classifier.classify("Здравей");

			assertThat(result.intent()).isEqualTo(QueryIntent.RAG);
			assertThat(result.confidence()).isEqualTo(0.3);
			assertThat(result.matchedSignals()).isEmpty();
		}

		@Test
		@DisplayName("Blank query is RAG with zero confidence")
		void blankQuery() {
			ClassificationResult result = classifier.classify("   ");

			assertThat(result.intent()).isEqualTo(QueryIntent.RAG);
			assertThat(result.confidence()).isZero();
			assertThat(result.explanation()).isEqualTo("Празна заявка - използва се RAG по подразбиране");
		}

		@Test
		@DisplayName("Matching ignores case")
		void caseInsensitive() {
			assertThat(classifier.classify("КОЛКО БРОЙ ОБЩО"))
					.isEqualTo(classifier.classify("колко брой общо"));
		}

		@Test
		void nullQueryIsRejected() {
			assertThatThrownBy(() -> classifier.classify(null)).isInstanceOf(NullPointerException.class);
		}
	}

	@Nested
	@DisplayName("Decision rules")
	class DecisionRules {

		private final KeywordIntentClassifier english = new KeywordIntentClassifier(new KeywordLexicon(
				List.of("count", "total"),
				List.of("what"),
				List.of("also")));

		@Test
		@DisplayName("Close scores without a connective give HYBRID")
		void closeScoresGiveHybrid() {
			ClassificationResult result = english.classify("what count");

			assertThat(result.intent()).isEqualTo(QueryIntent.HYBRID);
			assertThat(result.confidence()).isCloseTo(1.0 / 3.0, within(1e-9));
			assertThat(result.matchedSignals()).containsExactly("SQL: count", "RAG: what");
		}

		@Test
		@DisplayName("Distant scores pick the higher family")
		void distantScoresPickHigher() {
			ClassificationResult result = english.classify("what count total");

			assertThat(result.intent()).isEqualTo(QueryIntent.SQL);
			assertThat(result.confidence()).isCloseTo(2.0 / 3.0, within(1e-9));
		}

		@Test
		@DisplayName("Connective with both families takes precedence")
		void connectiveTakesPrecedence() {
			ClassificationResult result = english.classify("what count total also");

			assertThat(result.intent()).isEqualTo(QueryIntent.HYBRID);
			assertThat(result.confidence()).isCloseTo(0.5 * 0.9, within(1e-9));
		}

		@Test
		@DisplayName("Connective alone does not make a query hybrid")
		void connectiveAlone() {
			ClassificationResult result = english.classify("count also");

			assertThat(result.intent()).isEqualTo(QueryIntent.SQL);
		}

		@Test
		@DisplayName("Evidence is limited to three SQL and six signals in total")
		void evidenceIsLimited() {
			KeywordIntentClassifier many = new KeywordIntentClassifier(new KeywordLexicon(
					List.of("a1", "a2", "a3", "a4"),
					List.of("b1", "b2", "b3", "b4"),
					List.of("also")));

			ClassificationResult result = many.classify("a1 a2 a3 a4 b1 b2 b3 b4 also");

			assertThat(result.matchedSignals()).containsExactly(
					"SQL: a1", "SQL: a2", "SQL: a3", "RAG: b1", "RAG: b2", "RAG: b3");
		}
	}

	@Nested
	@DisplayName("Scoring")
	class Scoring {

		@Test
		void lengthFactorSteps() {
			assertThat(KeywordIntentClassifier.lengthFactor(3)).isEqualTo(1.0);
			assertThat(KeywordIntentClassifier.lengthFactor(4)).isEqualTo(0.9);
			assertThat(KeywordIntentClassifier.lengthFactor(6)).isEqualTo(0.9);
			assertThat(KeywordIntentClassifier.lengthFactor(10)).isEqualTo(0.8);
			assertThat(KeywordIntentClassifier.lengthFactor(11)).isEqualTo(0.7);
		}

		@Test
		void scoreSaturatesAtThreeMatches() {
			assertThat(KeywordIntentClassifier.score(0, 2)).isZero();
			assertThat(KeywordIntentClassifier.score(3, 2)).isEqualTo(1.0);
			assertThat(KeywordIntentClassifier.score(5, 12)).isCloseTo(0.7, within(1e-9));
		}

		@Test
		@DisplayName("Confidence never exceeds the cap")
		void confidenceIsCapped() {
			ClassificationResult result = classifier.classify("колко брой общо сума средно");

			assertThat(result.confidence()).isLessThanOrEqualTo(KeywordIntentClassifier.MAX_CONFIDENCE);
		}
	}
}
