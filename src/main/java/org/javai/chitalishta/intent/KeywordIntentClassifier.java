package org.javai.chitalishta.intent;

import static org.javai.chitalishta.intent.Explanations.percent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic rule-based classifier using keyword matching.
 *
 * <p>A keyword matches when it occurs as a substring of the lower-cased, trimmed query.
 * Each family (SQL, RAG) is scored by the number of distinct keywords matched, damped by
 * query length:</p>
 *
 * <pre>
 * matchScore   = min(1.0, matched / 3.0)
 * lengthFactor = 1.0 (≤3 words), 0.9 (≤6), 0.8 (≤10), 0.7 (&gt;10)
 * score        = matchScore * lengthFactor
 * </pre>
 *
 * <p>Confidence never exceeds {@value #MAX_CONFIDENCE}, leaving headroom for an external
 * classifier to win a disagreement in {@link HybridRouter}.</p>
 */
public class KeywordIntentClassifier implements IntentClassifier {

	private static final Logger logger = LoggerFactory.getLogger(KeywordIntentClassifier.class);

	static final double MAX_CONFIDENCE = 0.95;
	static final double MAX_HYBRID_CONFIDENCE = 0.9;
	static final double NO_MATCH_CONFIDENCE = 0.3;
	static final double CLOSE_SCORE_MARGIN = 0.2;

	private static final int MAX_SQL_SIGNALS = 3;
	private static final int MAX_SIGNALS = 6;

	private final KeywordLexicon lexicon;

	public KeywordIntentClassifier() {
		this(KeywordLexicon.bulgarian());
	}

	public KeywordIntentClassifier(KeywordLexicon lexicon) {
		this.lexicon = Objects.requireNonNull(lexicon, "lexicon must not be null");
	}

	public KeywordLexicon lexicon() {
		return lexicon;
	}

	@Override
	public ClassificationResult classify(String query) {
		Objects.requireNonNull(query, "query must not be null");
		String normalized = query.toLowerCase(Locale.ROOT).strip();

		if (normalized.isEmpty()) {
			return new ClassificationResult(QueryIntent.RAG, 0.0,
					"Празна заявка - използва се RAG по подразбиране");
		}

		List<String> sqlMatches = matches(normalized, lexicon.sqlKeywords());
		List<String> ragMatches = matches(normalized, lexicon.ragKeywords());
		boolean hasConnective = !matches(normalized, lexicon.hybridConnectives()).isEmpty();

		int wordCount = normalized.split("\\s+").length;
		double sqlScore = score(sqlMatches.size(), wordCount);
		double ragScore = score(ragMatches.size(), wordCount);

		ClassificationResult result = decide(sqlMatches, ragMatches, hasConnective, sqlScore, ragScore);
		logger.debug("Keyword classification: intent={} confidence={} sqlMatches={} ragMatches={} connective={}",
				result.intent(), result.confidence(), sqlMatches.size(), ragMatches.size(), hasConnective);
		return result;
	}

	private ClassificationResult decide(List<String> sqlMatches, List<String> ragMatches,
			boolean hasConnective, double sqlScore, double ragScore) {
		int sqlCount = sqlMatches.size();
		int ragCount = ragMatches.size();

		if (hasConnective && sqlCount > 0 && ragCount > 0) {
			return result(QueryIntent.HYBRID,
					Math.min(MAX_HYBRID_CONFIDENCE, (sqlScore + ragScore) / 2),
					signals(sqlMatches, ragMatches),
					"Открити са индикатори за хибридна заявка: %d SQL ключови думи и %d RAG ключови думи"
							.formatted(sqlCount, ragCount));
		}

		if (sqlCount > 0 && ragCount == 0) {
			return result(QueryIntent.SQL, sqlScore, signals(sqlMatches, List.of()),
					"Открити са само SQL ключови думи (%d, увереност: %s)"
							.formatted(sqlCount, percent(capped(sqlScore))));
		}

		if (ragCount > 0 && sqlCount == 0) {
			return result(QueryIntent.RAG, ragScore, signals(List.of(), ragMatches),
					"Открити са само RAG ключови думи (%d, увереност: %s)"
							.formatted(ragCount, percent(capped(ragScore))));
		}

		if (sqlCount > 0) {
			List<String> evidence = signals(sqlMatches, ragMatches);
			if (Math.abs(sqlScore - ragScore) < CLOSE_SCORE_MARGIN) {
				return result(QueryIntent.HYBRID, (sqlScore + ragScore) / 2, evidence,
						"Открити са и SQL (%d) и RAG (%d) ключови думи с близки резултати - използва се хибриден режим"
								.formatted(sqlCount, ragCount));
			}
			if (sqlScore > ragScore) {
				return result(QueryIntent.SQL, sqlScore, evidence,
						"Открити са и SQL и RAG ключови думи, но SQL има по-висок резултат (%s)"
								.formatted(percent(sqlScore)));
			}
			return result(QueryIntent.RAG, ragScore, evidence,
					"Открити са и SQL и RAG ключови думи, но RAG има по-висок резултат (%s)"
							.formatted(percent(ragScore)));
		}

		return result(QueryIntent.RAG, NO_MATCH_CONFIDENCE, List.of(),
				"Не са открити специфични ключови думи - използва се RAG по подразбиране с ниска увереност");
	}

	private static ClassificationResult result(QueryIntent intent, double confidence, List<String> signals,
			String explanation) {
		return new ClassificationResult(intent, capped(confidence), signals, explanation);
	}

	private static double capped(double confidence) {
		return Math.min(confidence, MAX_CONFIDENCE);
	}

	/**
	 * Distinct keywords contained in the query, in lexicon order.
	 */
	private static List<String> matches(String normalizedQuery, List<String> keywords) {
		List<String> matched = new ArrayList<>();
		for (String keyword : keywords) {
			if (normalizedQuery.contains(keyword)) {
				matched.add(keyword);
			}
		}
		return matched;
	}

	private static List<String> signals(List<String> sqlMatches, List<String> ragMatches) {
		List<String> signals = new ArrayList<>();
		for (String keyword : sqlMatches) {
			if (signals.size() >= MAX_SQL_SIGNALS) {
				break;
			}
			signals.add("SQL: " + keyword);
		}
		for (String keyword : ragMatches) {
			if (signals.size() >= MAX_SIGNALS) {
				break;
			}
			signals.add("RAG: " + keyword);
		}
		return signals;
	}

	static double score(int matchedCount, int wordCount) {
		if (matchedCount == 0) {
			return 0.0;
		}
		double matchScore = Math.min(1.0, matchedCount / 3.0);
		return matchScore * lengthFactor(wordCount);
	}

	static double lengthFactor(int wordCount) {
		if (wordCount <= 3) {
			return 1.0;
		}
		if (wordCount <= 6) {
			return 0.9;
		}
		if (wordCount <= 10) {
			return 0.8;
		}
		return 0.7;
	}
}
