package org.javai.chitalishta.intent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Keyword lists used by {@link KeywordIntentClassifier}.
 *
 * <p>All entries are stored lower-cased and de-duplicated, preserving first occurrence
 * order, so evidence is always reported in the same order.</p>
 *
 * @param sqlKeywords words and phrases indicating counting, aggregation, ranking or tables
 * @param ragKeywords question words and descriptive requests
 * @param hybridConnectives connectives suggesting the query asks for more than one thing
 */
public record KeywordLexicon(
		List<String> sqlKeywords,
		List<String> ragKeywords,
		List<String> hybridConnectives
) {

	public KeywordLexicon {
		sqlKeywords = normalize(sqlKeywords, "sqlKeywords");
		ragKeywords = normalize(ragKeywords, "ragKeywords");
		hybridConnectives = normalize(hybridConnectives, "hybridConnectives");
	}

	/**
	 * Returns a copy with the SQL keywords replaced.
	 */
	public KeywordLexicon withSqlKeywords(List<String> keywords) {
		return new KeywordLexicon(keywords, ragKeywords, hybridConnectives);
	}

	/**
	 * Returns a copy with the RAG keywords replaced.
	 */
	public KeywordLexicon withRagKeywords(List<String> keywords) {
		return new KeywordLexicon(sqlKeywords, keywords, hybridConnectives);
	}

	/**
	 * Returns a copy with the hybrid connectives replaced.
	 */
	public KeywordLexicon withHybridConnectives(List<String> connectives) {
		return new KeywordLexicon(sqlKeywords, ragKeywords, connectives);
	}

	/**
	 * The Bulgarian lexicon for questions about chitalishta.
	 */
	public static KeywordLexicon bulgarian() {
		return new KeywordLexicon(BULGARIAN_SQL, BULGARIAN_RAG, BULGARIAN_CONNECTIVES);
	}

	private static List<String> normalize(List<String> words, String name) {
		Objects.requireNonNull(words, name + " must not be null");
		LinkedHashSet<String> unique = new LinkedHashSet<>();
		for (String word : words) {
			if (word != null && !word.isBlank()) {
				unique.add(word.strip().toLowerCase(Locale.ROOT));
			}
		}
		return List.copyOf(unique);
	}

	private static final List<String> BULGARIAN_SQL = List.of(
			// counting and aggregation
			"колко", "брой", "броя", "броят", "общо", "общия", "общият",
			"сума", "сумата", "сбор", "сбора",
			// statistical operations
			"средно", "средната", "средният", "средното", "среден",
			"максимум", "максимално", "максималната",
			"минимум", "минимално", "минималната",
			"процент", "процента", "проценти", "процентите",
			// distribution and grouping
			"разпределение", "разпределението", "разпределения",
			"групиране", "групиране по", "по регион", "по град", "по статус", "по година",
			// lists, tables, charts
			"списък", "списъка", "списъци", "таблица", "таблицата", "таблици",
			"графика", "графиката", "графики",
			// ranking and comparison
			"топ", "най-много", "най-малко", "най-голям", "най-голяма", "най-голямо",
			"най-малък", "най-малка", "сравнение", "сравнение между", "сравни",
			// statistical terms
			"статистика", "статистиката", "статистики", "анализ", "анализа", "данни", "данните");

	private static final List<String> BULGARIAN_RAG = List.of(
			// question words
			"какво", "какво е", "какво представлява", "как", "как се", "защо", "защо се",
			"къде", "къде се", "кога", "кога се", "кой", "коя", "кое", "кои",
			// descriptive requests
			"опиши", "описвам", "описание", "описанието", "разкажи", "разказвам", "разказ", "разказа",
			// information requests
			"информация", "информацията", "информация за", "детайли", "детайлите", "детайли за",
			"подробности", "подробностите", "подробности за",
			// context
			"история", "историята", "история на", "история за", "контекст", "контекста", "контекст за",
			"обяснение", "обяснението", "обяснение на", "обясни",
			// general knowledge
			"какво знаеш", "какво знаеш за", "разкажи за", "разкажи ми за",
			"какво можеш да кажеш", "какво можеш да кажеш за");

	private static final List<String> BULGARIAN_CONNECTIVES = List.of(
			"и", "също", "освен това", "допълнително", "плюс", "както и", "включително", "заедно с");
}
