package org.javai.chitalishta.sql;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-only policy check for SQL text produced by an LLM.
 *
 * <p>Checks run in a fixed order and the first failure is reported:</p>
 * <ol>
 *   <li>empty or blank text</li>
 *   <li>any data-modifying or privileged keyword as a whole word</li>
 *   <li>statement not starting with {@code SELECT} or {@code WITH}</li>
 *   <li>more than one {@code ;}</li>
 *   <li>more than two {@code --} or more than one {@code /*}</li>
 *   <li>a known hallucinated column name as a whole word</li>
 * </ol>
 *
 * <p>This is a text-level heuristic, not a parser: it never resolves columns in general and
 * never executes anything.</p>
 */
public class SqlValidator {

	public static final List<String> DANGEROUS_KEYWORDS = List.of(
			"DELETE", "DROP", "TRUNCATE", "ALTER", "CREATE", "INSERT", "UPDATE",
			"GRANT", "REVOKE", "EXEC", "EXECUTE");

	private static final Map<String, Pattern> DANGEROUS_PATTERNS = DANGEROUS_KEYWORDS.stream()
			.collect(Collectors.toMap(k -> k, SqlValidator::wholeWord, (a, b) -> a, LinkedHashMap::new));

	private static final Pattern ALLOWED_START = Pattern.compile("^(SELECT|WITH)(?![A-Z0-9_])");

	private static final int MAX_SEMICOLONS = 1;
	private static final int MAX_LINE_COMMENTS = 2;
	private static final int MAX_BLOCK_COMMENTS = 1;

	public SqlValidationResult validate(String sql, SchemaCatalog catalog) {
		Objects.requireNonNull(catalog, "catalog must not be null");
		if (sql == null || sql.isBlank()) {
			return SqlValidationResult.rejected(SqlErrorCategory.EMPTY_QUERY, "Empty SQL query");
		}

		String upper = sql.strip().toUpperCase(Locale.ROOT);

		for (Map.Entry<String, Pattern> entry : DANGEROUS_PATTERNS.entrySet()) {
			if (entry.getValue().matcher(upper).find()) {
				return SqlValidationResult.rejected(SqlErrorCategory.DANGEROUS_KEYWORD,
						"Dangerous SQL keyword detected: " + entry.getKey() + ". Only SELECT queries are allowed.");
			}
		}

		if (!ALLOWED_START.matcher(upper).find()) {
			return SqlValidationResult.rejected(SqlErrorCategory.DISALLOWED_START,
					"Query must start with SELECT or WITH (for CTEs). Only read operations are allowed.");
		}

		if (count(sql, ";") > MAX_SEMICOLONS) {
			return SqlValidationResult.rejected(SqlErrorCategory.INJECTION_SEMICOLONS,
					"Multiple semicolons detected. Possible SQL injection attempt.");
		}

		if (count(sql, "--") > MAX_LINE_COMMENTS || count(sql, "/*") > MAX_BLOCK_COMMENTS) {
			return SqlValidationResult.rejected(SqlErrorCategory.INJECTION_COMMENTS,
					"Excessive comments detected. Possible SQL injection attempt.");
		}

		List<String> wrongNames = new ArrayList<>();
		List<String> hints = new ArrayList<>();
		for (Map.Entry<String, String> correction : catalog.columnCorrections().entrySet()) {
			if (wholeWord(correction.getKey()).matcher(sql).find()) {
				wrongNames.add(correction.getKey());
				hints.add(correction.getKey() + " -> " + correction.getValue());
			}
		}
		if (!wrongNames.isEmpty()) {
			return SqlValidationResult.invalidColumns(wrongNames,
					"Invalid column name(s): " + String.join(", ", hints));
		}

		return SqlValidationResult.ok();
	}

	private static Pattern wholeWord(String word) {
		return Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(word) + "(?![A-Za-z0-9_])", Pattern.CASE_INSENSITIVE);
	}

	private static int count(String text, String token) {
		int count = 0;
		int index = text.indexOf(token);
		while (index >= 0) {
			count++;
			index = text.indexOf(token, index + token.length());
		}
		return count;
	}
}
