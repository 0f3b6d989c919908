package org.javai.chitalishta.sql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one {@code SQL_QUERY_AUDIT} record per guarded statement: {@code info} when the
 * statement was accepted, {@code warn} when it was rejected.
 */
public class SqlAuditLogger {

	private static final int MAX_QUESTION_LENGTH = 200;

	private final Logger logger;
	private final boolean enabled;

	public SqlAuditLogger() {
		this(true);
	}

	public SqlAuditLogger(boolean enabled) {
		this.logger = LoggerFactory.getLogger(SqlAuditLogger.class);
		this.enabled = enabled;
	}

	public static SqlAuditLogger disabled() {
		return new SqlAuditLogger(false);
	}

	public boolean isEnabled() {
		return enabled;
	}

	public void logGuarded(String userQuestion, String generatedSql, GuardedSql result) {
		if (!enabled) {
			return;
		}
		if (result.accepted()) {
			if (!logger.isInfoEnabled()) {
				return;
			}
			logger.info("SQL_QUERY_AUDIT outcome=ACCEPTED question='{}' generated='{}' final='{}' passes={}",
					summarize(userQuestion, MAX_QUESTION_LENGTH),
					normalize(generatedSql),
					result.sql(),
					result.rewrite().appliedPasses());
			return;
		}
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("SQL_QUERY_AUDIT outcome=REJECTED question='{}' generated='{}' category={} reason='{}' passes={}",
				summarize(userQuestion, MAX_QUESTION_LENGTH),
				normalize(generatedSql),
				result.errorCategory(),
				result.validation().message(),
				result.rewrite().appliedPasses());
	}

	private static String normalize(String text) {
		if (text == null || text.isBlank()) {
			return "";
		}
		return text.replaceAll("\\s+", " ").trim();
	}

	private static String summarize(String text, int maxLength) {
		String normalized = normalize(text);
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
