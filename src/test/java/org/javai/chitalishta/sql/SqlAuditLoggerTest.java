package org.javai.chitalishta.sql;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.logging.log4j.Level;
import org.javai.chitalishta.sql.rewrite.SqlRewriter;
import org.javai.chitalishta.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SqlAuditLoggerTest {

	private static SchemaCatalog catalog;

	@BeforeAll
	static void loadCatalog() {
		catalog = new YamlSchemaCatalogLoader().loadDefault();
	}

	private static SqlGuard guard(SqlAuditLogger auditLogger) {
		return new SqlGuard(catalog, new SqlValidator(), new SqlRewriter(), auditLogger, true);
	}

	@Test
	void acceptedStatementEmitsInfoRecord() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(SqlAuditLogger.class, Level.INFO)) {
			guard(new SqlAuditLogger()).guard("Колко читалища има във Враца?",
					"SELECT COUNT(*)\n  FROM chitalishte WHERE region = 'Враца'");

			assertThat(appender.events())
					.singleElement()
					.satisfies(event -> {
						assertThat(event.getLevel()).isEqualTo(Level.INFO);
						assertThat(event.getMessage().getFormattedMessage())
								.startsWith("SQL_QUERY_AUDIT outcome=ACCEPTED")
								.contains("question='Колко читалища има във Враца?'")
								.contains("generated='SELECT COUNT(*) FROM chitalishte WHERE region = 'Враца''")
								.contains("LOWER(region) = LOWER('Враца')")
								.contains("passes=[sanitize, case-insensitive-comparison]");
					});
		}
	}

	@Test
	void rejectedStatementEmitsWarning() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(SqlAuditLogger.class, Level.INFO)) {
			guard(new SqlAuditLogger()).guard("Изтрий всичко", "DELETE FROM chitalishte");

			assertThat(appender.events())
					.singleElement()
					.satisfies(event -> {
						assertThat(event.getLevel()).isEqualTo(Level.WARN);
						assertThat(event.getMessage().getFormattedMessage())
								.contains("outcome=REJECTED")
								.contains("category=DANGEROUS_KEYWORD");
					});
		}
	}

	@Test
	void longQuestionsAreShortened() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(SqlAuditLogger.class, Level.INFO)) {
			guard(new SqlAuditLogger()).guard("а".repeat(500), "SELECT 1");

			assertThat(appender.messages()).singleElement()
					.satisfies(message -> assertThat(message).contains("а".repeat(197) + "..."));
		}
	}

	@Test
	void disabledLoggerStaysSilent() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(SqlAuditLogger.class, Level.DEBUG)) {
			guard(SqlAuditLogger.disabled()).guard("Изтрий всичко", "DELETE FROM chitalishte");

			assertThat(appender.events()).isEmpty();
		}
	}
}
