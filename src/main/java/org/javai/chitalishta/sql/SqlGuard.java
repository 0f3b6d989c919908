package org.javai.chitalishta.sql;

import java.util.Objects;
import org.javai.chitalishta.sql.rewrite.RewriteResult;
import org.javai.chitalishta.sql.rewrite.SqlRewriter;

/**
 * Single entry point for LLM-generated SQL: validate, rewrite, validate again.
 *
 * <p>SQL rejected by the first validation is never rewritten, except for
 * {@link SqlErrorCategory#INVALID_COLUMN} when column auto-correction is enabled: known
 * hallucinated column names are corrected by the rewriter and the result is validated again.</p>
 *
 * <pre>{@code
 * SqlGuard guard = new SqlGuard(new YamlSchemaCatalogLoader().loadDefault());
 * GuardedSql guarded = guard.guard(question, generatedSql);
 * if (guarded.accepted()) {
 *     execute(guarded.sql());
 * }
 * }</pre>
 */
public class SqlGuard {

	private final SchemaCatalog catalog;
	private final SqlValidator validator;
	private final SqlRewriter rewriter;
	private final SqlAuditLogger auditLogger;
	private final boolean autoCorrectColumns;

	public SqlGuard(SchemaCatalog catalog) {
		this(catalog, new SqlValidator(), new SqlRewriter(), new SqlAuditLogger(), true);
	}

	public SqlGuard(SchemaCatalog catalog, SqlValidator validator, SqlRewriter rewriter,
			SqlAuditLogger auditLogger, boolean autoCorrectColumns) {
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.rewriter = Objects.requireNonNull(rewriter, "rewriter must not be null");
		this.auditLogger = Objects.requireNonNull(auditLogger, "auditLogger must not be null");
		this.autoCorrectColumns = autoCorrectColumns;
	}

	public SchemaCatalog catalog() {
		return catalog;
	}

	public GuardedSql guard(String sql) {
		return guard(null, sql);
	}

	/**
	 * @param userQuestion the question the SQL answers, for the audit log (may be null)
	 * @param sql the generated SQL
	 */
	public GuardedSql guard(String userQuestion, String sql) {
		GuardedSql result = evaluate(sql);
		auditLogger.logGuarded(userQuestion, sql, result);
		return result;
	}

	private GuardedSql evaluate(String sql) {
		SqlValidationResult validation = validator.validate(sql, catalog);
		boolean correctable = validation.errorCategory() == SqlErrorCategory.INVALID_COLUMN && autoCorrectColumns;
		if (!validation.valid() && !correctable) {
			return GuardedSql.rejected(sql, validation);
		}
		RewriteResult rewrite = rewriter.rewrite(sql, catalog);
		SqlValidationResult revalidation = validator.validate(rewrite.sql(), catalog);
		return new GuardedSql(revalidation.valid(), rewrite.sql(), revalidation, rewrite);
	}
}
