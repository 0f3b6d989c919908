package org.javai.chitalishta.sql;

import java.util.Objects;
import org.javai.chitalishta.sql.rewrite.RewriteResult;

/**
 * Outcome of {@link SqlGuard#guard}.
 *
 * @param accepted true if {@code sql} may be handed to the execution layer
 * @param sql the SQL after rewriting, or as received when rejected before rewriting
 * @param validation the validation of {@code sql}
 * @param rewrite the rewrite that produced {@code sql}; an empty rewrite when rejected up front
 */
public record GuardedSql(
		boolean accepted,
		String sql,
		SqlValidationResult validation,
		RewriteResult rewrite
) {

	public GuardedSql {
		Objects.requireNonNull(validation, "validation must not be null");
		Objects.requireNonNull(rewrite, "rewrite must not be null");
		if (accepted && !validation.valid()) {
			throw new IllegalArgumentException("accepted SQL must have a valid validation result");
		}
	}

	static GuardedSql rejected(String sql, SqlValidationResult validation) {
		return new GuardedSql(false, sql, validation, new RewriteResult(sql == null ? "" : sql, null));
	}

	public SqlErrorCategory errorCategory() {
		return validation.errorCategory();
	}
}
