package org.javai.chitalishta.sql;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link SqlValidator#validate(String, SchemaCatalog)}.
 *
 * @param valid true if the statement may be rewritten and executed
 * @param errorCategory {@link SqlErrorCategory#NONE} when valid
 * @param message human-readable reason (empty when valid)
 * @param invalidColumns offending column names; non-empty only for {@link SqlErrorCategory#INVALID_COLUMN}
 */
public record SqlValidationResult(
		boolean valid,
		SqlErrorCategory errorCategory,
		String message,
		List<String> invalidColumns
) {

	public SqlValidationResult {
		Objects.requireNonNull(errorCategory, "errorCategory must not be null");
		if (valid != (errorCategory == SqlErrorCategory.NONE)) {
			throw new IllegalArgumentException("valid must be true exactly when errorCategory is NONE");
		}
		invalidColumns = invalidColumns != null ? List.copyOf(invalidColumns) : List.of();
		if (!invalidColumns.isEmpty() && errorCategory != SqlErrorCategory.INVALID_COLUMN) {
			throw new IllegalArgumentException("invalidColumns are only reported for INVALID_COLUMN");
		}
		message = message != null ? message : "";
	}

	public static SqlValidationResult ok() {
		return new SqlValidationResult(true, SqlErrorCategory.NONE, "", List.of());
	}

	public static SqlValidationResult rejected(SqlErrorCategory category, String message) {
		return new SqlValidationResult(false, category, message, List.of());
	}

	public static SqlValidationResult invalidColumns(List<String> columns, String message) {
		return new SqlValidationResult(false, SqlErrorCategory.INVALID_COLUMN, message, columns);
	}
}
