package org.javai.chitalishta.sql.rewrite;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link SqlRewriter#rewrite}. Rewriting never fails; at worst {@code sql} is the
 * input unchanged and {@code appliedPasses} is empty.
 *
 * @param sql the rewritten SQL
 * @param appliedPasses names of the passes that changed the text, in pipeline order
 */
public record RewriteResult(String sql, List<String> appliedPasses) {

	public RewriteResult {
		Objects.requireNonNull(sql, "sql must not be null");
		appliedPasses = appliedPasses == null ? List.of() : List.copyOf(appliedPasses);
	}

	public boolean changed() {
		return !appliedPasses.isEmpty();
	}

	public boolean applied(String passName) {
		return appliedPasses.contains(passName);
	}
}
