package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.chitalishta.sql.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an ordered pipeline of {@link RewritePass}es over SQL that already passed validation.
 *
 * <p>The default pipeline is: sanitize, column-name correction, case-insensitive text
 * comparison, composite-column matching, negation repair, null-filter injection and fan-out
 * de-duplication. Every pass sees the output of the previous one.</p>
 *
 * <p>A pass that throws, or that turns a parseable SELECT into something that is not one, is
 * reverted: the pipeline continues with that pass's input. The rewriter holds no per-call
 * state and is safe to share between threads.</p>
 */
public class SqlRewriter {

	private static final Logger logger = LoggerFactory.getLogger(SqlRewriter.class);

	private final List<RewritePass> passes;
	private final SelectStatementVerifier verifier;

	public SqlRewriter() {
		this(defaultPasses(), new SelectStatementVerifier());
	}

	public SqlRewriter(List<RewritePass> passes, SelectStatementVerifier verifier) {
		this.passes = List.copyOf(Objects.requireNonNull(passes, "passes must not be null"));
		this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
	}

	public static List<RewritePass> defaultPasses() {
		return List.of(
				new SanitizePass(),
				new ColumnCorrectionPass(),
				new CaseInsensitiveComparisonPass(),
				new CompositeColumnPass(),
				new NegationRepairPass(),
				new NullFilterPass(),
				new FanOutDedupPass());
	}

	public List<RewritePass> passes() {
		return passes;
	}

	/**
	 * Rewrites the SQL.
	 *
	 * @param sql SQL text that passed validation (never null)
	 * @param catalog the schema catalog (never null)
	 * @return the rewritten SQL and the passes that changed it
	 */
	public RewriteResult rewrite(String sql, SchemaCatalog catalog) {
		Objects.requireNonNull(sql, "sql must not be null");
		Objects.requireNonNull(catalog, "catalog must not be null");

		String current = sql;
		List<String> applied = new ArrayList<>();
		for (RewritePass pass : passes) {
			String output;
			try {
				output = pass.apply(current, catalog);
			} catch (RuntimeException e) {
				logger.warn("Rewrite pass '{}' failed and was skipped: {}", pass.name(), e.getMessage(), e);
				continue;
			}
			if (output == null || output.equals(current)) {
				continue;
			}
			if (verifier.breaksSelect(current, output)) {
				logger.warn("Rewrite pass '{}' reverted: output is no longer a valid SELECT: {}", pass.name(), output);
				continue;
			}
			logger.debug("Rewrite pass '{}' applied: {}", pass.name(), output);
			applied.add(pass.name());
			current = output;
		}
		return new RewriteResult(current, applied);
	}
}
