package org.javai.chitalishta.sql.rewrite;

import org.javai.chitalishta.sql.SchemaCatalog;

/**
 * One text-level transformation in the {@link SqlRewriter} pipeline.
 *
 * <p>A pass is pure and idempotent: applying it to its own output changes nothing. A pass
 * that cannot confidently apply its transformation returns the input unchanged.</p>
 */
public interface RewritePass {

	/**
	 * @return the stable name recorded in {@link RewriteResult#appliedPasses()}
	 */
	String name();

	String apply(String sql, SchemaCatalog catalog);
}
