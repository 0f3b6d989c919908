package org.javai.chitalishta.sql.rewrite;

import java.util.List;
import org.javai.chitalishta.sql.SchemaCatalog;

/**
 * Removes comments, collapses whitespace outside literals to single spaces and drops
 * trailing semicolons.
 */
public class SanitizePass implements RewritePass {

	public static final String NAME = "sanitize";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String apply(String sql, SchemaCatalog catalog) {
		List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
		int end = tokens.size();
		int last = SqlTokens.previous(tokens, end - 1);
		while (last >= 0 && tokens.get(last).isSymbol(";")) {
			end = last;
			last = SqlTokens.previous(tokens, last - 1);
		}
		return SqlTokens.renderCompact(tokens, 0, end);
	}
}
