package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.chitalishta.sql.SchemaCatalog;
import org.javai.chitalishta.sql.rewrite.SqlTokens.Edit;

/**
 * Repairs pattern matches compared against a boolean literal:
 * {@code col ILIKE 'X' = false} becomes {@code col NOT ILIKE 'X'} and
 * {@code col ILIKE 'X' = true} becomes {@code col ILIKE 'X'}. The same applies to {@code LIKE}
 * and to an already negated operator.
 */
public class NegationRepairPass implements RewritePass {

	public static final String NAME = "negation-repair";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String apply(String sql, SchemaCatalog catalog) {
		List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
		List<Edit> edits = new ArrayList<>();
		for (int i = 0; i < tokens.size(); i++) {
			if (!tokens.get(i).isKeyword("LIKE", "ILIKE")) {
				continue;
			}
			int literal = SqlTokens.next(tokens, i + 1);
			int equals = SqlTokens.next(tokens, literal + 1);
			int bool = SqlTokens.next(tokens, equals + 1);
			if (literal < 0 || !tokens.get(literal).isQuotedValue()
					|| !SqlTokens.isSymbolAt(tokens, equals, "=")
					|| !SqlTokens.isKeywordAt(tokens, bool, "TRUE", "FALSE")) {
				continue;
			}
			int start = i;
			boolean negated = false;
			int not = SqlTokens.previous(tokens, i - 1);
			if (SqlTokens.isKeywordAt(tokens, not, "NOT")) {
				start = not;
				negated = true;
			}
			if (tokens.get(bool).isKeyword("FALSE")) {
				negated = !negated;
			}
			String operator = tokens.get(i).text().toUpperCase(Locale.ROOT);
			edits.add(new Edit(start, bool + 1,
					(negated ? "NOT " : "") + operator + " " + tokens.get(literal).asStringLiteral()));
			i = bool;
		}
		return edits.isEmpty() ? sql : SqlTokens.apply(tokens, edits);
	}
}
