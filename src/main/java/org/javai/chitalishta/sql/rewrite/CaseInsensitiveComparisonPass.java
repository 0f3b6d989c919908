package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.chitalishta.sql.SchemaCatalog;
import org.javai.chitalishta.sql.rewrite.SqlTokens.ColumnRef;
import org.javai.chitalishta.sql.rewrite.SqlTokens.Edit;

/**
 * Rewrites {@code [t.]column = 'value'} into {@code LOWER([t.]column) = LOWER('value')} for
 * catalog text columns. Double-quoted values become single-quoted literals. Composite
 * columns are left to {@link CompositeColumnPass}.
 */
public class CaseInsensitiveComparisonPass implements RewritePass {

	public static final String NAME = "case-insensitive-comparison";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String apply(String sql, SchemaCatalog catalog) {
		List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
		List<Edit> edits = new ArrayList<>();
		for (int i = 0; i < tokens.size(); i++) {
			Optional<Comparison> comparison = comparisonAt(tokens, i, catalog);
			if (comparison.isPresent()) {
				Comparison c = comparison.get();
				edits.add(new Edit(c.ref().start(), c.literal() + 1,
						"LOWER(" + c.ref().text() + ") = LOWER(" + tokens.get(c.literal()).asStringLiteral() + ")"));
				i = c.literal();
			}
		}
		return edits.isEmpty() ? sql : SqlTokens.apply(tokens, edits);
	}

	private record Comparison(ColumnRef ref, int literal) {
	}

	private static Optional<Comparison> comparisonAt(List<SqlToken> tokens, int i, SchemaCatalog catalog) {
		if (!SqlTokens.isIdentifier(tokens, i)) {
			return Optional.empty();
		}
		String column = tokens.get(i).identifier();
		if (!catalog.isTextColumn(column) || catalog.isCompositeTextColumn(column)) {
			return Optional.empty();
		}
		int operator = SqlTokens.next(tokens, i + 1);
		if (!SqlTokens.isSymbolAt(tokens, operator, "=")) {
			return Optional.empty();
		}
		int literal = SqlTokens.next(tokens, operator + 1);
		if (literal < 0 || !tokens.get(literal).isQuotedValue()) {
			return Optional.empty();
		}
		int after = SqlTokens.next(tokens, literal + 1);
		if (SqlTokens.isSymbolAt(tokens, after, "||") || SqlTokens.isSymbolAt(tokens, after, "::")) {
			return Optional.empty();
		}
		Optional<ColumnRef> ref = SqlTokens.columnRefEndingAt(tokens, i);
		if (ref.isEmpty() || SqlTokens.isSymbolAt(tokens, SqlTokens.previous(tokens, ref.get().start() - 1), ".")) {
			return Optional.empty();
		}
		return Optional.of(new Comparison(ref.get(), literal));
	}
}
