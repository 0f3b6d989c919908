package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.chitalishta.sql.SchemaCatalog;
import org.javai.chitalishta.sql.rewrite.SqlTokens.ColumnRef;
import org.javai.chitalishta.sql.rewrite.SqlTokens.Edit;

/**
 * Turns comparisons against composite text columns (values such as {@code "гр. Враца"}) into
 * case-insensitive substring matches.
 *
 * <ul>
 *   <li>{@code town = 'X'} and {@code LOWER(town) = LOWER('X')} become {@code town ILIKE '%X%'}</li>
 *   <li>{@code town != 'X'} and {@code town <> 'X'} become {@code town NOT ILIKE '%X%'}</li>
 *   <li>{@code town LIKE 'X'} becomes {@code town ILIKE '%X%'}</li>
 * </ul>
 *
 * <p>A pattern that already contains {@code %} keeps its wildcards as written.</p>
 */
public class CompositeColumnPass implements RewritePass {

	public static final String NAME = "composite-column";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String apply(String sql, SchemaCatalog catalog) {
		if (catalog.compositeColumns().isEmpty()) {
			return sql;
		}
		List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
		List<Edit> edits = new ArrayList<>();
		for (int i = 0; i < tokens.size(); i++) {
			if (!SqlTokens.isIdentifier(tokens, i) || !catalog.isCompositeTextColumn(tokens.get(i).identifier())) {
				continue;
			}
			Optional<Match> match = matchAt(tokens, i);
			if (match.isEmpty()) {
				continue;
			}
			Match m = match.get();
			String replacement = m.ref().text() + (m.negated() ? " NOT ILIKE " : " ILIKE ") + m.pattern();
			if (!replacement.equals(SqlTokens.renderCompact(tokens, m.start(), m.end()))) {
				edits.add(new Edit(m.start(), m.end(), replacement));
			}
			i = m.end() - 1;
		}
		return edits.isEmpty() ? sql : SqlTokens.apply(tokens, edits);
	}

	private record Match(int start, int end, ColumnRef ref, boolean negated, String pattern) {
	}

	private static Optional<Match> matchAt(List<SqlToken> tokens, int column) {
		Optional<ColumnRef> found = SqlTokens.columnRefEndingAt(tokens, column);
		if (found.isEmpty()) {
			return Optional.empty();
		}
		ColumnRef ref = found.get();
		int start = ref.start();
		int afterRef = SqlTokens.next(tokens, column + 1);
		if (SqlTokens.isSymbolAt(tokens, afterRef, ".")) {
			return Optional.empty();
		}

		boolean wrapped = false;
		int open = SqlTokens.previous(tokens, ref.start() - 1);
		int function = SqlTokens.previous(tokens, open - 1);
		if (SqlTokens.isSymbolAt(tokens, open, "(") && SqlTokens.isKeywordAt(tokens, function, "LOWER", "UPPER")
				&& SqlTokens.isSymbolAt(tokens, afterRef, ")")) {
			wrapped = true;
			start = function;
			afterRef = SqlTokens.next(tokens, afterRef + 1);
		}
		if (afterRef < 0) {
			return Optional.empty();
		}

		SqlToken operator = tokens.get(afterRef);
		int literal;
		int end;
		boolean negated;
		if (operator.isSymbol("=") || operator.isSymbol("!=") || operator.isSymbol("<>")) {
			negated = !operator.isSymbol("=");
			int rhs = SqlTokens.next(tokens, afterRef + 1);
			if (rhs >= 0 && tokens.get(rhs).isQuotedValue()) {
				literal = rhs;
				end = rhs + 1;
			} else {
				int rhsOpen = SqlTokens.next(tokens, rhs + 1);
				int rhsLiteral = SqlTokens.next(tokens, rhsOpen + 1);
				int rhsClose = SqlTokens.next(tokens, rhsLiteral + 1);
				if (!SqlTokens.isKeywordAt(tokens, rhs, "LOWER", "UPPER")
						|| !SqlTokens.isSymbolAt(tokens, rhsOpen, "(")
						|| rhsLiteral < 0 || !tokens.get(rhsLiteral).isQuotedValue()
						|| !SqlTokens.isSymbolAt(tokens, rhsClose, ")")) {
					return Optional.empty();
				}
				literal = rhsLiteral;
				end = rhsClose + 1;
			}
		} else {
			int like = afterRef;
			negated = false;
			if (operator.isKeyword("NOT")) {
				negated = true;
				like = SqlTokens.next(tokens, afterRef + 1);
			}
			if (wrapped || !SqlTokens.isKeywordAt(tokens, like, "LIKE", "ILIKE")) {
				return Optional.empty();
			}
			literal = SqlTokens.next(tokens, like + 1);
			if (literal < 0 || !tokens.get(literal).isQuotedValue()) {
				return Optional.empty();
			}
			end = literal + 1;
		}

		String value = tokens.get(literal).unquoted();
		if (value.isEmpty()) {
			return Optional.empty();
		}
		String pattern = value.contains("%")
				? tokens.get(literal).asStringLiteral()
				: "'%" + value.replace("'", "''") + "%'";
		return Optional.of(new Match(start, end, ref, negated, pattern));
	}
}
