package org.javai.chitalishta.sql.rewrite;

import java.util.List;
import java.util.Optional;
import org.javai.chitalishta.sql.rewrite.SqlTokens.ColumnRef;

/**
 * Helpers for {@code ORDER BY} and select-list items.
 */
final class OrderItems {

	private OrderItems() {
	}

	/**
	 * Recognizes an ordering item that is a bare column reference, optionally followed by
	 * {@code ASC}/{@code DESC} and {@code NULLS FIRST}/{@code NULLS LAST}.
	 */
	static Optional<ColumnRef> plainColumn(List<SqlToken> tokens, int from, int to) {
		int first = SqlTokens.next(tokens, from);
		if (first < 0 || first >= to) {
			return Optional.empty();
		}
		Optional<ColumnRef> ref = SqlTokens.columnRefStartingAt(tokens, first);
		if (ref.isEmpty() || ref.get().end() >= to) {
			return Optional.empty();
		}
		for (int i = SqlTokens.next(tokens, ref.get().end() + 1); i >= 0 && i < to; i = SqlTokens.next(tokens, i + 1)) {
			if (!tokens.get(i).isKeyword("ASC", "DESC", "NULLS", "FIRST", "LAST")) {
				return Optional.empty();
			}
		}
		return ref;
	}

	/**
	 * Recognizes a select-list item that is a bare column reference with an optional alias.
	 */
	static Optional<ColumnRef> selectedColumn(List<SqlToken> tokens, int from, int to) {
		int first = SqlTokens.next(tokens, from);
		if (first < 0 || first >= to) {
			return Optional.empty();
		}
		Optional<ColumnRef> ref = SqlTokens.columnRefStartingAt(tokens, first);
		if (ref.isEmpty() || ref.get().end() >= to) {
			return Optional.empty();
		}
		int next = SqlTokens.next(tokens, ref.get().end() + 1);
		if (next < 0 || next >= to) {
			return ref;
		}
		if (tokens.get(next).isKeyword("AS")) {
			next = SqlTokens.next(tokens, next + 1);
		}
		if (next < 0 || next >= to || !SqlTokens.isIdentifier(tokens, next)) {
			return Optional.empty();
		}
		int after = SqlTokens.next(tokens, next + 1);
		return after < 0 || after >= to ? ref : Optional.empty();
	}
}
