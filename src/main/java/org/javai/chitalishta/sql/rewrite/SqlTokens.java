package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Navigation and editing helpers over a token list produced by {@link SqlTokenizer}.
 */
final class SqlTokens {

	private SqlTokens() {
	}

	/**
	 * Replaces tokens {@code [start, end)} with {@code replacement}; {@code start == end}
	 * inserts before {@code start}.
	 */
	record Edit(int start, int end, String replacement) {
	}

	/**
	 * A possibly qualified column reference such as {@code c.region}.
	 *
	 * @param start index of the first token (the qualifier, if any)
	 * @param end index of the column token
	 * @param qualifier lower-cased table name or alias, or null
	 * @param column lower-cased column name
	 * @param text the reference as written, without trivia
	 */
	record ColumnRef(int start, int end, String qualifier, String column, String text) {
	}

	static String render(List<SqlToken> tokens) {
		return render(tokens, 0, tokens.size());
	}

	static String render(List<SqlToken> tokens, int from, int to) {
		StringBuilder sb = new StringBuilder();
		for (int i = from; i < to; i++) {
			sb.append(tokens.get(i).text());
		}
		return sb.toString();
	}

	/**
	 * Renders a range with leading and trailing trivia dropped and inner trivia collapsed to
	 * single spaces.
	 */
	static String renderCompact(List<SqlToken> tokens, int from, int to) {
		StringBuilder sb = new StringBuilder();
		boolean pendingSpace = false;
		for (int i = from; i < to; i++) {
			SqlToken token = tokens.get(i);
			if (token.isTrivia()) {
				pendingSpace = true;
				continue;
			}
			if (pendingSpace && !sb.isEmpty()) {
				sb.append(' ');
			}
			pendingSpace = false;
			sb.append(token.text());
		}
		return sb.toString();
	}

	static String apply(List<SqlToken> tokens, List<Edit> edits) {
		List<Edit> ordered = new ArrayList<>(edits);
		ordered.sort(Comparator.comparingInt(Edit::start).thenComparingInt(Edit::end));
		StringBuilder sb = new StringBuilder();
		int i = 0;
		for (Edit edit : ordered) {
			if (edit.start() < i) {
				throw new IllegalStateException("Overlapping edits at token " + edit.start());
			}
			sb.append(render(tokens, i, edit.start()));
			sb.append(edit.replacement());
			i = edit.end();
		}
		sb.append(render(tokens, i, tokens.size()));
		return sb.toString();
	}

	/**
	 * @return the index of the first non-trivia token at or after {@code from}, or -1
	 */
	static int next(List<SqlToken> tokens, int from) {
		for (int i = Math.max(from, 0); i < tokens.size(); i++) {
			if (!tokens.get(i).isTrivia()) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * @return the index of the last non-trivia token at or before {@code from}, or -1
	 */
	static int previous(List<SqlToken> tokens, int from) {
		for (int i = Math.min(from, tokens.size() - 1); i >= 0; i--) {
			if (!tokens.get(i).isTrivia()) {
				return i;
			}
		}
		return -1;
	}

	static boolean isKeywordAt(List<SqlToken> tokens, int index, String... keywords) {
		return index >= 0 && index < tokens.size() && tokens.get(index).isKeyword(keywords);
	}

	static boolean isSymbolAt(List<SqlToken> tokens, int index, String symbol) {
		return index >= 0 && index < tokens.size() && tokens.get(index).isSymbol(symbol);
	}

	/**
	 * Parenthesis depth of every token; an opening parenthesis has the depth of its context.
	 */
	static int[] depths(List<SqlToken> tokens) {
		int[] depths = new int[tokens.size()];
		int depth = 0;
		for (int i = 0; i < tokens.size(); i++) {
			SqlToken token = tokens.get(i);
			if (token.isSymbol(")")) {
				depth = Math.max(0, depth - 1);
			}
			depths[i] = depth;
			if (token.isSymbol("(")) {
				depth++;
			}
		}
		return depths;
	}

	static Optional<ColumnRef> columnRefStartingAt(List<SqlToken> tokens, int index) {
		if (!isIdentifier(tokens, index)) {
			return Optional.empty();
		}
		int dot = next(tokens, index + 1);
		if (isSymbolAt(tokens, dot, ".")) {
			int column = next(tokens, dot + 1);
			if (!isIdentifier(tokens, column)) {
				return Optional.empty();
			}
			return Optional.of(ref(tokens, index, column));
		}
		return Optional.of(ref(tokens, index, index));
	}

	static Optional<ColumnRef> columnRefEndingAt(List<SqlToken> tokens, int index) {
		if (!isIdentifier(tokens, index)) {
			return Optional.empty();
		}
		int dot = previous(tokens, index - 1);
		if (isSymbolAt(tokens, dot, ".")) {
			int qualifier = previous(tokens, dot - 1);
			if (!isIdentifier(tokens, qualifier)) {
				return Optional.empty();
			}
			return Optional.of(ref(tokens, qualifier, index));
		}
		return Optional.of(ref(tokens, index, index));
	}

	private static ColumnRef ref(List<SqlToken> tokens, int start, int end) {
		String qualifier = start == end ? null : tokens.get(start).identifier();
		StringBuilder text = new StringBuilder();
		for (int i = start; i <= end; i++) {
			if (!tokens.get(i).isTrivia()) {
				text.append(tokens.get(i).text());
			}
		}
		return new ColumnRef(start, end, qualifier, tokens.get(end).identifier(), text.toString());
	}

	static boolean isIdentifier(List<SqlToken> tokens, int index) {
		if (index < 0 || index >= tokens.size()) {
			return false;
		}
		SqlToken token = tokens.get(index);
		return token.isWord() || token.isType(SqlToken.TokenType.QUOTED);
	}

	/**
	 * @return true if the token at {@code index} is immediately followed by an opening parenthesis
	 */
	static boolean isFunctionCall(List<SqlToken> tokens, int index) {
		return isSymbolAt(tokens, next(tokens, index + 1), "(");
	}
}
