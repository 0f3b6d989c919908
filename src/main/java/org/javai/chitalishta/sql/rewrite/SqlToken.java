package org.javai.chitalishta.sql.rewrite;

import java.util.Locale;

/**
 * A lexical token of SQL text. Concatenating the {@code text} of every token produced by
 * {@link SqlTokenizer} reproduces the input exactly.
 *
 * @param type the token type
 * @param text the exact source text of the token, including quotes for literals
 * @param position the character position in the input string
 */
public record SqlToken(TokenType type, String text, int position) {

	public enum TokenType {
		WORD,              // keywords, identifiers, function names
		QUOTED,            // "double quoted"
		STRING,            // 'single quoted'
		NUMBER,            // integers and decimals
		SYMBOL,            // operators and punctuation
		WHITESPACE,
		COMMENT            // -- line and /* block */ comments
	}

	@Override
	public String toString() {
		return type + "(" + text + ")";
	}

	public boolean isType(TokenType expectedType) {
		return type == expectedType;
	}

	/**
	 * @return true for whitespace and comments
	 */
	public boolean isTrivia() {
		return type == TokenType.WHITESPACE || type == TokenType.COMMENT;
	}

	public boolean isWord() {
		return type == TokenType.WORD;
	}

	/**
	 * @return true if this is a word equal (ignoring case) to any of the given keywords
	 */
	public boolean isKeyword(String... keywords) {
		if (type != TokenType.WORD) {
			return false;
		}
		for (String keyword : keywords) {
			if (text.equalsIgnoreCase(keyword)) {
				return true;
			}
		}
		return false;
	}

	public boolean isSymbol(String symbol) {
		return type == TokenType.SYMBOL && text.equals(symbol);
	}

	/**
	 * @return true for single- or double-quoted text, either of which an LLM may use as a value
	 */
	public boolean isQuotedValue() {
		return type == TokenType.STRING || type == TokenType.QUOTED;
	}

	/**
	 * @return the lower-cased identifier for words and quoted identifiers, otherwise the raw text
	 */
	public String identifier() {
		return switch (type) {
			case WORD -> text.toLowerCase(Locale.ROOT);
			case QUOTED -> unquote(text, '"').toLowerCase(Locale.ROOT);
			default -> text;
		};
	}

	/**
	 * @return the unescaped content of a quoted token
	 */
	public String unquoted() {
		return switch (type) {
			case STRING -> unquote(text, '\'');
			case QUOTED -> unquote(text, '"');
			default -> text;
		};
	}

	/**
	 * @return this value as a single-quoted SQL string literal
	 */
	public String asStringLiteral() {
		if (type == TokenType.STRING) {
			return text;
		}
		return "'" + unquoted().replace("'", "''") + "'";
	}

	private static String unquote(String quoted, char quote) {
		int end = quoted.length() > 1 && quoted.charAt(quoted.length() - 1) == quote
				? quoted.length() - 1
				: quoted.length();
		String body = quoted.substring(1, end);
		String doubled = String.valueOf(quote) + quote;
		return body.replace(doubled, String.valueOf(quote));
	}
}
