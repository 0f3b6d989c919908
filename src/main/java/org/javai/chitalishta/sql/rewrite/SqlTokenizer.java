package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lossless tokenizer for SQL text.
 *
 * <p>Unlike a parser it never rejects its input: unterminated literals and comments run to the
 * end of the text and unknown characters become single-character symbols. This lets rewrite
 * passes edit identifiers and operators without ever touching the inside of a literal.</p>
 */
public class SqlTokenizer {

	private static final Set<String> TWO_CHAR_SYMBOLS = Set.of("<>", "!=", "<=", ">=", "::", "||");

	private final String input;
	private int pos = 0;

	public SqlTokenizer(String input) {
		this.input = input;
	}

	public static List<SqlToken> tokenize(String input) {
		return new SqlTokenizer(input).tokenize();
	}

	public List<SqlToken> tokenize() {
		List<SqlToken> tokens = new ArrayList<>();
		while (!isAtEnd()) {
			tokens.add(nextToken());
		}
		return tokens;
	}

	private SqlToken nextToken() {
		char c = peek();

		if (Character.isWhitespace(c)) {
			return scanWhitespace();
		}
		if (c == '-' && peekNext() == '-') {
			return scanLineComment();
		}
		if (c == '/' && peekNext() == '*') {
			return scanBlockComment();
		}
		if (c == '\'') {
			return scanQuoted(SqlToken.TokenType.STRING, '\'');
		}
		if (c == '"') {
			return scanQuoted(SqlToken.TokenType.QUOTED, '"');
		}
		if (isDigit(c)) {
			return scanNumber();
		}
		if (isIdentifierStart(c)) {
			return scanWord();
		}
		return scanSymbol();
	}

	private SqlToken scanWhitespace() {
		int start = pos;
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
		return token(SqlToken.TokenType.WHITESPACE, start);
	}

	private SqlToken scanLineComment() {
		int start = pos;
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
		return token(SqlToken.TokenType.COMMENT, start);
	}

	private SqlToken scanBlockComment() {
		int start = pos;
		advance(); // '/'
		advance(); // '*'
		while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
			advance();
		}
		if (!isAtEnd()) {
			advance();
			advance();
		}
		return token(SqlToken.TokenType.COMMENT, start);
	}

	private SqlToken scanQuoted(SqlToken.TokenType type, char quote) {
		int start = pos;
		advance(); // opening quote
		while (!isAtEnd()) {
			char c = advance();
			if (c == quote) {
				if (peek() == quote && !isAtEnd()) {
					advance(); // doubled quote is an escaped quote
				} else {
					break;
				}
			}
		}
		return token(type, start);
	}

	private SqlToken scanNumber() {
		int start = pos;
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
			advance(); // consume '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}
		return token(SqlToken.TokenType.NUMBER, start);
	}

	private SqlToken scanWord() {
		int start = pos;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}
		return token(SqlToken.TokenType.WORD, start);
	}

	private SqlToken scanSymbol() {
		int start = pos;
		if (pos + 1 < input.length() && TWO_CHAR_SYMBOLS.contains(input.substring(pos, pos + 2))) {
			advance();
		}
		advance();
		return token(SqlToken.TokenType.SYMBOL, start);
	}

	private SqlToken token(SqlToken.TokenType type, int start) {
		return new SqlToken(type, input.substring(start, pos), start);
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 >= input.length() ? '\0' : input.charAt(pos + 1);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c) || c == '$';
	}
}
