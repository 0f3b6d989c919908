package org.javai.chitalishta.sql.rewrite;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.chitalishta.sql.rewrite.SqlToken.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SqlTokenizer")
class SqlTokenizerTest {

	private static List<SqlToken> significant(String sql) {
		return SqlTokenizer.tokenize(sql).stream().filter(t -> !t.isTrivia()).toList();
	}

	@Test
	@DisplayName("Concatenated tokens reproduce the input")
	void lossless() {
		String sql = "SELECT c.name, 'it''s -- not a comment'\n  FROM chitalishte c /* block */ WHERE x <> 1.5 -- tail";

		assertThat(SqlTokens.render(SqlTokenizer.tokenize(sql))).isEqualTo(sql);
	}

	@Test
	void literalsKeepCommentMarkersAndKeywords() {
		List<SqlToken> tokens = significant("SELECT 'DROP -- x' AS label");

		assertThat(tokens).extracting(SqlToken::type)
				.containsExactly(TokenType.WORD, TokenType.STRING, TokenType.WORD, TokenType.WORD);
		assertThat(tokens.get(1).unquoted()).isEqualTo("DROP -- x");
	}

	@Test
	void commentsAreTrivia() {
		List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT /* a */ 1 -- b");

		assertThat(tokens).filteredOn(t -> t.isType(TokenType.COMMENT))
				.extracting(SqlToken::text)
				.containsExactly("/* a */", "-- b");
	}

	@Test
	void cyrillicWordsAndTwoCharSymbols() {
		List<SqlToken> tokens = significant("град != 'Враца' OR x::text || y >= 2");

		assertThat(tokens).extracting(SqlToken::text)
				.containsExactly("град", "!=", "'Враца'", "OR", "x", "::", "text", "||", "y", ">=", "2");
		assertThat(tokens.get(0).isWord()).isTrue();
	}

	@Test
	@DisplayName("Unterminated literal runs to the end of the input")
	void unterminatedLiteral() {
		List<SqlToken> tokens = significant("SELECT 'open");

		assertThat(tokens).hasSize(2);
		assertThat(tokens.get(1).type()).isEqualTo(TokenType.STRING);
		assertThat(tokens.get(1).text()).isEqualTo("'open");
	}

	@Test
	void quotedIdentifierHelpers() {
		SqlToken quoted = significant("\"Region\"").get(0);

		assertThat(quoted.type()).isEqualTo(TokenType.QUOTED);
		assertThat(quoted.identifier()).isEqualTo("region");
		assertThat(quoted.asStringLiteral()).isEqualTo("'Region'");
	}

	@Test
	void doubleQuotedValueBecomesEscapedStringLiteral() {
		SqlToken quoted = significant("\"O'Neil\"").get(0);

		assertThat(quoted.asStringLiteral()).isEqualTo("'O''Neil'");
	}

	@Test
	void positionsPointIntoInput() {
		List<SqlToken> tokens = significant("SELECT  id");

		assertThat(tokens.get(1).position()).isEqualTo(8);
	}
}
