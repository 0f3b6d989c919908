package org.javai.chitalishta.sql.rewrite;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;

/**
 * Checks, with JSqlParser, that a rewrite did not turn a parseable SELECT into something else.
 *
 * <p>Statements JSqlParser cannot parse (dialect features it does not know) are not judged:
 * a pass is only reverted when its input parsed as a SELECT and its output does not.</p>
 */
public class SelectStatementVerifier {

	public enum Shape {
		SELECT,
		OTHER_STATEMENT,
		UNPARSEABLE
	}

	private static final SelectStatementVerifier DISABLED = new SelectStatementVerifier(false);

	private final boolean enabled;

	public SelectStatementVerifier() {
		this(true);
	}

	private SelectStatementVerifier(boolean enabled) {
		this.enabled = enabled;
	}

	/**
	 * @return a verifier that accepts every rewrite
	 */
	public static SelectStatementVerifier disabled() {
		return DISABLED;
	}

	public Shape shapeOf(String sql) {
		Statement stmt;
		try {
			stmt = CCJSqlParserUtil.parse(sql);
		} catch (JSQLParserException | RuntimeException e) {
			return Shape.UNPARSEABLE;
		}
		return stmt instanceof Select ? Shape.SELECT : Shape.OTHER_STATEMENT;
	}

	/**
	 * @return true if {@code before} is a SELECT and {@code after} no longer is
	 */
	public boolean breaksSelect(String before, String after) {
		if (!enabled) {
			return false;
		}
		return shapeOf(before) == Shape.SELECT && shapeOf(after) != Shape.SELECT;
	}
}
