package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.chitalishta.sql.SchemaCatalog;
import org.javai.chitalishta.sql.rewrite.SqlTokens.ColumnRef;

/**
 * Clause positions and table references of the outermost SELECT of a statement.
 *
 * <p>Only plain {@code SELECT ... FROM ...} statements have a layout; statements starting with
 * {@code WITH} or combining queries with {@code UNION}, {@code INTERSECT} or {@code EXCEPT}
 * do not.</p>
 */
final class SelectLayout {

	enum Clause {
		FROM, WHERE, GROUP_BY, HAVING, ORDER_BY, LIMIT, OFFSET, FETCH
	}

	record TableRef(String name, String alias) {

		boolean isReferencedAs(String qualifier) {
			return qualifier.equals(alias) || (alias == null && qualifier.equals(name));
		}

		String referenceName() {
			return alias != null ? alias : name;
		}
	}

	private static final Set<String> NON_ALIAS_WORDS = Set.of(
			"on", "using", "join", "left", "right", "inner", "full", "cross", "outer", "natural",
			"where", "group", "order", "having", "limit", "offset", "fetch", "window", "lateral",
			"union", "intersect", "except");

	private final List<SqlToken> tokens;
	private final int[] depths;
	private final int selectIndex;
	private final Map<Clause, Integer> clauses = new EnumMap<>(Clause.class);
	private final List<TableRef> tables = new ArrayList<>();
	private final List<String> selectAliases = new ArrayList<>();
	private int joinCount;
	private int commaJoinCount;
	private boolean derivedTable;
	private boolean distinctOn;

	private SelectLayout(List<SqlToken> tokens, int[] depths, int selectIndex) {
		this.tokens = tokens;
		this.depths = depths;
		this.selectIndex = selectIndex;
	}

	static Optional<SelectLayout> of(List<SqlToken> tokens) {
		int first = SqlTokens.next(tokens, 0);
		if (!SqlTokens.isKeywordAt(tokens, first, "SELECT")) {
			return Optional.empty();
		}
		int[] depths = SqlTokens.depths(tokens);
		SelectLayout layout = new SelectLayout(tokens, depths, first);
		for (int i = first + 1; i < tokens.size(); i++) {
			SqlToken token = tokens.get(i);
			if (depths[i] != 0 || !token.isWord()) {
				continue;
			}
			if (token.isKeyword("UNION", "INTERSECT", "EXCEPT")) {
				return Optional.empty();
			}
			Clause clause = clauseAt(tokens, i);
			if (clause != null) {
				layout.clauses.putIfAbsent(clause, i);
			}
		}
		if (!layout.clauses.containsKey(Clause.FROM)) {
			return Optional.empty();
		}
		layout.scanSelectList();
		layout.scanFrom();
		return Optional.of(layout);
	}

	private static Clause clauseAt(List<SqlToken> tokens, int i) {
		SqlToken token = tokens.get(i);
		if (token.isKeyword("FROM")) {
			return Clause.FROM;
		}
		if (token.isKeyword("WHERE")) {
			return Clause.WHERE;
		}
		if (token.isKeyword("HAVING")) {
			return Clause.HAVING;
		}
		if (token.isKeyword("LIMIT")) {
			return Clause.LIMIT;
		}
		if (token.isKeyword("OFFSET")) {
			return Clause.OFFSET;
		}
		if (token.isKeyword("FETCH")) {
			return Clause.FETCH;
		}
		boolean followedByBy = SqlTokens.isKeywordAt(tokens, SqlTokens.next(tokens, i + 1), "BY");
		if (token.isKeyword("GROUP") && followedByBy) {
			return Clause.GROUP_BY;
		}
		if (token.isKeyword("ORDER") && followedByBy) {
			return Clause.ORDER_BY;
		}
		return null;
	}

	private void scanSelectList() {
		int distinct = SqlTokens.next(tokens, selectIndex + 1);
		if (SqlTokens.isKeywordAt(tokens, distinct, "DISTINCT")
				&& SqlTokens.isKeywordAt(tokens, SqlTokens.next(tokens, distinct + 1), "ON")) {
			distinctOn = true;
		}
		int from = indexOf(Clause.FROM);
		for (int i = selectIndex + 1; i < from; i++) {
			if (depths[i] == 0 && tokens.get(i).isKeyword("AS")) {
				int alias = SqlTokens.next(tokens, i + 1);
				if (alias >= 0 && alias < from && SqlTokens.isIdentifier(tokens, alias)) {
					selectAliases.add(tokens.get(alias).identifier());
				}
			}
		}
	}

	private void scanFrom() {
		int end = endOf(Clause.FROM);
		boolean expectTable = true;
		for (int i = SqlTokens.next(tokens, indexOf(Clause.FROM) + 1); i >= 0 && i < end;
				i = SqlTokens.next(tokens, i + 1)) {
			if (depths[i] != 0) {
				continue;
			}
			SqlToken token = tokens.get(i);
			if (expectTable) {
				expectTable = false;
				if (token.isSymbol("(") || token.isKeyword("LATERAL")) {
					derivedTable = true;
					continue;
				}
				if (!SqlTokens.isIdentifier(tokens, i)) {
					continue;
				}
				int nameIndex = i;
				int dot = SqlTokens.next(tokens, i + 1);
				if (SqlTokens.isSymbolAt(tokens, dot, ".") && SqlTokens.isIdentifier(tokens, SqlTokens.next(tokens, dot + 1))) {
					nameIndex = SqlTokens.next(tokens, dot + 1);
				}
				i = nameIndex;
				String alias = null;
				int after = SqlTokens.next(tokens, nameIndex + 1);
				if (SqlTokens.isKeywordAt(tokens, after, "AS")) {
					after = SqlTokens.next(tokens, after + 1);
				}
				if (after >= 0 && after < end && isAlias(after)) {
					alias = tokens.get(after).identifier();
					i = after;
				}
				tables.add(new TableRef(tokens.get(nameIndex).identifier(), alias));
			} else if (token.isSymbol(",")) {
				commaJoinCount++;
				expectTable = true;
			} else if (token.isKeyword("JOIN")) {
				joinCount++;
				expectTable = true;
			}
		}
	}

	private boolean isAlias(int index) {
		SqlToken token = tokens.get(index);
		if (token.isType(SqlToken.TokenType.QUOTED)) {
			return true;
		}
		return token.isWord() && !NON_ALIAS_WORDS.contains(token.identifier());
	}

	List<SqlToken> tokens() {
		return tokens;
	}

	int depth(int index) {
		return depths[index];
	}

	int selectIndex() {
		return selectIndex;
	}

	boolean has(Clause clause) {
		return clauses.containsKey(clause);
	}

	/**
	 * @return the index of the clause keyword, or -1
	 */
	int indexOf(Clause clause) {
		return clauses.getOrDefault(clause, -1);
	}

	/**
	 * @return the index of the first token after the clause keyword(s)
	 */
	int bodyStart(Clause clause) {
		int index = indexOf(clause);
		if (clause == Clause.GROUP_BY || clause == Clause.ORDER_BY) {
			index = SqlTokens.next(tokens, index + 1);
		}
		return index + 1;
	}

	/**
	 * @return the index of the next top-level clause keyword after {@code clause}, or the token count
	 */
	int endOf(Clause clause) {
		return nextClauseAfter(indexOf(clause));
	}

	/**
	 * @return the index of the first top-level clause keyword after {@code index}, or the token count
	 */
	int nextClauseAfter(int index) {
		int end = tokens.size();
		for (int position : clauses.values()) {
			if (position > index && position < end) {
				end = position;
			}
		}
		return end;
	}

	/**
	 * Splits {@code [from, to)} on top-level commas.
	 *
	 * @return {@code [start, end)} pairs
	 */
	List<int[]> items(int from, int to) {
		List<int[]> items = new ArrayList<>();
		int start = from;
		for (int i = from; i < to; i++) {
			if (depths[i] == 0 && tokens.get(i).isSymbol(",")) {
				items.add(new int[] {start, i});
				start = i + 1;
			}
		}
		items.add(new int[] {start, to});
		return items;
	}

	boolean containsTopLevelKeyword(int from, int to, String keyword) {
		for (int i = from; i < to; i++) {
			if (depths[i] == 0 && tokens.get(i).isKeyword(keyword)) {
				return true;
			}
		}
		return false;
	}

	List<TableRef> tables() {
		return tables;
	}

	int joinCount() {
		return joinCount;
	}

	int commaJoinCount() {
		return commaJoinCount;
	}

	boolean hasDerivedTable() {
		return derivedTable;
	}

	boolean isDistinctOn() {
		return distinctOn;
	}

	boolean isSelectAlias(String name) {
		return selectAliases.contains(name);
	}

	/**
	 * Resolves the table a column reference belongs to. An unqualified column resolves only when
	 * exactly one table of the query declares it.
	 */
	Optional<TableRef> resolve(ColumnRef ref, SchemaCatalog catalog) {
		if (ref.qualifier() != null) {
			return tables.stream().filter(t -> t.isReferencedAs(ref.qualifier())).findFirst();
		}
		List<TableRef> candidates = tables.stream()
				.filter(t -> catalog.isKnownColumn(t.name(), ref.column()))
				.toList();
		return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
	}
}
