package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.chitalishta.sql.SchemaCatalog;
import org.javai.chitalishta.sql.rewrite.SelectLayout.Clause;
import org.javai.chitalishta.sql.rewrite.SelectLayout.TableRef;
import org.javai.chitalishta.sql.rewrite.SqlTokens.ColumnRef;
import org.javai.chitalishta.sql.rewrite.SqlTokens.Edit;

/**
 * Ensures every nullable column the outermost query orders by is filtered with
 * {@code IS NOT NULL}, so rankings are not topped by rows with missing values.
 *
 * <p>The predicate is appended to an existing {@code WHERE} with {@code AND} (parenthesizing
 * a top-level {@code OR}), or a new {@code WHERE} is inserted before {@code GROUP BY},
 * {@code HAVING} or {@code ORDER BY}.</p>
 */
public class NullFilterPass implements RewritePass {

	public static final String NAME = "null-filter";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String apply(String sql, SchemaCatalog catalog) {
		List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
		Optional<SelectLayout> found = SelectLayout.of(tokens);
		if (found.isEmpty() || !found.get().has(Clause.ORDER_BY)) {
			return sql;
		}
		SelectLayout layout = found.get();

		Map<String, String> predicates = new LinkedHashMap<>();
		for (int[] item : layout.items(layout.bodyStart(Clause.ORDER_BY), layout.endOf(Clause.ORDER_BY))) {
			Optional<ColumnRef> ref = OrderItems.plainColumn(tokens, item[0], item[1]);
			if (ref.isEmpty() || (ref.get().qualifier() == null && layout.isSelectAlias(ref.get().column()))) {
				continue;
			}
			Optional<TableRef> table = layout.resolve(ref.get(), catalog);
			if (table.isEmpty() || !catalog.isNullable(table.get().name(), ref.get().column())) {
				continue;
			}
			String key = table.get().name() + "." + ref.get().column();
			if (!predicates.containsKey(key) && !hasNotNullFilter(layout, table.get(), ref.get().column(), catalog)) {
				predicates.put(key, ref.get().text() + " IS NOT NULL");
			}
		}
		if (predicates.isEmpty()) {
			return sql;
		}

		String filter = String.join(" AND ", predicates.values());
		List<Edit> edits = new ArrayList<>();
		if (layout.has(Clause.WHERE)) {
			int start = layout.bodyStart(Clause.WHERE);
			int end = layout.endOf(Clause.WHERE);
			String condition = SqlTokens.renderCompact(tokens, start, end);
			if (layout.containsTopLevelKeyword(start, end, "OR")) {
				condition = "(" + condition + ")";
			}
			edits.add(new Edit(start, end, " " + condition + " AND " + filter + " "));
		} else {
			int insertAt = firstOf(layout, Clause.GROUP_BY, Clause.HAVING, Clause.ORDER_BY);
			String prefix = tokens.get(insertAt - 1).isTrivia() ? "" : " ";
			edits.add(new Edit(insertAt, insertAt, prefix + "WHERE " + filter + " "));
		}
		return SqlTokens.apply(tokens, edits);
	}

	private static boolean hasNotNullFilter(SelectLayout layout, TableRef table, String column, SchemaCatalog catalog) {
		if (!layout.has(Clause.WHERE)) {
			return false;
		}
		List<SqlToken> tokens = layout.tokens();
		int end = layout.endOf(Clause.WHERE);
		for (int i = layout.bodyStart(Clause.WHERE); i < end; i++) {
			if (!SqlTokens.isIdentifier(tokens, i) || !tokens.get(i).identifier().equals(column)) {
				continue;
			}
			int is = SqlTokens.next(tokens, i + 1);
			int not = SqlTokens.next(tokens, is + 1);
			int nul = SqlTokens.next(tokens, not + 1);
			if (!SqlTokens.isKeywordAt(tokens, is, "IS") || !SqlTokens.isKeywordAt(tokens, not, "NOT")
					|| !SqlTokens.isKeywordAt(tokens, nul, "NULL")) {
				continue;
			}
			Optional<TableRef> resolved = SqlTokens.columnRefEndingAt(tokens, i)
					.flatMap(ref -> layout.resolve(ref, catalog));
			if (resolved.isEmpty() || resolved.get().equals(table)) {
				return true;
			}
		}
		return false;
	}

	private static int firstOf(SelectLayout layout, Clause... clauses) {
		int first = layout.tokens().size();
		for (Clause clause : clauses) {
			if (layout.has(clause)) {
				first = Math.min(first, layout.indexOf(clause));
			}
		}
		return first;
	}
}
