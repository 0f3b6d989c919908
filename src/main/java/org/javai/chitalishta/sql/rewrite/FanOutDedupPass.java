package org.javai.chitalishta.sql.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.chitalishta.sql.SchemaCatalog;
import org.javai.chitalishta.sql.TableRelationship;
import org.javai.chitalishta.sql.rewrite.SelectLayout.Clause;
import org.javai.chitalishta.sql.rewrite.SelectLayout.TableRef;
import org.javai.chitalishta.sql.rewrite.SqlTokens.ColumnRef;
import org.javai.chitalishta.sql.rewrite.SqlTokens.Edit;

/**
 * Collapses the duplicate parent rows produced by ordering a parent-child join by a child
 * column.
 *
 * <pre>
 * SELECT c.name, ic.total_members_count FROM chitalishte c JOIN information_card ic ON ...
 *     ORDER BY ic.total_members_count DESC
 * </pre>
 * becomes
 * <pre>
 * SELECT c.name, MAX(ic.total_members_count) FROM chitalishte c JOIN information_card ic ON ...
 *     GROUP BY c.id ORDER BY MAX(ic.total_members_count) DESC
 * </pre>
 *
 * <p>Applies only to the simplest shape: exactly two tables joined once along a catalog
 * relationship, no existing grouping, one ordering item that is a bare child column, and no
 * other bare child column (or {@code *}) in the select list. Anything else is left unchanged.</p>
 */
public class FanOutDedupPass implements RewritePass {

	public static final String NAME = "fan-out-dedup";

	private static final String[] AGGREGATES = {"COUNT", "SUM", "AVG", "MIN", "MAX"};

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String apply(String sql, SchemaCatalog catalog) {
		List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
		Optional<SelectLayout> found = SelectLayout.of(tokens);
		if (found.isEmpty() || !isSimpleJoin(found.get())) {
			return sql;
		}
		SelectLayout layout = found.get();

		TableRef first = layout.tables().get(0);
		TableRef second = layout.tables().get(1);
		TableRef parent;
		TableRef child;
		Optional<TableRelationship> relationship = catalog.fanOutRelationship(first.name(), second.name());
		if (relationship.isPresent()) {
			parent = first;
			child = second;
		} else {
			relationship = catalog.fanOutRelationship(second.name(), first.name());
			if (relationship.isEmpty()) {
				return sql;
			}
			parent = second;
			child = first;
		}

		List<int[]> orderItems = layout.items(layout.bodyStart(Clause.ORDER_BY), layout.endOf(Clause.ORDER_BY));
		if (orderItems.size() != 1) {
			return sql;
		}
		Optional<ColumnRef> ordered = OrderItems.plainColumn(tokens, orderItems.get(0)[0], orderItems.get(0)[1]);
		if (ordered.isEmpty() || !isChildColumn(layout, ordered.get(), child, catalog)) {
			return sql;
		}

		List<Edit> edits = new ArrayList<>();
		int selectStart = layout.selectIndex() + 1;
		if (SqlTokens.isKeywordAt(tokens, SqlTokens.next(tokens, selectStart), "DISTINCT")) {
			selectStart = SqlTokens.next(tokens, selectStart) + 1;
		}
		for (int[] item : layout.items(selectStart, layout.indexOf(Clause.FROM))) {
			if (containsTopLevelStar(layout, item)) {
				return sql;
			}
			Optional<ColumnRef> selected = OrderItems.selectedColumn(tokens, item[0], item[1]);
			if (selected.isPresent()) {
				ColumnRef ref = selected.get();
				if (layout.resolve(ref, catalog).isEmpty() && catalog.isKnownColumn(child.name(), ref.column())) {
					return sql;
				}
				if (!isChildColumn(layout, ref, child, catalog)) {
					continue;
				}
				if (!ref.column().equals(ordered.get().column())) {
					return sql;
				}
				edits.add(new Edit(ref.start(), ref.end() + 1, "MAX(" + ref.text() + ")"));
			} else if (!isAggregate(tokens, item) && referencesChild(layout, item, child, catalog)) {
				return sql;
			}
		}

		int orderBy = layout.indexOf(Clause.ORDER_BY);
		edits.add(new Edit(orderBy, orderBy,
				"GROUP BY " + parent.referenceName() + "." + relationship.get().toColumn() + " "));
		ColumnRef orderRef = ordered.get();
		edits.add(new Edit(orderRef.start(), orderRef.end() + 1, "MAX(" + orderRef.text() + ")"));
		return SqlTokens.apply(tokens, edits);
	}

	private static boolean isSimpleJoin(SelectLayout layout) {
		return layout.has(Clause.ORDER_BY)
				&& !layout.has(Clause.GROUP_BY)
				&& !layout.has(Clause.HAVING)
				&& !layout.isDistinctOn()
				&& !layout.hasDerivedTable()
				&& layout.tables().size() == 2
				&& layout.joinCount() == 1
				&& layout.commaJoinCount() == 0;
	}

	private static boolean isChildColumn(SelectLayout layout, ColumnRef ref, TableRef child, SchemaCatalog catalog) {
		return layout.resolve(ref, catalog).filter(child::equals).isPresent()
				&& catalog.isKnownColumn(child.name(), ref.column());
	}

	private static boolean containsTopLevelStar(SelectLayout layout, int[] item) {
		for (int i = item[0]; i < item[1]; i++) {
			if (layout.depth(i) == 0 && layout.tokens().get(i).isSymbol("*")) {
				return true;
			}
		}
		return false;
	}

	private static boolean isAggregate(List<SqlToken> tokens, int[] item) {
		int first = SqlTokens.next(tokens, item[0]);
		return first >= 0 && first < item[1]
				&& tokens.get(first).isKeyword(AGGREGATES)
				&& SqlTokens.isFunctionCall(tokens, first);
	}

	private static boolean referencesChild(SelectLayout layout, int[] item, TableRef child, SchemaCatalog catalog) {
		List<SqlToken> tokens = layout.tokens();
		for (int i = item[0]; i < item[1]; i++) {
			if (!SqlTokens.isIdentifier(tokens, i) || SqlTokens.isFunctionCall(tokens, i)
					|| SqlTokens.isSymbolAt(tokens, SqlTokens.next(tokens, i + 1), ".")) {
				continue;
			}
			Optional<ColumnRef> ref = SqlTokens.columnRefEndingAt(tokens, i);
			if (ref.isPresent() && (isChildColumn(layout, ref.get(), child, catalog)
					|| (ref.get().qualifier() == null && catalog.isKnownColumn(child.name(), ref.get().column())))) {
				return true;
			}
		}
		return false;
	}
}
