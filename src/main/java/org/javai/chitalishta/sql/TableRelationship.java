package org.javai.chitalishta.sql;

import java.util.Objects;

/**
 * A one-to-many foreign key relationship: every row of {@code toTable} may be referenced by
 * many rows of {@code fromTable}.
 *
 * @param fromTable the child table holding the foreign key
 * @param fromColumn the foreign key column
 * @param toTable the parent table
 * @param toColumn the referenced column (typically the primary key)
 * @param description human-readable description of the relationship
 */
public record TableRelationship(
		String fromTable,
		String fromColumn,
		String toTable,
		String toColumn,
		String description
) {

	public TableRelationship {
		Objects.requireNonNull(fromTable, "fromTable must not be null");
		Objects.requireNonNull(fromColumn, "fromColumn must not be null");
		Objects.requireNonNull(toTable, "toTable must not be null");
		Objects.requireNonNull(toColumn, "toColumn must not be null");
	}

	/**
	 * @return true if joining {@code parent} with {@code child} fans out along this relationship
	 */
	public boolean fansOut(String parent, String child) {
		return toTable.equalsIgnoreCase(parent) && fromTable.equalsIgnoreCase(child);
	}
}
