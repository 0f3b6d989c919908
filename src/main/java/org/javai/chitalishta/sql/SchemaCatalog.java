package org.javai.chitalishta.sql;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only description of the tables an LLM-generated query may touch, plus the knowledge
 * needed to correct common mistakes in such queries.
 *
 * <p>All name lookups are case-insensitive. Implementations are immutable once built and
 * safe to share between threads.</p>
 */
public interface SchemaCatalog {

	/**
	 * @return the known table names, lower-cased
	 */
	Set<String> tableNames();

	/**
	 * @return the columns of the table, lower-cased; empty for an unknown table
	 */
	Set<String> columns(String table);

	boolean isKnownColumn(String table, String column);

	boolean isNullable(String table, String column);

	/**
	 * @return true if comparisons against this column (in any table) must ignore case
	 */
	boolean isTextColumn(String column);

	/**
	 * @return true if the column stores composite values such as {@code "<PREFIX> <NAME>"}
	 *         that must be matched by substring rather than equality
	 */
	boolean isCompositeTextColumn(String column);

	/**
	 * @return the correct column name for a known hallucinated one
	 */
	Optional<String> correctedColumnName(String wrong);

	/**
	 * @return every known wrong-to-correct column name pair, lower-cased, in declaration order
	 */
	Map<String, String> columnCorrections();

	Set<String> textColumns();

	Set<String> compositeColumns();

	/**
	 * @return the primary key column of the table, if declared
	 */
	Optional<String> primaryKey(String table);

	List<TableRelationship> relationships();

	/**
	 * Finds the relationship along which joining {@code parent} and {@code child} multiplies
	 * parent rows.
	 */
	default Optional<TableRelationship> fanOutRelationship(String parent, String child) {
		if (parent == null || child == null) {
			return Optional.empty();
		}
		return relationships().stream()
				.filter(r -> r.fansOut(parent, child))
				.findFirst();
	}

	/**
	 * @return the tables that declare the column, in table declaration order
	 */
	default List<String> tablesWithColumn(String column) {
		if (column == null) {
			return List.of();
		}
		return tableNames().stream()
				.filter(t -> isKnownColumn(t, column))
				.toList();
	}
}
