package org.javai.chitalishta.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable {@link SchemaCatalog} assembled with a fluent builder.
 *
 * <pre>{@code
 * SchemaCatalog catalog = InMemorySchemaCatalog.builder()
 *     .addTable("chitalishte", "id")
 *     .addColumn("chitalishte", "name")
 *     .addNullableColumn("chitalishte", "region")
 *     .addTextColumn("region")
 *     .addCompositeColumn("town")
 *     .addCorrection("employee_count", "employees_count")
 *     .addRelationship(new TableRelationship("information_card", "chitalishte_id", "chitalishte", "id", null))
 *     .build();
 * }</pre>
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {

	private final Map<String, Set<String>> columns;
	private final Map<String, Set<String>> nullableColumns;
	private final Map<String, String> primaryKeys;
	private final Set<String> textColumns;
	private final Set<String> compositeColumns;
	private final Map<String, String> corrections;
	private final List<TableRelationship> relationships;

	private InMemorySchemaCatalog(Builder builder) {
		this.columns = freeze(builder.columns);
		this.nullableColumns = freeze(builder.nullableColumns);
		this.primaryKeys = Collections.unmodifiableMap(new LinkedHashMap<>(builder.primaryKeys));
		this.textColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.textColumns));
		this.compositeColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.compositeColumns));
		this.corrections = Collections.unmodifiableMap(new LinkedHashMap<>(builder.corrections));
		this.relationships = List.copyOf(builder.relationships);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Set<String> tableNames() {
		return columns.keySet();
	}

	@Override
	public Set<String> columns(String table) {
		return columns.getOrDefault(key(table), Set.of());
	}

	@Override
	public boolean isKnownColumn(String table, String column) {
		return columns(table).contains(key(column));
	}

	@Override
	public boolean isNullable(String table, String column) {
		return nullableColumns.getOrDefault(key(table), Set.of()).contains(key(column));
	}

	@Override
	public boolean isTextColumn(String column) {
		return textColumns.contains(key(column));
	}

	@Override
	public boolean isCompositeTextColumn(String column) {
		return compositeColumns.contains(key(column));
	}

	@Override
	public Optional<String> correctedColumnName(String wrong) {
		return Optional.ofNullable(corrections.get(key(wrong)));
	}

	@Override
	public Map<String, String> columnCorrections() {
		return corrections;
	}

	@Override
	public Set<String> textColumns() {
		return textColumns;
	}

	@Override
	public Set<String> compositeColumns() {
		return compositeColumns;
	}

	@Override
	public Optional<String> primaryKey(String table) {
		return Optional.ofNullable(primaryKeys.get(key(table)));
	}

	@Override
	public List<TableRelationship> relationships() {
		return relationships;
	}

	private static String key(String name) {
		return name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
	}

	private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
		Map<String, Set<String>> copy = new LinkedHashMap<>();
		source.forEach((table, cols) -> copy.put(table, Collections.unmodifiableSet(new LinkedHashSet<>(cols))));
		return Collections.unmodifiableMap(copy);
	}

	/**
	 * Mutable builder; not thread-safe. Blank names are ignored.
	 */
	public static final class Builder {

		private final Map<String, Set<String>> columns = new LinkedHashMap<>();
		private final Map<String, Set<String>> nullableColumns = new LinkedHashMap<>();
		private final Map<String, String> primaryKeys = new LinkedHashMap<>();
		private final Set<String> textColumns = new LinkedHashSet<>();
		private final Set<String> compositeColumns = new LinkedHashSet<>();
		private final Map<String, String> corrections = new LinkedHashMap<>();
		private final List<TableRelationship> relationships = new ArrayList<>();

		private Builder() {
		}

		public Builder addTable(String table) {
			if (isBlank(table)) {
				return this;
			}
			columns.computeIfAbsent(key(table), t -> new LinkedHashSet<>());
			return this;
		}

		/**
		 * Adds a table together with its (non-nullable) primary key column.
		 */
		public Builder addTable(String table, String primaryKey) {
			addTable(table);
			if (!isBlank(table) && !isBlank(primaryKey)) {
				primaryKeys.put(key(table), key(primaryKey));
				addColumn(table, primaryKey);
			}
			return this;
		}

		public Builder addColumn(String table, String column) {
			if (isBlank(table) || isBlank(column)) {
				return this;
			}
			columns.computeIfAbsent(key(table), t -> new LinkedHashSet<>()).add(key(column));
			return this;
		}

		public Builder addColumns(String table, String... names) {
			for (String column : names) {
				addColumn(table, column);
			}
			return this;
		}

		public Builder addNullableColumn(String table, String column) {
			addColumn(table, column);
			if (!isBlank(table) && !isBlank(column)) {
				nullableColumns.computeIfAbsent(key(table), t -> new LinkedHashSet<>()).add(key(column));
			}
			return this;
		}

		public Builder addNullableColumns(String table, String... names) {
			for (String column : names) {
				addNullableColumn(table, column);
			}
			return this;
		}

		public Builder addTextColumn(String column) {
			if (!isBlank(column)) {
				textColumns.add(key(column));
			}
			return this;
		}

		/**
		 * Declares a column holding composite values; it is also treated as a text column.
		 */
		public Builder addCompositeColumn(String column) {
			if (!isBlank(column)) {
				compositeColumns.add(key(column));
				textColumns.add(key(column));
			}
			return this;
		}

		public Builder addCorrection(String wrongName, String correctName) {
			if (isBlank(wrongName) || isBlank(correctName)) {
				return this;
			}
			if (key(wrongName).equals(key(correctName))) {
				throw new IllegalArgumentException("Column correction maps '" + wrongName + "' to itself");
			}
			corrections.put(key(wrongName), key(correctName));
			return this;
		}

		public Builder addRelationship(TableRelationship relationship) {
			if (relationship != null) {
				relationships.add(new TableRelationship(
						key(relationship.fromTable()), key(relationship.fromColumn()),
						key(relationship.toTable()), key(relationship.toColumn()),
						relationship.description()));
			}
			return this;
		}

		/**
		 * @throws IllegalArgumentException if a correction target is itself a known wrong name,
		 *         which would make column correction non-idempotent
		 */
		public InMemorySchemaCatalog build() {
			for (Map.Entry<String, String> correction : corrections.entrySet()) {
				if (corrections.containsKey(correction.getValue())) {
					throw new IllegalArgumentException("Column correction '" + correction.getKey() + "' -> '"
							+ correction.getValue() + "' targets another wrong name");
				}
			}
			return new InMemorySchemaCatalog(this);
		}

		private static boolean isBlank(String value) {
			return value == null || value.isBlank();
		}
	}
}
