package org.javai.chitalishta.sql;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads a {@link SchemaCatalog} from YAML.
 *
 * <pre>
 * tables:
 *   chitalishte:
 *     primaryKey: id
 *     columns: [registration_number, created_at]
 *     nullable: [name, region, town]
 * textColumns: [name, region]
 * compositeColumns: [town]
 * columnCorrections:
 *   employee_count: employees_count
 * relationships:
 *   - fromTable: information_card
 *     fromColumn: chitalishte_id
 *     toTable: chitalishte
 *     toColumn: id
 * </pre>
 *
 * <p>{@code columns} lists the non-nullable columns, {@code nullable} the nullable ones;
 * both are known columns of the table.</p>
 */
public class YamlSchemaCatalogLoader {

	private static final Logger logger = LoggerFactory.getLogger(YamlSchemaCatalogLoader.class);

	/** Classpath location of the chitalishta schema shipped with the library. */
	public static final String DEFAULT_RESOURCE = "chitalishta-schema.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the chitalishta schema bundled on the classpath.
	 */
	public SchemaCatalog loadDefault() {
		try (InputStream in = YamlSchemaCatalogLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new SchemaCatalogLoadException("Schema resource not found on classpath: " + DEFAULT_RESOURCE);
			}
			return load(in);
		} catch (IOException e) {
			throw new SchemaCatalogLoadException("Failed to read schema resource: " + DEFAULT_RESOURCE, e);
		}
	}

	public SchemaCatalog load(InputStream inputStream) {
		Map<String, Object> data;
		try {
			data = yaml.load(inputStream);
		} catch (RuntimeException e) {
			throw new SchemaCatalogLoadException("Failed to parse schema catalog from input stream", e);
		}
		return build(data);
	}

	public SchemaCatalog load(Reader reader) {
		Map<String, Object> data;
		try {
			data = yaml.load(reader);
		} catch (RuntimeException e) {
			throw new SchemaCatalogLoadException("Failed to parse schema catalog from reader", e);
		}
		return build(data);
	}

	public SchemaCatalog loadString(String yamlContent) {
		Map<String, Object> data;
		try {
			data = yaml.load(yamlContent);
		} catch (RuntimeException e) {
			throw new SchemaCatalogLoadException("Failed to parse schema catalog from string", e);
		}
		return build(data);
	}

	private SchemaCatalog build(Map<String, Object> data) {
		if (data == null) {
			throw new SchemaCatalogLoadException("Schema catalog definition is empty");
		}
		try {
			InMemorySchemaCatalog.Builder builder = InMemorySchemaCatalog.builder();

			Map<String, Object> tables = asMap(data.get("tables"), "tables");
			if (tables.isEmpty()) {
				throw new SchemaCatalogLoadException("Missing required 'tables' section");
			}
			tables.forEach((table, definition) -> addTable(builder, table, asMap(definition, "tables." + table)));

			asList(data.get("textColumns"), "textColumns").forEach(c -> builder.addTextColumn(asString(c)));
			asList(data.get("compositeColumns"), "compositeColumns").forEach(c -> builder.addCompositeColumn(asString(c)));
			asMap(data.get("columnCorrections"), "columnCorrections")
					.forEach((wrong, correct) -> builder.addCorrection(wrong, asString(correct)));

			for (Object entry : asList(data.get("relationships"), "relationships")) {
				Map<String, Object> relationship = asMap(entry, "relationships[]");
				builder.addRelationship(new TableRelationship(
						required(relationship, "fromTable"),
						required(relationship, "fromColumn"),
						required(relationship, "toTable"),
						required(relationship, "toColumn"),
						asString(relationship.get("description"))));
			}

			InMemorySchemaCatalog catalog = builder.build();
			logger.debug("Loaded schema catalog with {} table(s), {} correction(s), {} relationship(s)",
					catalog.tableNames().size(), catalog.columnCorrections().size(), catalog.relationships().size());
			return catalog;
		} catch (IllegalArgumentException | NullPointerException | ClassCastException e) {
			throw new SchemaCatalogLoadException("Invalid schema catalog definition: " + e.getMessage(), e);
		}
	}

	private static void addTable(InMemorySchemaCatalog.Builder builder, String table, Map<String, Object> definition) {
		String primaryKey = asString(definition.get("primaryKey"));
		if (primaryKey != null) {
			builder.addTable(table, primaryKey);
		} else {
			builder.addTable(table);
		}
		asList(definition.get("columns"), table + ".columns").forEach(c -> builder.addColumn(table, asString(c)));
		asList(definition.get("nullable"), table + ".nullable").forEach(c -> builder.addNullableColumn(table, asString(c)));
	}

	private static String required(Map<String, Object> map, String key) {
		String value = asString(map.get(key));
		if (value == null || value.isBlank()) {
			throw new SchemaCatalogLoadException("Missing required field '" + key + "' in relationship");
		}
		return value;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String path) {
		if (value == null) {
			return Map.of();
		}
		if (value instanceof Map<?, ?> map) {
			return (Map<String, Object>) map;
		}
		throw new SchemaCatalogLoadException("Expected a mapping at '" + path + "'");
	}

	private static List<?> asList(Object value, String path) {
		if (value == null) {
			return List.of();
		}
		if (value instanceof List<?> list) {
			return list;
		}
		throw new SchemaCatalogLoadException("Expected a list at '" + path + "'");
	}

	private static String asString(Object value) {
		return value == null ? null : String.valueOf(value);
	}
}
