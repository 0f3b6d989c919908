package org.javai.chitalishta.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("YamlSchemaCatalogLoader")
class YamlSchemaCatalogLoaderTest {

	private final YamlSchemaCatalogLoader loader = new YamlSchemaCatalogLoader();

	@Test
	@DisplayName("Bundled chitalishta schema loads")
	void loadsDefaultSchema() {
		SchemaCatalog catalog = loader.loadDefault();

		assertThat(catalog.tableNames()).containsExactly("chitalishte", "information_card");
		assertThat(catalog.primaryKey("chitalishte")).contains("id");
		assertThat(catalog.isNullable("chitalishte", "region")).isTrue();
		assertThat(catalog.isNullable("information_card", "chitalishte_id")).isFalse();
		assertThat(catalog.isTextColumn("region")).isTrue();
		assertThat(catalog.isCompositeTextColumn("town")).isTrue();
		assertThat(catalog.correctedColumnName("members_count")).contains("total_members_count");
		assertThat(catalog.fanOutRelationship("chitalishte", "information_card"))
				.hasValueSatisfying(r -> assertThat(r.fromColumn()).isEqualTo("chitalishte_id"));
	}

	@Test
	void loadsFromReader() {
		SchemaCatalog catalog = loader.load(new StringReader("""
				tables:
				  books:
				    columns: [id]
				    nullable: [title]
				textColumns: [title]
				"""));

		assertThat(catalog.isNullable("books", "title")).isTrue();
		assertThat(catalog.primaryKey("books")).isEmpty();
		assertThat(catalog.relationships()).isEmpty();
	}

	@Test
	void emptyDocumentIsRejected() {
		assertThatThrownBy(() -> loader.loadString(""))
				.isInstanceOf(SchemaCatalogLoadException.class)
				.hasMessageContaining("empty");
	}

	@Test
	void missingTablesAreRejected() {
		assertThatThrownBy(() -> loader.loadString("textColumns: [name]"))
				.isInstanceOf(SchemaCatalogLoadException.class)
				.hasMessageContaining("tables");
	}

	@Test
	void wrongShapeIsRejected() {
		assertThatThrownBy(() -> loader.loadString("tables: [chitalishte]"))
				.isInstanceOf(SchemaCatalogLoadException.class)
				.hasMessageContaining("Expected a mapping at 'tables'");
	}

	@Test
	void incompleteRelationshipIsRejected() {
		assertThatThrownBy(() -> loader.loadString("""
				tables:
				  a:
				    columns: [id]
				relationships:
				  - fromTable: a
				    toTable: b
				"""))
				.isInstanceOf(SchemaCatalogLoadException.class)
				.hasMessageContaining("fromColumn");
	}

	@Test
	void malformedYamlIsRejected() {
		assertThatThrownBy(() -> loader.loadString("tables: {a: [unclosed"))
				.isInstanceOf(SchemaCatalogLoadException.class)
				.hasCauseInstanceOf(RuntimeException.class);
	}
}
