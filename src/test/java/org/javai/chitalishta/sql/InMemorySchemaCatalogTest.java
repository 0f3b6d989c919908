package org.javai.chitalishta.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class InMemorySchemaCatalogTest {

	private static final TableRelationship CARDS = new TableRelationship(
			"Information_Card", "chitalishte_id", "chitalishte", "id", "cards");

	private final SchemaCatalog catalog = InMemorySchemaCatalog.builder()
			.addTable("Chitalishte", "ID")
			.addColumns("chitalishte", "registration_number")
			.addNullableColumns("chitalishte", "name", "region", "town")
			.addTable("information_card", "id")
			.addColumn("information_card", "chitalishte_id")
			.addNullableColumns("information_card", "total_members_count", "region")
			.addTextColumn("Region")
			.addCompositeColumn("town")
			.addCorrection("member_count", "total_members_count")
			.addRelationship(CARDS)
			.build();

	@Test
	void lookupsIgnoreCase() {
		assertThat(catalog.tableNames()).containsExactly("chitalishte", "information_card");
		assertThat(catalog.isKnownColumn("CHITALISHTE", "Name")).isTrue();
		assertThat(catalog.isNullable("chitalishte", "REGION")).isTrue();
		assertThat(catalog.isTextColumn("region")).isTrue();
		assertThat(catalog.correctedColumnName("Member_Count")).contains("total_members_count");
	}

	@Test
	void primaryKeyIsAKnownNonNullableColumn() {
		assertThat(catalog.primaryKey("chitalishte")).contains("id");
		assertThat(catalog.isKnownColumn("chitalishte", "id")).isTrue();
		assertThat(catalog.isNullable("chitalishte", "id")).isFalse();
		assertThat(catalog.isNullable("chitalishte", "registration_number")).isFalse();
	}

	@Test
	void compositeColumnsAreTextColumns() {
		assertThat(catalog.isCompositeTextColumn("TOWN")).isTrue();
		assertThat(catalog.isTextColumn("town")).isTrue();
		assertThat(catalog.isCompositeTextColumn("region")).isFalse();
	}

	@Test
	void unknownNamesAreHandled() {
		assertThat(catalog.columns("nope")).isEmpty();
		assertThat(catalog.isKnownColumn("nope", "name")).isFalse();
		assertThat(catalog.primaryKey("nope")).isEmpty();
		assertThat(catalog.correctedColumnName("name")).isEmpty();
	}

	@Test
	void relationshipsAreNormalized() {
		assertThat(catalog.relationships()).singleElement()
				.satisfies(r -> assertThat(r.fromTable()).isEqualTo("information_card"));
		assertThat(catalog.fanOutRelationship("chitalishte", "information_card")).isPresent();
		assertThat(catalog.fanOutRelationship("information_card", "chitalishte")).isEmpty();
	}

	@Test
	void tablesWithColumn() {
		assertThat(catalog.tablesWithColumn("region")).containsExactly("chitalishte", "information_card");
		assertThat(catalog.tablesWithColumn("name")).containsExactly("chitalishte");
		assertThat(catalog.tablesWithColumn(null)).isEmpty();
	}

	@Test
	void viewsAreImmutable() {
		assertThatThrownBy(() -> catalog.columns("chitalishte").add("x"))
				.isInstanceOf(UnsupportedOperationException.class);
		assertThatThrownBy(() -> catalog.columnCorrections().put("a", "b"))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void correctionToItselfIsRejected() {
		assertThatThrownBy(() -> InMemorySchemaCatalog.builder().addCorrection("name", "NAME"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void chainedCorrectionsAreRejected() {
		InMemorySchemaCatalog.Builder builder = InMemorySchemaCatalog.builder()
				.addCorrection("a", "b")
				.addCorrection("b", "c");

		assertThatThrownBy(builder::build)
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("targets another wrong name");
	}
}
