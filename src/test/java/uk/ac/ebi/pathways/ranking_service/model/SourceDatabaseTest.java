package uk.ac.ebi.pathways.ranking_service.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SourceDatabaseTest {

  @ParameterizedTest
  @CsvSource({
    "REAC, CURATED_SIGNALING",
    "reactome, CURATED_SIGNALING",
    "KEGG, METABOLIC_REFERENCE",
    "WP, COMMUNITY_CURATED",
    "GO:BP, ONTOLOGY",
    "ontology, ONTOLOGY",
    "community_curated, COMMUNITY_CURATED"
  })
  void resolvesIdsNamesAndNativeCodes(String value, SourceDatabase expected) {
    assertThat(SourceDatabase.fromValue(value)).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource({"MSIGDB", "''"})
  void rejectsUnknownValues(String value) {
    assertThatThrownBy(() -> SourceDatabase.fromValue(value))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void jsonReadingLeavesUnknownCodesUnresolved() {
    assertThat(SourceDatabase.fromJson("REAC")).isEqualTo(SourceDatabase.CURATED_SIGNALING);
    assertThat(SourceDatabase.fromJson("BIOCARTA")).isNull();
    assertThat(SourceDatabase.fromJson(null)).isNull();
  }
}
