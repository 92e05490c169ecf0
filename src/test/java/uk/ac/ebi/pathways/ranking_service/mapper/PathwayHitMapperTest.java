package uk.ac.ebi.pathways.ranking_service.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import uk.ac.ebi.pathways.ranking_service.aggregation.HitValidationResult;
import uk.ac.ebi.pathways.ranking_service.aggregation.HitValidator;
import uk.ac.ebi.pathways.ranking_service.aggregation.RejectedHit;
import uk.ac.ebi.pathways.ranking_service.model.DiscoveryPath;
import uk.ac.ebi.pathways.ranking_service.model.PathwayHit;
import uk.ac.ebi.pathways.ranking_service.model.PrimaryHit;
import uk.ac.ebi.pathways.ranking_service.model.SecondaryHit;
import uk.ac.ebi.pathways.ranking_service.model.SourceDatabase;

class PathwayHitMapperTest {

  private PathwayHitMapper mapper;

  @BeforeEach
  void setUp() {
    mapper = new PathwayHitMapper();
  }

  @Test
  void readsBothDiscoveryPaths() throws IOException {
    List<PathwayHit> hits = mapper.fromJson(readFixture("hits/heart-development-hits.json"));

    assertThat(hits).hasSize(4);
    assertThat(hits.get(0)).isInstanceOf(PrimaryHit.class);
    assertThat(hits.get(0).sourceDb()).isEqualTo(SourceDatabase.ONTOLOGY);
    assertThat(hits.get(0).evidenceGenes()).hasSize(20);
    assertThat(hits.get(0).contributingSeedGenes()).containsExactly("GATA4", "NKX2-5");

    SecondaryHit secondary = (SecondaryHit) hits.get(1);
    assertThat(secondary.discoveryPath()).isEqualTo(DiscoveryPath.SECONDARY);
    assertThat(secondary.originPrimaryPathwayId()).isEqualTo("GO:0007507");
    assertThat(secondary.pValue()).isEqualTo(1e-6);
  }

  @Test
  void nativeDatabaseCodesAndGeneCaseAreNormalized() throws IOException {
    PathwayHit conduction = mapper.fromJson(readFixture("hits/heart-development-hits.json")).get(2);

    assertThat(conduction.sourceDb()).isEqualTo(SourceDatabase.CURATED_SIGNALING);
    assertThat(conduction.evidenceGenes()).containsExactly("KCNH2", "KCNQ1", "SCN5A");
    assertThat(conduction.description()).isEqualTo("Ion channel activity in cardiomyocytes");
  }

  @Test
  void unavailableStatisticsAreKept() throws IOException {
    List<PathwayHit> hits = mapper.fromJson(readFixture("hits/heart-development-hits.json"));

    assertThat(hits.get(2).pValue()).isNaN();
    assertThat(hits.get(3).pValue()).isNull();
  }

  @Test
  void hitWithoutDiscoveryPathIsSkippedAndTheRestKept() {
    String json =
        "[{\"source_pathway_id\": \"GO:1\", \"name\": \"heart looping\"},"
            + " {\"discovery_path\": \"primary\", \"source_pathway_id\": \"GO:0007507\","
            + " \"name\": \"heart development\", \"source_db\": \"GO:BP\","
            + " \"p_value\": 1e-10, \"evidence_genes\": [\"GATA4\"]}]";

    List<PathwayHit> hits = mapper.fromJson(json);

    assertThat(hits).extracting(PathwayHit::sourcePathwayId).containsExactly("GO:0007507");
  }

  @Test
  void unknownDatabaseIsLeftForValidationAndSiblingsSurvive() {
    String json =
        "[{\"discovery_path\": \"primary\", \"source_pathway_id\": \"GO:0007507\","
            + " \"name\": \"heart development\", \"source_db\": \"GO:BP\","
            + " \"p_value\": 1e-10, \"evidence_genes\": [\"GATA4\", \"TBX5\"]},"
            + " {\"discovery_path\": \"primary\", \"source_pathway_id\": \"BC:1\","
            + " \"name\": \"cardiac hypertrophy\", \"source_db\": \"BIOCARTA\","
            + " \"p_value\": 1e-3, \"evidence_genes\": [\"MYH7\"]}]";

    List<PathwayHit> hits = mapper.fromJson(json);

    assertThat(hits).extracting(PathwayHit::sourcePathwayId).containsExactly("GO:0007507", "BC:1");
    assertThat(hits.get(0).sourceDb()).isEqualTo(SourceDatabase.ONTOLOGY);
    assertThat(hits.get(1).sourceDb()).isNull();

    HitValidationResult validation = new HitValidator().validate(hits);

    assertThat(validation.accepted()).containsExactly(hits.get(0));
    assertThat(validation.rejected())
        .extracting(RejectedHit::reason)
        .containsExactly("missing or unknown source_db");
  }

  @Test
  void nonArrayInputFails() {
    assertThatThrownBy(() -> mapper.fromJson("{\"discovery_path\": \"primary\"}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be an array");
  }

  @Test
  void invalidJsonFails() {
    assertThatThrownBy(() -> mapper.fromJson("[{\"discovery_path\": "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Failed to parse pathway hits");
  }

  @Test
  void emptyInputFails() {
    assertThatThrownBy(() -> mapper.fromJson("")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void emptyArrayGivesNoHits() {
    assertThat(mapper.fromJson("[]")).isEmpty();
  }

  static String readFixture(String path) throws IOException {
    return new String(
        new ClassPathResource(path).getInputStream().readAllBytes(), StandardCharsets.UTF_8);
  }
}
