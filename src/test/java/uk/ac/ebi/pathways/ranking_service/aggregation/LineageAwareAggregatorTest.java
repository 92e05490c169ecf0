package uk.ac.ebi.pathways.ranking_service.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.HEART_DEVELOPMENT_ID;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.SEED_GENES;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.genes;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.heartDevelopmentPrimary;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.heartDevelopmentSecondary;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.primaryHit;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.secondaryHit;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.AggregationSettings;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.model.DiscoveryMethod;
import uk.ac.ebi.pathways.ranking_service.model.Lineage;
import uk.ac.ebi.pathways.ranking_service.model.PathwayHit;

class LineageAwareAggregatorTest {

  private LineageAwareAggregator aggregator;
  private AggregationSettings settings;

  @BeforeEach
  void setUp() {
    aggregator = new LineageAwareAggregator();
    settings = RankingSettings.defaults().aggregation();
  }

  @Nested
  @DisplayName("Pathway rediscovered through a secondary path")
  class Rediscovery {

    private AggregatedPathway pathway;

    @BeforeEach
    void aggregate() {
      List<PathwayHit> hits = List.of(heartDevelopmentPrimary(), heartDevelopmentSecondary());
      AggregationResult result = aggregator.aggregate(hits, SEED_GENES, settings);
      pathway = result.pathways().get(HEART_DEVELOPMENT_ID);
    }

    @Test
    void bothHitsSupportThePathway() {
      assertThat(pathway.supportCount()).isEqualTo(2);
    }

    @Test
    void evidenceGenesAreTheUnion() {
      assertThat(pathway.evidenceGenes()).hasSize(20);
    }

    @Test
    void combinedPValueIsStrongerThanTheBestHit() {
      assertThat(pathway.combinedPValue()).isLessThan(1e-10);
    }

    @Test
    void lineageKeepsTheSecondaryInstance() {
      assertThat(pathway.sourcePrimaryPathwayIds()).containsExactly(HEART_DEVELOPMENT_ID);
      assertThat(pathway.sourceSecondaryInstances()).hasSize(1);
      assertThat(pathway.contributingSeedGenes()).containsExactly("GATA4", "NKX2-5");

      Lineage lineage = pathway.toLineage();
      assertThat(lineage.discoveryMethod()).isEqualTo(DiscoveryMethod.AGGREGATED);
      assertThat(lineage.secondaryInstances())
          .singleElement()
          .satisfies(
              instance -> {
                assertThat(instance.originPrimaryPathwayId()).isEqualTo(HEART_DEVELOPMENT_ID);
                assertThat(instance.evidenceGeneCount()).isEqualTo(15);
              });
    }

    @Test
    void confidenceCombinesItsParts() {
      double evidence = Math.min(1.0, 20.0 / settings.evidenceSaturation());
      double expected =
          settings.replicationWeight() * pathway.supportFraction()
              + settings.significanceWeight() * (1.0 - pathway.combinedPValue())
              + settings.evidenceWeight() * evidence
              + settings.consistencyWeight() * pathway.consistencyScore();

      assertThat(pathway.confidenceScore()).isEqualTo(expected);
      assertThat(pathway.aggregationScore()).isEqualTo(pathway.confidenceScore());
    }
  }

  @Test
  void singleHitKeepsItsPValue() {
    PathwayHit hit = primaryHit("R-1", "Cardiac conduction", 0.002, List.of("SCN5A", "KCNQ1"));

    AggregatedPathway pathway =
        aggregator.aggregate(List.of(hit), Set.of(), settings).pathways().get("R-1");

    assertThat(pathway.combinedPValue()).isEqualTo(0.002);
    assertThat(pathway.consistencyScore()).isEqualTo(1.0);
    assertThat(pathway.toLineage().discoveryMethod()).isEqualTo(DiscoveryMethod.PRIMARY);
  }

  @Test
  void primaryHitSeedsAreDerivedFromEvidence() {
    PathwayHit hit = primaryHit("R-1", "Cardiac conduction", 0.002, List.of("SCN5A", "KCNQ1"));

    AggregatedPathway pathway =
        aggregator.aggregate(List.of(hit), Set.of("SCN5A", "TTN"), settings).pathways().get("R-1");

    assertThat(pathway.contributingSeedGenes()).containsExactly("SCN5A");
  }

  @Test
  void identicalHitRecordsCountOnce() {
    PathwayHit hit = heartDevelopmentPrimary();

    AggregationResult result = aggregator.aggregate(List.of(hit, hit), SEED_GENES, settings);

    assertThat(result.pathways().get(HEART_DEVELOPMENT_ID).supportCount()).isEqualTo(1);
    assertThat(result.stats().duplicateHits()).isEqualTo(1);
  }

  @Test
  void unusablePValuesBecomeNoEvidence() {
    List<PathwayHit> hits =
        List.of(
            primaryHit("GO:1", "heart looping", null, genes("G", 3)),
            primaryHit("GO:2", "heart valve development", Double.NaN, genes("G", 3)),
            primaryHit("GO:3", "cardiac muscle contraction", 1.7, genes("G", 3)),
            primaryHit("GO:4", "heart morphogenesis", 0.01, genes("G", 3)));

    AggregationResult result = aggregator.aggregate(hits, Set.of(), settings);

    assertThat(result.pathways()).containsOnlyKeys("GO:1", "GO:2", "GO:3", "GO:4");
    assertThat(result.pathways().get("GO:1").combinedPValue()).isEqualTo(1.0);
    assertThat(result.pathways().get("GO:2").combinedPValue()).isEqualTo(1.0);
    assertThat(result.pathways().get("GO:3").combinedPValue()).isEqualTo(1.0);
    assertThat(result.pathways().get("GO:4").combinedPValue()).isEqualTo(0.01);
    assertThat(result.stats().substitutedPValues()).isEqualTo(3);
  }

  @Test
  void zeroPValueIsClampedToTheFloor() {
    PathwayHit hit = primaryHit("GO:1", "heart development", 0.0, genes("G", 3));

    AggregatedPathway pathway =
        aggregator.aggregate(List.of(hit), Set.of(), settings).pathways().get("GO:1");

    assertThat(pathway.combinedPValue()).isEqualTo(settings.minimumPValue());
  }

  @Test
  void supportFractionIsRelativeToThePrimaryPathwaysOfTheRun() {
    List<PathwayHit> hits =
        List.of(
            primaryHit("P1", "heart development", 0.01, genes("A", 5)),
            primaryHit("P2", "cardiac conduction", 0.01, genes("B", 5)),
            secondaryHit("S1", "cardiac hypertrophy", 0.02, genes("C", 5), "P1"),
            secondaryHit("S1", "cardiac hypertrophy", 0.03, genes("C", 6), "P2"));

    AggregationResult result = aggregator.aggregate(hits, Set.of(), settings);

    assertThat(result.pathways().get("S1").supportFraction()).isEqualTo(1.0);
    assertThat(result.pathways().get("S1").sourcePrimaryPathwayIds()).containsExactly("P1", "P2");
    assertThat(result.pathways().get("P1").supportFraction()).isEqualTo(0.5);
  }

  @Test
  void thresholdsDropWeakPathways() {
    AggregationSettings strict =
        new AggregationSettings(
            settings.minimumPValue(),
            2,
            0.05,
            settings.evidenceSaturation(),
            settings.replicationWeight(),
            settings.significanceWeight(),
            settings.evidenceWeight(),
            settings.consistencyWeight());
    List<PathwayHit> hits =
        List.of(
            heartDevelopmentPrimary(),
            heartDevelopmentSecondary(),
            primaryHit("GO:2", "heart valve development", 1e-5, genes("V", 4)),
            secondaryHit("GO:3", "heart looping", 0.4, genes("L", 4), "GO:2"),
            secondaryHit("GO:3", "heart looping", 0.6, genes("L", 4), HEART_DEVELOPMENT_ID));

    AggregationResult result = aggregator.aggregate(hits, SEED_GENES, strict);

    assertThat(result.pathways()).containsOnlyKeys(HEART_DEVELOPMENT_ID);
    assertThat(result.stats().filteredPathways()).isEqualTo(2);
  }

  @Test
  void pathwaysKeepFirstSeenOrder() {
    List<PathwayHit> hits =
        List.of(
            primaryHit("Z", "heart looping", 0.01, genes("A", 2)),
            primaryHit("A", "heart valve development", 0.01, genes("B", 2)));

    AggregationResult result = aggregator.aggregate(hits, Set.of(), settings);

    assertThat(result.pathwayList())
        .extracting(AggregatedPathway::canonicalId)
        .containsExactly("Z", "A");
  }
}
