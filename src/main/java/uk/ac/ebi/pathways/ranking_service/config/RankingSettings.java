package uk.ac.ebi.pathways.ranking_service.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import uk.ac.ebi.pathways.ranking_service.model.SourceDatabase;

/**
 * Immutable snapshot of every ranking weight and threshold used by one analysis run.
 *
 * <p>The snapshot is threaded explicitly through every stage call, so two concurrent runs with
 * different settings never observe each other's values.
 *
 * @param aggregation lineage-aware aggregation settings
 * @param pruning redundancy pruning settings
 * @param relevance relevance scoring settings
 * @param scoring composite scoring settings
 * @param genes important gene ranking settings
 */
public record RankingSettings(
    AggregationSettings aggregation,
    PruningSettings pruning,
    RelevanceSettings relevance,
    ScoringSettings scoring,
    GeneRankingSettings genes) {

  public RankingSettings {
    Objects.requireNonNull(aggregation, "aggregation must not be null");
    Objects.requireNonNull(pruning, "pruning must not be null");
    Objects.requireNonNull(relevance, "relevance must not be null");
    Objects.requireNonNull(scoring, "scoring must not be null");
    Objects.requireNonNull(genes, "genes must not be null");
  }

  /** Returns the settings built from the property defaults. */
  public static RankingSettings defaults() {
    return from(new RankingProperties());
  }

  /**
   * Copies the current values of the bound properties into a new immutable snapshot.
   *
   * @param properties the bound properties
   * @return the snapshot
   */
  public static RankingSettings from(RankingProperties properties) {
    RankingProperties.Aggregation agg = properties.getAggregation();
    RankingProperties.Confidence confidence = agg.getConfidence();
    RankingProperties.Relevance rel = properties.getRelevance();
    RankingProperties.Scoring sc = properties.getScoring();
    RankingProperties.Genes genes = properties.getGenes();

    return new RankingSettings(
        new AggregationSettings(
            agg.getMinimumPValue(),
            agg.getMinSupport(),
            agg.getMaxCombinedPValue(),
            agg.getEvidenceSaturation(),
            confidence.getReplicationWeight(),
            confidence.getSignificanceWeight(),
            confidence.getEvidenceWeight(),
            confidence.getConsistencyWeight()),
        new PruningSettings(properties.getPruning().getJaccardThreshold()),
        new RelevanceSettings(
            CategoryValues.from(rel.getWeights()),
            CategoryValues.from(rel.getCaps()),
            rel.getDiseaseContextBoost(),
            rel.getNegativePenalty()),
        new ScoringSettings(
            sc.getDbWeights(),
            sc.getEpsilon(),
            sc.getEvidenceDivisor(),
            sc.getEvidenceCap(),
            sc.getAggregationWeightCap(),
            sc.getTissueBonusWeight(),
            sc.getTissueBonusCap(),
            sc.getLiteratureBonusWeight(),
            sc.getLiteratureBonusCap()),
        new GeneRankingSettings(
            genes.getTopPathways(), genes.getTopGenes(), genes.getPathwayCountExponent()));
  }

  public RankingSettings withAggregation(AggregationSettings value) {
    return new RankingSettings(value, pruning, relevance, scoring, genes);
  }

  public RankingSettings withPruning(PruningSettings value) {
    return new RankingSettings(aggregation, value, relevance, scoring, genes);
  }

  public RankingSettings withRelevance(RelevanceSettings value) {
    return new RankingSettings(aggregation, pruning, value, scoring, genes);
  }

  public RankingSettings withScoring(ScoringSettings value) {
    return new RankingSettings(aggregation, pruning, relevance, value, genes);
  }

  public RankingSettings withGenes(GeneRankingSettings value) {
    return new RankingSettings(aggregation, pruning, relevance, scoring, value);
  }

  public record AggregationSettings(
      double minimumPValue,
      int minSupport,
      double maxCombinedPValue,
      int evidenceSaturation,
      double replicationWeight,
      double significanceWeight,
      double evidenceWeight,
      double consistencyWeight) {}

  public record PruningSettings(double jaccardThreshold) {}

  /** Per-category values of the relevance lexicon. */
  public record CategoryValues(
      double direct, double process, double pathology, double diseaseContext) {

    static CategoryValues from(RankingProperties.CategoryValues values) {
      return new CategoryValues(
          values.getDirect(),
          values.getProcess(),
          values.getPathology(),
          values.getDiseaseContext());
    }
  }

  public record RelevanceSettings(
      CategoryValues weights,
      CategoryValues caps,
      double diseaseContextBoost,
      double negativePenalty) {}

  /**
   * @param dbWeights quality weight keyed by {@link SourceDatabase#getId()}
   */
  public record ScoringSettings(
      Map<String, Double> dbWeights,
      double epsilon,
      double evidenceDivisor,
      double evidenceCap,
      double aggregationWeightCap,
      double tissueBonusWeight,
      double tissueBonusCap,
      double literatureBonusWeight,
      double literatureBonusCap) {

    public ScoringSettings {
      dbWeights =
          dbWeights == null
              ? Map.of()
              : Collections.unmodifiableMap(new LinkedHashMap<>(dbWeights));
    }

    /** Returns the configured weight of the database, or 1.0 when none is configured. */
    public double dbWeight(SourceDatabase database) {
      Double weight = dbWeights.get(database.getId());
      return weight != null ? weight : 1.0;
    }
  }

  public record GeneRankingSettings(int topPathways, int topGenes, double pathwayCountExponent) {}
}
