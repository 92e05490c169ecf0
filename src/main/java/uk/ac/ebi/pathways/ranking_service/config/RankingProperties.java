package uk.ac.ebi.pathways.ranking_service.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.model.SourceDatabase;

/**
 * Tunable weights and thresholds of the ranking stages. Properties loaded from {@code
 * application.properties} with prefix {@code ranking}.
 *
 * <p>This bean is mutable because Spring binds into it. Stages never read it directly: each run
 * takes an immutable {@link RankingSettings} snapshot via {@link RankingSettings#from} and passes
 * that snapshot explicitly to every stage call.
 */
@Data
@Component
@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {

  private Aggregation aggregation = new Aggregation();
  private Pruning pruning = new Pruning();
  private Relevance relevance = new Relevance();
  private Scoring scoring = new Scoring();
  private Genes genes = new Genes();

  @Data
  public static class Aggregation {
    /** Lower clamp applied to p-values before taking the logarithm. */
    private double minimumPValue = 1e-300;

    /** Aggregated pathways supported by fewer hits are dropped. 1 keeps everything. */
    private int minSupport = 1;

    /** Aggregated pathways with a larger combined p-value are dropped. 1.0 keeps everything. */
    private double maxCombinedPValue = 1.0;

    /** Gene count at which the evidence part of the confidence score saturates. */
    private int evidenceSaturation = 20;

    private Confidence confidence = new Confidence();
  }

  @Data
  public static class Confidence {
    private double replicationWeight = 0.30;
    private double significanceWeight = 0.30;
    private double evidenceWeight = 0.25;
    private double consistencyWeight = 0.15;
  }

  @Data
  public static class Pruning {
    /** Jaccard similarity of evidence genes at or above which a pathway is redundant. */
    private double jaccardThreshold = 0.85;
  }

  @Data
  public static class Relevance {
    private String lexiconLocation = "classpath:lexicon/cardiac-lexicon.json";

    /** Contribution of each matched term, per category. */
    private CategoryValues weights = new CategoryValues(0.20, 0.08, 0.10, 0.15);

    /** Maximum sub-score of each category. */
    private CategoryValues caps = new CategoryValues(0.50, 0.20, 0.20, 0.30);

    /** Multiplier applied when the pathway matches the requested disease context. */
    private double diseaseContextBoost = 1.5;

    /** Multiplier applied when the pathway matches a negative term. */
    private double negativePenalty = 0.5;
  }

  @Data
  public static class CategoryValues {
    private double direct;
    private double process;
    private double pathology;
    private double diseaseContext;

    public CategoryValues() {}

    public CategoryValues(double direct, double process, double pathology, double diseaseContext) {
      this.direct = direct;
      this.process = process;
      this.pathology = pathology;
      this.diseaseContext = diseaseContext;
    }
  }

  @Data
  public static class Scoring {
    /** Quality weight per source database id, e.g. {@code ranking.scoring.db-weights.ontology}. */
    private Map<String, Double> dbWeights = defaultDbWeights();

    /** The epsilon of {@code -log10(max(p, epsilon))}. */
    private double epsilon = 1e-50;

    private double evidenceDivisor = 10.0;
    private double evidenceCap = 3.0;
    private double aggregationWeightCap = 1.5;
    private double tissueBonusWeight = 1.0;
    private double tissueBonusCap = 1.0;
    private double literatureBonusWeight = 0.5;
    private double literatureBonusCap = 1.5;

    private static Map<String, Double> defaultDbWeights() {
      Map<String, Double> weights = new LinkedHashMap<>();
      weights.put(SourceDatabase.CURATED_SIGNALING.getId(), 1.5);
      weights.put(SourceDatabase.METABOLIC_REFERENCE.getId(), 1.5);
      weights.put(SourceDatabase.COMMUNITY_CURATED.getId(), 1.2);
      weights.put(SourceDatabase.ONTOLOGY.getId(), 1.0);
      return weights;
    }
  }

  @Data
  public static class Genes {
    /** Curated domain gene scores and druggability annotations. */
    private String annotationsLocation = "classpath:genes/cardiac-gene-annotations.json";
    private int topPathways = 50;
    private int topGenes = 20;
    private double pathwayCountExponent = 1.2;
  }
}
