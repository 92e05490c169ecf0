package uk.ac.ebi.pathways.ranking_service.config;

import static uk.ac.ebi.pathways.ranking_service.Constants.AGGREGATION_PREFIX;
import static uk.ac.ebi.pathways.ranking_service.Constants.GENES_PREFIX;
import static uk.ac.ebi.pathways.ranking_service.Constants.PRUNING_PREFIX;
import static uk.ac.ebi.pathways.ranking_service.Constants.RELEVANCE_PREFIX;
import static uk.ac.ebi.pathways.ranking_service.Constants.SCORING_PREFIX;

import java.util.Map;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.exceptions.RankingConfigurationException;
import uk.ac.ebi.pathways.ranking_service.model.SourceDatabase;

@Component
public class DefaultRankingConfigValidator implements RankingConfigValidator {

  @Override
  public void validate(RankingSettings settings) {
    if (settings == null) {
      throw new RankingConfigurationException("ranking", "settings must not be null");
    }
    validateAggregation(settings.aggregation());
    validatePruning(settings.pruning());
    validateRelevance(settings.relevance());
    validateScoring(settings.scoring());
    validateGenes(settings.genes());
  }

  private void validateAggregation(RankingSettings.AggregationSettings aggregation) {
    requireOpenUnitInterval(AGGREGATION_PREFIX + ".minimum-p-value", aggregation.minimumPValue());
    if (aggregation.minSupport() < 1) {
      throw new RankingConfigurationException(
          AGGREGATION_PREFIX + ".min-support", "must be >= 1 but was " + aggregation.minSupport());
    }
    double maxP = aggregation.maxCombinedPValue();
    if (!Double.isFinite(maxP) || maxP <= 0.0 || maxP > 1.0) {
      throw new RankingConfigurationException(
          AGGREGATION_PREFIX + ".max-combined-p-value", "must be in (0, 1] but was " + maxP);
    }
    if (aggregation.evidenceSaturation() < 1) {
      throw new RankingConfigurationException(
          AGGREGATION_PREFIX + ".evidence-saturation",
          "must be >= 1 but was " + aggregation.evidenceSaturation());
    }
    String confidence = AGGREGATION_PREFIX + ".confidence";
    requireNonNegative(confidence + ".replication-weight", aggregation.replicationWeight());
    requireNonNegative(confidence + ".significance-weight", aggregation.significanceWeight());
    requireNonNegative(confidence + ".evidence-weight", aggregation.evidenceWeight());
    requireNonNegative(confidence + ".consistency-weight", aggregation.consistencyWeight());
  }

  private void validatePruning(RankingSettings.PruningSettings pruning) {
    double threshold = pruning.jaccardThreshold();
    if (!Double.isFinite(threshold) || threshold <= 0.0 || threshold > 1.0) {
      throw new RankingConfigurationException(
          PRUNING_PREFIX + ".jaccard-threshold", "must be in (0, 1] but was " + threshold);
    }
  }

  private void validateRelevance(RankingSettings.RelevanceSettings relevance) {
    validateCategories(RELEVANCE_PREFIX + ".weights", relevance.weights());
    validateCategories(RELEVANCE_PREFIX + ".caps", relevance.caps());
    validateCaps(RELEVANCE_PREFIX + ".caps", relevance.caps());

    double boost = relevance.diseaseContextBoost();
    if (!Double.isFinite(boost) || boost < 1.0) {
      throw new RankingConfigurationException(
          RELEVANCE_PREFIX + ".disease-context-boost", "must be >= 1 but was " + boost);
    }
    double penalty = relevance.negativePenalty();
    if (!Double.isFinite(penalty) || penalty <= 0.0 || penalty > 1.0) {
      throw new RankingConfigurationException(
          RELEVANCE_PREFIX + ".negative-penalty", "must be in (0, 1] but was " + penalty);
    }
  }

  private void validateCategories(String prefix, RankingSettings.CategoryValues values) {
    if (values == null) {
      throw new RankingConfigurationException(prefix, "must not be null");
    }
    requireNonNegative(prefix + ".direct", values.direct());
    requireNonNegative(prefix + ".process", values.process());
    requireNonNegative(prefix + ".pathology", values.pathology());
    requireNonNegative(prefix + ".disease-context", values.diseaseContext());
  }

  private void validateCaps(String prefix, RankingSettings.CategoryValues caps) {
    requireAtMostOne(prefix + ".direct", caps.direct());
    requireAtMostOne(prefix + ".process", caps.process());
    requireAtMostOne(prefix + ".pathology", caps.pathology());
    requireAtMostOne(prefix + ".disease-context", caps.diseaseContext());
  }

  private void validateScoring(RankingSettings.ScoringSettings scoring) {
    for (Map.Entry<String, Double> entry : scoring.dbWeights().entrySet()) {
      String property = SCORING_PREFIX + ".db-weights." + entry.getKey();
      if (!SourceDatabase.isKnownId(entry.getKey())) {
        throw new RankingConfigurationException(
            property, "is not a known source database, allowed: " + SourceDatabase.allowedIds());
      }
      if (entry.getValue() == null) {
        throw new RankingConfigurationException(property, "must not be empty");
      }
      requireNonNegative(property, entry.getValue());
    }
    requireOpenUnitInterval(SCORING_PREFIX + ".epsilon", scoring.epsilon());
    requirePositive(SCORING_PREFIX + ".evidence-divisor", scoring.evidenceDivisor());
    requirePositive(SCORING_PREFIX + ".evidence-cap", scoring.evidenceCap());
    if (!Double.isFinite(scoring.aggregationWeightCap()) || scoring.aggregationWeightCap() < 1.0) {
      throw new RankingConfigurationException(
          SCORING_PREFIX + ".aggregation-weight-cap",
          "must be >= 1 but was " + scoring.aggregationWeightCap());
    }
    requireNonNegative(SCORING_PREFIX + ".tissue-bonus-weight", scoring.tissueBonusWeight());
    requireNonNegative(SCORING_PREFIX + ".tissue-bonus-cap", scoring.tissueBonusCap());
    requireNonNegative(
        SCORING_PREFIX + ".literature-bonus-weight", scoring.literatureBonusWeight());
    requireNonNegative(SCORING_PREFIX + ".literature-bonus-cap", scoring.literatureBonusCap());
  }

  private void validateGenes(RankingSettings.GeneRankingSettings genes) {
    if (genes.topPathways() < 1) {
      throw new RankingConfigurationException(
          GENES_PREFIX + ".top-pathways", "must be >= 1 but was " + genes.topPathways());
    }
    if (genes.topGenes() < 1) {
      throw new RankingConfigurationException(
          GENES_PREFIX + ".top-genes", "must be >= 1 but was " + genes.topGenes());
    }
    requirePositive(GENES_PREFIX + ".pathway-count-exponent", genes.pathwayCountExponent());
  }

  private void requireNonNegative(String property, double value) {
    if (!Double.isFinite(value) || value < 0.0) {
      throw new RankingConfigurationException(property, "must be >= 0 but was " + value);
    }
  }

  private void requirePositive(String property, double value) {
    if (!Double.isFinite(value) || value <= 0.0) {
      throw new RankingConfigurationException(property, "must be > 0 but was " + value);
    }
  }

  private void requireAtMostOne(String property, double value) {
    if (value > 1.0) {
      throw new RankingConfigurationException(property, "must be <= 1 but was " + value);
    }
  }

  private void requireOpenUnitInterval(String property, double value) {
    if (!Double.isFinite(value) || value <= 0.0 || value >= 1.0) {
      throw new RankingConfigurationException(property, "must be in (0, 1) but was " + value);
    }
  }
}
