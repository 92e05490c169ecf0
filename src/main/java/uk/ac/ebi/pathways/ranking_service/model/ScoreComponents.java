package uk.ac.ebi.pathways.ranking_service.model;

import lombok.Builder;

/**
 * Named contributions to a composite score.
 *
 * <p>{@code tissueSpecificityRatio} and {@code literatureCitationCount} are the values supplied
 * by the auxiliary evidence providers, passed through unchanged; {@code null} means the provider
 * had no data.
 */
@Builder
public record ScoreComponents(
    double pValueComponent,
    double evidenceComponent,
    double dbWeight,
    double aggregationWeight,
    double relevanceBoost,
    Double tissueSpecificityRatio,
    Integer literatureCitationCount,
    double tissueBonus,
    double literatureBonus) {

  /** The multiplicative part of the composite score. */
  public double statisticalScore() {
    return pValueComponent * evidenceComponent * dbWeight * aggregationWeight * relevanceBoost;
  }
}
