package uk.ac.ebi.pathways.ranking_service.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * A ranked pathway hypothesis, the final output of the ranking engine.
 *
 * @param rank 1-based position after sorting
 * @param pathway the aggregated pathway, serialized inline
 * @param relevance domain relevance of the pathway
 * @param scoreComponents named contributions to {@code compositeScore}
 * @param compositeScore the rank key
 * @param domainGeneScore decayed mean of the curated domain scores of the evidence genes
 * @param lineage provenance view of the pathway
 */
public record ScoredHypothesis(
    int rank,
    @JsonUnwrapped AggregatedPathway pathway,
    RelevanceAnnotation relevance,
    ScoreComponents scoreComponents,
    double compositeScore,
    double domainGeneScore,
    Lineage lineage) {

  public String canonicalId() {
    return pathway.canonicalId();
  }

  public ScoredHypothesis withRank(int newRank) {
    return new ScoredHypothesis(
        newRank, pathway, relevance, scoreComponents, compositeScore, domainGeneScore, lineage);
  }
}
