package uk.ac.ebi.pathways.ranking_service.model;

import java.util.List;

/**
 * Domain relevance of one pathway.
 *
 * @param relevanceScore soft score used for ranking, in [0, 1]
 * @param passesGate whether the pathway name contains a direct domain term
 * @param breakdown per-category sub-scores
 * @param diseaseContextBoostApplied whether a term of the requested disease context matched
 * @param matchedDirectTerms direct terms found in the pathway name, in lexicon order
 */
public record RelevanceAnnotation(
    double relevanceScore,
    boolean passesGate,
    RelevanceBreakdown breakdown,
    boolean diseaseContextBoostApplied,
    List<String> matchedDirectTerms) {

  public RelevanceAnnotation {
    if (relevanceScore < 0.0 || relevanceScore > 1.0 || Double.isNaN(relevanceScore)) {
      throw new IllegalArgumentException("Relevance score must be in [0, 1]: " + relevanceScore);
    }
    breakdown = breakdown == null ? RelevanceBreakdown.NONE : breakdown;
    matchedDirectTerms = matchedDirectTerms == null ? List.of() : List.copyOf(matchedDirectTerms);
  }
}
