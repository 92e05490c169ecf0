package uk.ac.ebi.pathways.ranking_service.model;

/**
 * Per-category contributions to a relevance score.
 *
 * @param directTerm capped sub-score of the direct domain terms
 * @param processTerm capped sub-score of the biological process terms
 * @param pathologyTerm capped sub-score of the pathology terms
 * @param diseaseContextTerm capped sub-score of the disease context terms
 * @param negativePenalty multiplier applied for negative terms, 1.0 when none matched
 */
public record RelevanceBreakdown(
    double directTerm,
    double processTerm,
    double pathologyTerm,
    double diseaseContextTerm,
    double negativePenalty) {

  public static final RelevanceBreakdown NONE = new RelevanceBreakdown(0, 0, 0, 0, 1.0);

  /** Sum of the category sub-scores, before boost and penalty. */
  public double rawScore() {
    return directTerm + processTerm + pathologyTerm + diseaseContextTerm;
  }
}
