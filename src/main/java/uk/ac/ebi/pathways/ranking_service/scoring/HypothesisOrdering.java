package uk.ac.ebi.pathways.ranking_service.scoring;

import java.util.Comparator;
import uk.ac.ebi.pathways.ranking_service.model.ScoredHypothesis;

/**
 * Total order of scored hypotheses: composite score descending, then evidence gene count
 * descending, then support count descending, then canonical id ascending.
 */
public final class HypothesisOrdering {

  public static final Comparator<ScoredHypothesis> RANK_ORDER =
      Comparator.comparingDouble(ScoredHypothesis::compositeScore)
          .reversed()
          .thenComparing(
              Comparator.comparingInt(
                      (ScoredHypothesis h) -> h.pathway().evidenceGenes().size())
                  .reversed())
          .thenComparing(
              Comparator.comparingInt((ScoredHypothesis h) -> h.pathway().supportCount())
                  .reversed())
          .thenComparing(ScoredHypothesis::canonicalId);

  private HypothesisOrdering() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }
}
