package uk.ac.ebi.pathways.ranking_service.pruning;

import java.util.List;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;

/**
 * Output of the redundancy pruning stage.
 *
 * @param retained pathways kept, strongest support first
 * @param redundant pathways dropped, with the pathway each was superseded by
 */
public record PruningResult(List<AggregatedPathway> retained, List<RedundantPathway> redundant) {

  public PruningResult {
    retained = List.copyOf(retained);
    redundant = List.copyOf(redundant);
  }
}
