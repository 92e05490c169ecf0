package uk.ac.ebi.pathways.ranking_service.aggregation;

import java.util.List;
import uk.ac.ebi.pathways.ranking_service.model.PathwayHit;

/**
 * Outcome of validating a list of pathway hits.
 *
 * @param accepted hits carrying every required field, in input order
 * @param rejected malformed hits with the reason each was excluded
 */
public record HitValidationResult(List<PathwayHit> accepted, List<RejectedHit> rejected) {

  public HitValidationResult {
    accepted = List.copyOf(accepted);
    rejected = List.copyOf(rejected);
  }
}
