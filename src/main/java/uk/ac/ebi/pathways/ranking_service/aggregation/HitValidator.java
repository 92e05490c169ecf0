package uk.ac.ebi.pathways.ranking_service.aggregation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.model.PathwayHit;
import uk.ac.ebi.pathways.ranking_service.model.SecondaryHit;

/**
 * Separates well-formed pathway hits from malformed ones.
 *
 * <p>A hit is malformed when it lacks its pathway id, name, source database or evidence genes,
 * or when a secondary hit lacks the primary pathway it originates from. Statistics are not
 * checked here: a missing or unusable p-value is handled by the aggregator.
 */
@Slf4j
@Component
public class HitValidator {

  /**
   * Validates every hit of the list.
   *
   * @param hits the hits to validate
   * @return the accepted hits and the rejected ones with their reasons
   */
  public HitValidationResult validate(List<? extends PathwayHit> hits) {
    Objects.requireNonNull(hits, "Pathway hits must not be null");

    List<PathwayHit> accepted = new ArrayList<>(hits.size());
    List<RejectedHit> rejected = new ArrayList<>();

    for (PathwayHit hit : hits) {
      String reason = findProblem(hit);
      if (reason == null) {
        accepted.add(hit);
      } else {
        log.warn("Dropping malformed pathway hit {}: {}", describe(hit), reason);
        rejected.add(new RejectedHit(hit, reason));
      }
    }

    if (!rejected.isEmpty()) {
      log.info("Rejected {} of {} pathway hits as malformed", rejected.size(), hits.size());
    }
    return new HitValidationResult(accepted, rejected);
  }

  private String findProblem(PathwayHit hit) {
    if (hit == null) {
      return "hit is null";
    }
    if (StringUtils.isBlank(hit.sourcePathwayId())) {
      return "missing source_pathway_id";
    }
    if (StringUtils.isBlank(hit.name())) {
      return "missing name";
    }
    if (hit.sourceDb() == null) {
      return "missing or unknown source_db";
    }
    if (hit.evidenceGenes().isEmpty()) {
      return "no evidence_genes";
    }
    if (hit instanceof SecondaryHit secondary
        && StringUtils.isBlank(secondary.originPrimaryPathwayId())) {
      return "secondary hit without origin_primary_pathway_id";
    }
    return null;
  }

  private static String describe(PathwayHit hit) {
    return hit == null ? "<null>" : "'" + hit.sourcePathwayId() + "' (" + hit.name() + ")";
  }
}
