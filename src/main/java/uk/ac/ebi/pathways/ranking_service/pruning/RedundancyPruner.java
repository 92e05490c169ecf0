package uk.ac.ebi.pathways.ranking_service.pruning;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.PruningSettings;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.util.GeneSymbols;

/**
 * Collapses aggregated pathways with near-identical evidence gene sets.
 *
 * <p>Candidates are visited by descending support, then descending gene count, then canonical
 * id. A candidate whose Jaccard similarity with any already retained pathway reaches the
 * threshold is dropped, so the survivor of a cluster is always its best supported member.
 */
@Slf4j
@Component
public class RedundancyPruner {

  static final Comparator<AggregatedPathway> PRUNING_ORDER =
      Comparator.comparingInt(AggregatedPathway::supportCount)
          .reversed()
          .thenComparing(
              Comparator.comparingInt((AggregatedPathway p) -> p.evidenceGenes().size())
                  .reversed())
          .thenComparing(AggregatedPathway::canonicalId);

  public PruningResult prune(Collection<AggregatedPathway> pathways, PruningSettings settings) {
    Objects.requireNonNull(pathways, "Aggregated pathways must not be null");
    Objects.requireNonNull(settings, "Pruning settings must not be null");

    List<AggregatedPathway> candidates = new ArrayList<>(pathways);
    candidates.sort(PRUNING_ORDER);

    List<AggregatedPathway> retained = new ArrayList<>();
    List<RedundantPathway> redundant = new ArrayList<>();
    for (AggregatedPathway candidate : candidates) {
      RedundantPathway duplicate = findDuplicate(candidate, retained, settings.jaccardThreshold());
      if (duplicate == null) {
        retained.add(candidate);
      } else {
        log.debug(
            "Pathway {} is redundant with {} (Jaccard {})",
            candidate.canonicalId(),
            duplicate.supersededBy(),
            duplicate.similarity());
        redundant.add(duplicate);
      }
    }

    log.info(
        "Redundancy pruning kept {} of {} pathways (threshold {})",
        retained.size(),
        candidates.size(),
        settings.jaccardThreshold());
    return new PruningResult(retained, redundant);
  }

  private RedundantPathway findDuplicate(
      AggregatedPathway candidate, List<AggregatedPathway> retained, double threshold) {
    for (AggregatedPathway kept : retained) {
      double similarity = GeneSymbols.jaccard(candidate.evidenceGenes(), kept.evidenceGenes());
      if (similarity >= threshold) {
        return new RedundantPathway(
            candidate.canonicalId(), candidate.name(), kept.canonicalId(), similarity);
      }
    }
    return null;
  }
}
