package uk.ac.ebi.pathways.ranking_service.pipeline;

import java.util.List;
import java.util.Set;
import lombok.Builder;
import uk.ac.ebi.pathways.ranking_service.aggregation.AggregationStats;
import uk.ac.ebi.pathways.ranking_service.aggregation.RejectedHit;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.model.ImportantGene;
import uk.ac.ebi.pathways.ranking_service.model.ScoredHypothesis;
import uk.ac.ebi.pathways.ranking_service.pruning.RedundantPathway;
import uk.ac.ebi.pathways.ranking_service.relevance.AnnotatedPathway;

/**
 * Output of one ranking run. Each stage has its own field; {@code hypotheses} only ever holds
 * pathways that passed the relevance gate.
 *
 * @param runId the run
 * @param status whether any pathway survived the relevance gate
 * @param seedGenes normalized seed genes
 * @param diseaseContext requested disease context label
 * @param rejectedHits malformed hits excluded before aggregation
 * @param aggregationStats counters of the aggregation stage
 * @param aggregated output of the aggregation stage
 * @param pruned output of the redundancy pruning stage
 * @param redundant pathways dropped by pruning
 * @param excluded pathways rejected by the relevance gate, for diagnostics
 * @param hypotheses final ranked hypotheses
 * @param importantGenes ranked genes of the final hypotheses
 */
@Builder
public record RankingResult(
    String runId,
    RankingStatus status,
    Set<String> seedGenes,
    String diseaseContext,
    List<RejectedHit> rejectedHits,
    AggregationStats aggregationStats,
    List<AggregatedPathway> aggregated,
    List<AggregatedPathway> pruned,
    List<RedundantPathway> redundant,
    List<AnnotatedPathway> excluded,
    List<ScoredHypothesis> hypotheses,
    List<ImportantGene> importantGenes) {

  public RankingResult {
    rejectedHits = rejectedHits == null ? List.of() : List.copyOf(rejectedHits);
    aggregated = aggregated == null ? List.of() : List.copyOf(aggregated);
    pruned = pruned == null ? List.of() : List.copyOf(pruned);
    redundant = redundant == null ? List.of() : List.copyOf(redundant);
    excluded = excluded == null ? List.of() : List.copyOf(excluded);
    hypotheses = hypotheses == null ? List.of() : List.copyOf(hypotheses);
    importantGenes = importantGenes == null ? List.of() : List.copyOf(importantGenes);
  }
}
