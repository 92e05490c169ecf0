package uk.ac.ebi.pathways.ranking_service.pipeline;

/** Stages of a ranking run, in execution order, with the type of their published output. */
public enum PipelineStage {
  /** Publishes the {@code AggregationResult}. */
  AGGREGATION,

  /** Publishes the {@code PruningResult}. */
  PRUNING,

  /** Publishes the {@code FilterResult}; only its survivors reach later stages. */
  RELEVANCE_FILTER,

  /** Publishes the ranked {@code List<ScoredHypothesis>}. */
  SCORING,

  /** Publishes the ranked {@code List<ImportantGene>}. */
  GENE_RANKING
}
