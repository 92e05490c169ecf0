package uk.ac.ebi.pathways.ranking_service.pipeline;

/** Outcome of a ranking run. */
public enum RankingStatus {
  /** At least one pathway passed the relevance gate. */
  COMPLETED,

  /**
   * No pathway passed the relevance gate. A legitimate result: the seed genes have no domain
   * relevant neighborhood.
   */
  NO_RELEVANT_PATHWAYS
}
