package uk.ac.ebi.pathways.ranking_service.model;

/** How a pathway hit was reached from the seed genes. */
public enum DiscoveryPath {
  /** Direct enrichment of the seed gene neighborhood. */
  PRIMARY,

  /** Enrichment of the genes of a first-round pathway. */
  SECONDARY
}
