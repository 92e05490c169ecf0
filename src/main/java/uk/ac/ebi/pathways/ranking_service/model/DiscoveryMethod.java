package uk.ac.ebi.pathways.ranking_service.model;

/** How the evidence behind a final pathway was gathered. */
public enum DiscoveryMethod {
  /** A single primary hit. */
  PRIMARY,

  /** Several hits, or at least one secondary hit, merged together. */
  AGGREGATED
}
