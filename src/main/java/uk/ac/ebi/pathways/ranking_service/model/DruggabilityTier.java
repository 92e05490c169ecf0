package uk.ac.ebi.pathways.ranking_service.model;

/** Development stage of the drugs known to target a gene, best first. */
public enum DruggabilityTier {
  APPROVED,
  CLINICAL_TRIAL,
  DRUGGABLE,
  UNKNOWN
}
