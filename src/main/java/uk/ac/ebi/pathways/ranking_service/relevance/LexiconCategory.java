package uk.ac.ebi.pathways.ranking_service.relevance;

/** Categories of the relevance term lexicon. */
public enum LexiconCategory {
  /** Terms naming the target domain itself. A match in the pathway name passes the gate. */
  DIRECT,

  /** Biological processes typical of the domain. */
  PROCESS,

  /** Disease and pathology terms of the domain. */
  PATHOLOGY,

  /** Clinical disease context terms. */
  DISEASE_CONTEXT,

  /** Terms indicating another organ system or an unrelated subject. */
  NEGATIVE
}
