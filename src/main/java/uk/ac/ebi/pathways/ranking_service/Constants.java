package uk.ac.ebi.pathways.ranking_service;

/**
 * A utility class holding application-wide constant values used across the ranking service. This
 * class is non-instantiable.
 */
public final class Constants {

  /** Prefix of every ranking property in {@code application.properties}. */
  public static final String PROPERTY_PREFIX = "ranking";

  public static final String AGGREGATION_PREFIX = PROPERTY_PREFIX + ".aggregation";
  public static final String PRUNING_PREFIX = PROPERTY_PREFIX + ".pruning";
  public static final String RELEVANCE_PREFIX = PROPERTY_PREFIX + ".relevance";
  public static final String SCORING_PREFIX = PROPERTY_PREFIX + ".scoring";
  public static final String GENES_PREFIX = PROPERTY_PREFIX + ".genes";

  /** Value substituted for a p-value that is missing or cannot be used: no evidence at all. */
  public static final double NO_EVIDENCE_P_VALUE = 1.0;

  /**
   * Number of top-scoring genes used when summarising the curated domain score of a pathway. Each
   * further gene weighs {@link #DOMAIN_SCORE_DECAY} times the previous one.
   */
  public static final int DOMAIN_SCORE_TOP_GENES = 10;

  public static final double DOMAIN_SCORE_DECAY = 0.9;

  // Private constructor to prevent instantiation
  private Constants() {
    throw new UnsupportedOperationException("Constants class cannot be instantiated");
  }
}
