package uk.ac.ebi.pathways.ranking_service.exceptions;

/**
 * Thrown when a ranking weight, threshold or lexicon is invalid.
 *
 * <p>Raised before any pathway hit is processed, so a run either starts with a consistent
 * configuration or does not start at all. The message always names the offending property.
 */
public class RankingConfigurationException extends IllegalStateException {

  private final String property;

  public RankingConfigurationException(String property, String message) {
    super(property + " " + message);
    this.property = property;
  }

  public RankingConfigurationException(String property, String message, Throwable cause) {
    super(property + " " + message, cause);
    this.property = property;
  }

  /** Returns the fully qualified name of the property that failed validation. */
  public String getProperty() {
    return property;
  }
}
