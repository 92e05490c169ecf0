package uk.ac.ebi.pathways.ranking_service.config;

public interface RankingConfigValidator {
  /**
   * Validates every weight and threshold of a run.
   *
   * @param settings the settings to validate (not null)
   * @throws uk.ac.ebi.pathways.ranking_service.exceptions.RankingConfigurationException naming the
   *     first offending property
   */
  void validate(RankingSettings settings);
}
