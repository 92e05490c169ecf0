package uk.ac.ebi.pathways.ranking_service.evidence;

import java.util.OptionalDouble;

/** Supplies a curated domain relevance weight per gene. */
@FunctionalInterface
public interface DomainGeneScoreProvider {

  /**
   * @param gene normalized gene symbol
   * @return the score in [0, 1], empty when the gene is not curated
   */
  OptionalDouble domainScore(String gene);
}
