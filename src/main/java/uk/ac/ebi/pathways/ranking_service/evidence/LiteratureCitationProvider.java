package uk.ac.ebi.pathways.ranking_service.evidence;

import java.util.OptionalInt;
import java.util.Set;

/** Supplies how often a pathway is cited together with the seed genes. */
@FunctionalInterface
public interface LiteratureCitationProvider {

  /**
   * Returns the number of publications mentioning the pathway together with the seed genes.
   *
   * @param pathwayName the pathway name
   * @param seedGenes the contributing seed genes of the pathway
   * @return the citation count, empty when there is no data
   */
  OptionalInt citationCount(String pathwayName, Set<String> seedGenes);
}
