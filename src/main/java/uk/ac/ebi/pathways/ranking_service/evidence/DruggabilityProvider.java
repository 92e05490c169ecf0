package uk.ac.ebi.pathways.ranking_service.evidence;

import java.util.Optional;
import uk.ac.ebi.pathways.ranking_service.model.DruggabilityTier;

/** Supplies the druggability tier of a gene. */
@FunctionalInterface
public interface DruggabilityProvider {

  /**
   * @param gene normalized gene symbol
   * @return the best known tier, empty when there is no data
   */
  Optional<DruggabilityTier> druggability(String gene);
}
