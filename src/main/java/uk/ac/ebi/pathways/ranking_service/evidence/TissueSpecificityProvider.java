package uk.ac.ebi.pathways.ranking_service.evidence;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Supplies how specifically a gene set is expressed in the target tissue.
 *
 * <p>Implementations are pure lookups; the ranking engine never retries or caches them.
 */
@FunctionalInterface
public interface TissueSpecificityProvider {

  /**
   * Returns the tissue specificity ratio of the genes, typically the share of genes enriched in
   * the target tissue.
   *
   * @param genes normalized gene symbols
   * @return the ratio, empty when there is no data
   */
  OptionalDouble tissueSpecificityRatio(Set<String> genes);
}
