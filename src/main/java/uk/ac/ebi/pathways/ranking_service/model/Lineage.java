package uk.ac.ebi.pathways.ranking_service.model;

import java.util.List;
import java.util.Set;

/**
 * Provenance of a final pathway: seed genes, then the primary pathways they reached, then the
 * secondary instances found through those, then the canonical pathway.
 *
 * <p>Derived from an {@link AggregatedPathway}, never stored on its own.
 */
public record Lineage(
    Set<String> seedGenes,
    Set<String> primaryPathwayIds,
    List<SecondaryInstance> secondaryInstances,
    String canonicalId,
    DiscoveryMethod discoveryMethod) {

  public Lineage {
    seedGenes = seedGenes == null ? Set.of() : seedGenes;
    primaryPathwayIds = primaryPathwayIds == null ? Set.of() : primaryPathwayIds;
    secondaryInstances = secondaryInstances == null ? List.of() : List.copyOf(secondaryInstances);
  }

  /**
   * Compact view of one secondary hit.
   *
   * @param originPrimaryPathwayId the primary pathway whose genes produced the hit
   * @param pValue the p-value reported for the hit, {@code null} when unavailable
   * @param evidenceGeneCount number of evidence genes of the hit
   */
  public record SecondaryInstance(
      String sourcePathwayId, String originPrimaryPathwayId, Double pValue, int evidenceGeneCount) {

    static SecondaryInstance of(SecondaryHit hit) {
      return new SecondaryInstance(
          hit.sourcePathwayId(),
          hit.originPrimaryPathwayId(),
          hit.pValue(),
          hit.evidenceGenes().size());
    }
  }
}
