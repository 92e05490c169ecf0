package uk.ac.ebi.pathways.ranking_service.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/**
 * All hits sharing one canonical pathway identifier, merged into a single record.
 *
 * @param canonicalId the external pathway identifier, unique within one run
 * @param name pathway name, taken from the first contributing hit
 * @param description optional pathway description, taken from the first hit that has one
 * @param sourceDb annotation database of the pathway
 * @param evidenceGenes union of the evidence genes of every contributing hit
 * @param supportCount number of distinct contributing hits
 * @param sourcePrimaryPathwayIds primary pathways this pathway was reached from (itself for a
 *     primary hit)
 * @param sourceSecondaryInstances the raw secondary hits, kept for lineage display
 * @param hitPValues the p-value used for each contributing hit, after substitution
 * @param combinedPValue Fisher's combination of {@code hitPValues}
 * @param aggregationScore ranking value of the aggregation stage, equal to {@code
 *     confidenceScore}
 * @param consistencyScore {@code 1 - cv(hitPValues)} clamped to [0, 1], 1 for a single hit
 * @param confidenceScore weighted mix of replication, significance, evidence and consistency
 * @param supportFraction {@code supportCount} relative to the primary pathways seen in the run
 * @param contributingSeedGenes union of the seed genes behind every contributing hit
 */
@Builder(toBuilder = true)
public record AggregatedPathway(
    String canonicalId,
    String name,
    String description,
    SourceDatabase sourceDb,
    Set<String> evidenceGenes,
    int supportCount,
    Set<String> sourcePrimaryPathwayIds,
    List<SecondaryHit> sourceSecondaryInstances,
    List<Double> hitPValues,
    double combinedPValue,
    double aggregationScore,
    double consistencyScore,
    double confidenceScore,
    double supportFraction,
    Set<String> contributingSeedGenes) {

  public AggregatedPathway {
    evidenceGenes = copyOf(evidenceGenes);
    sourcePrimaryPathwayIds = copyOf(sourcePrimaryPathwayIds);
    sourceSecondaryInstances =
        sourceSecondaryInstances == null ? List.of() : List.copyOf(sourceSecondaryInstances);
    hitPValues = hitPValues == null ? List.of() : List.copyOf(hitPValues);
    contributingSeedGenes = copyOf(contributingSeedGenes);
  }

  // Keeps iteration order, which the JSON output and lineage view rely on.
  private static Set<String> copyOf(Set<String> values) {
    return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
  }

  /** Builds the lineage view of this pathway. */
  public Lineage toLineage() {
    DiscoveryMethod method =
        supportCount > 1 || !sourceSecondaryInstances.isEmpty()
            ? DiscoveryMethod.AGGREGATED
            : DiscoveryMethod.PRIMARY;
    List<Lineage.SecondaryInstance> secondaries =
        sourceSecondaryInstances.stream().map(Lineage.SecondaryInstance::of).toList();
    return new Lineage(
        contributingSeedGenes, sourcePrimaryPathwayIds, secondaries, canonicalId, method);
  }
}
