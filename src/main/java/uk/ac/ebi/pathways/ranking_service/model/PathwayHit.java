package uk.ac.ebi.pathways.ranking_service.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Set;

/**
 * One enrichment hit, as normalized by the evidence ingestion adapter.
 *
 * <p>A hit is either a {@link PrimaryHit} or a {@link SecondaryHit}. Only the secondary variant
 * carries lineage back to the first-round pathway whose genes produced it. In JSON the variant is
 * selected by the {@code discovery_path} property.
 *
 * <p>{@link #pValue()} is {@code null} when the adapter marked the statistic as unavailable.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "discovery_path")
@JsonSubTypes({
  @JsonSubTypes.Type(value = PrimaryHit.class, name = "primary"),
  @JsonSubTypes.Type(value = SecondaryHit.class, name = "secondary")
})
public sealed interface PathwayHit permits PrimaryHit, SecondaryHit {

  String sourcePathwayId();

  String name();

  String description();

  SourceDatabase sourceDb();

  Double pValue();

  Double pAdjusted();

  Set<String> evidenceGenes();

  Set<String> contributingSeedGenes();

  DiscoveryPath discoveryPath();
}
