package uk.ac.ebi.pathways.ranking_service.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Set;
import lombok.Builder;
import uk.ac.ebi.pathways.ranking_service.util.GeneSymbols;

/**
 * A pathway hit found by enriching the evidence genes of a first-round (primary) pathway.
 *
 * @param originPrimaryPathwayId the primary pathway whose genes produced this query
 * @param contributingSeedGenes the seed genes reachable through this discovery path
 */
@Builder
@JsonTypeName("secondary")
public record SecondaryHit(
    @JsonProperty("source_pathway_id") String sourcePathwayId,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("source_db") SourceDatabase sourceDb,
    @JsonProperty("p_value") Double pValue,
    @JsonProperty("p_adjusted") Double pAdjusted,
    @JsonProperty("evidence_genes") Set<String> evidenceGenes,
    @JsonProperty("origin_primary_pathway_id") String originPrimaryPathwayId,
    @JsonProperty("contributing_seed_genes") Set<String> contributingSeedGenes)
    implements PathwayHit {

  public SecondaryHit {
    evidenceGenes = GeneSymbols.normalizeAll(evidenceGenes);
    contributingSeedGenes = GeneSymbols.normalizeAll(contributingSeedGenes);
  }

  @Override
  public DiscoveryPath discoveryPath() {
    return DiscoveryPath.SECONDARY;
  }
}
