package uk.ac.ebi.pathways.ranking_service.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Set;
import lombok.Builder;
import uk.ac.ebi.pathways.ranking_service.util.GeneSymbols;

/**
 * A pathway hit found by enriching the seed gene neighborhood directly.
 *
 * <p>{@code contributingSeedGenes} may be left empty by the adapter; the aggregator then derives
 * them from the seed genes present in the evidence.
 */
@Builder
@JsonTypeName("primary")
public record PrimaryHit(
    @JsonProperty("source_pathway_id") String sourcePathwayId,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("source_db") SourceDatabase sourceDb,
    @JsonProperty("p_value") Double pValue,
    @JsonProperty("p_adjusted") Double pAdjusted,
    @JsonProperty("evidence_genes") Set<String> evidenceGenes,
    @JsonProperty("contributing_seed_genes") Set<String> contributingSeedGenes)
    implements PathwayHit {

  public PrimaryHit {
    evidenceGenes = GeneSymbols.normalizeAll(evidenceGenes);
    contributingSeedGenes = GeneSymbols.normalizeAll(contributingSeedGenes);
  }

  @Override
  public DiscoveryPath discoveryPath() {
    return DiscoveryPath.PRIMARY;
  }
}
