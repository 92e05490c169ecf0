package uk.ac.ebi.pathways.ranking_service.model;

import java.util.List;

/**
 * A gene ranked by how often, and how strongly, it appears across the final pathways.
 *
 * @param rank 1-based position
 * @param symbol normalized gene symbol
 * @param pathwayCount number of final pathways whose evidence contains the gene
 * @param meanCompositeScore mean composite score of those pathways
 * @param domainScore curated domain score of the gene, 0 when unknown
 * @param importanceScore the rank key
 * @param druggability druggability tier, {@link DruggabilityTier#UNKNOWN} when no data
 * @param pathwayIds canonical ids of the pathways containing the gene, in rank order
 */
public record ImportantGene(
    int rank,
    String symbol,
    int pathwayCount,
    double meanCompositeScore,
    double domainScore,
    double importanceScore,
    DruggabilityTier druggability,
    List<String> pathwayIds) {

  public ImportantGene {
    pathwayIds = pathwayIds == null ? List.of() : List.copyOf(pathwayIds);
  }
}
