package uk.ac.ebi.pathways.ranking_service.pruning;

/**
 * A pathway dropped because its gene set nearly duplicates a retained one. Kept for diagnostics.
 *
 * @param canonicalId the dropped pathway
 * @param name name of the dropped pathway
 * @param supersededBy the retained pathway it duplicates
 * @param similarity Jaccard similarity of the two evidence gene sets
 */
public record RedundantPathway(
    String canonicalId, String name, String supersededBy, double similarity) {}
