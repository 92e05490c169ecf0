package uk.ac.ebi.pathways.ranking_service.aggregation;

import uk.ac.ebi.pathways.ranking_service.model.PathwayHit;

/**
 * A pathway hit excluded from the run because a required field is missing.
 *
 * @param hit the offending hit, {@code null} when the list itself held a null entry
 * @param reason human readable reason
 */
public record RejectedHit(PathwayHit hit, String reason) {}
