package uk.ac.ebi.pathways.ranking_service.aggregation;

/**
 * Counters of one aggregation pass.
 *
 * @param inputHits hits received
 * @param duplicateHits hits identical to an earlier one, counted once
 * @param substitutedPValues hits whose p-value was missing or unusable and was replaced by 1.0
 * @param aggregatedPathways pathways produced
 * @param filteredPathways pathways removed by the minimum support or maximum p-value filters
 */
public record AggregationStats(
    int inputHits,
    int duplicateHits,
    int substitutedPValues,
    int aggregatedPathways,
    int filteredPathways) {}
