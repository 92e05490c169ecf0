package uk.ac.ebi.pathways.ranking_service.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;

/**
 * Output of the aggregation stage.
 *
 * @param pathways aggregated pathways keyed by canonical id, in order of first appearance
 * @param stats counters of the pass
 */
public record AggregationResult(Map<String, AggregatedPathway> pathways, AggregationStats stats) {

  public AggregationResult {
    pathways = Collections.unmodifiableMap(new LinkedHashMap<>(pathways));
  }

  public List<AggregatedPathway> pathwayList() {
    return List.copyOf(pathways.values());
  }
}
