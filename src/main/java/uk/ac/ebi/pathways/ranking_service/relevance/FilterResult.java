package uk.ac.ebi.pathways.ranking_service.relevance;

import java.util.List;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;

/**
 * Output of the relevance filter.
 *
 * @param survivors pathways passing the gate, in input order
 * @param excluded pathways failing the gate, kept for diagnostics only
 * @param contextTerms disease context terms resolved from the requested label
 */
public record FilterResult(
    List<AnnotatedPathway> survivors, List<AnnotatedPathway> excluded, List<String> contextTerms) {

  public FilterResult {
    survivors = List.copyOf(survivors);
    excluded = List.copyOf(excluded);
    contextTerms = List.copyOf(contextTerms);
  }

  public boolean isEmpty() {
    return survivors.isEmpty();
  }

  public List<AggregatedPathway> survivingPathways() {
    return survivors.stream().map(AnnotatedPathway::pathway).toList();
  }
}
