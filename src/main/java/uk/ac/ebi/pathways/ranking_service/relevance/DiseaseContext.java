package uk.ac.ebi.pathways.ranking_service.relevance;

import java.util.List;

/**
 * Terms specific to one disease context.
 *
 * @param label the context label, e.g. "heart failure"
 * @param synonyms other labels a user may give for the same context
 * @param terms pathway terms that indicate this context
 */
public record DiseaseContext(String label, List<String> synonyms, List<String> terms) {

  public DiseaseContext {
    synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    terms = terms == null ? List.of() : List.copyOf(terms);
  }
}
