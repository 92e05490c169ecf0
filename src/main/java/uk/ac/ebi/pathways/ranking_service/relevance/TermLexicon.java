package uk.ac.ebi.pathways.ranking_service.relevance;

import java.util.List;
import java.util.Map;

/**
 * The curated relevance term lexicon, partitioned by category.
 *
 * <p>A term ending in {@code *} matches any word starting with it, e.g. {@code cardio*}.
 */
public record TermLexicon(
    List<String> directTerms,
    List<String> processTerms,
    List<String> pathologyTerms,
    List<String> diseaseContextTerms,
    List<String> negativeTerms,
    List<DiseaseContext> diseaseContexts) {

  public TermLexicon {
    directTerms = directTerms == null ? List.of() : List.copyOf(directTerms);
    processTerms = processTerms == null ? List.of() : List.copyOf(processTerms);
    pathologyTerms = pathologyTerms == null ? List.of() : List.copyOf(pathologyTerms);
    diseaseContextTerms =
        diseaseContextTerms == null ? List.of() : List.copyOf(diseaseContextTerms);
    negativeTerms = negativeTerms == null ? List.of() : List.copyOf(negativeTerms);
    diseaseContexts = diseaseContexts == null ? List.of() : List.copyOf(diseaseContexts);
  }

  public List<String> terms(LexiconCategory category) {
    return switch (category) {
      case DIRECT -> directTerms;
      case PROCESS -> processTerms;
      case PATHOLOGY -> pathologyTerms;
      case DISEASE_CONTEXT -> diseaseContextTerms;
      case NEGATIVE -> negativeTerms;
    };
  }

  public Map<LexiconCategory, Integer> sizes() {
    return Map.of(
        LexiconCategory.DIRECT, directTerms.size(),
        LexiconCategory.PROCESS, processTerms.size(),
        LexiconCategory.PATHOLOGY, pathologyTerms.size(),
        LexiconCategory.DISEASE_CONTEXT, diseaseContextTerms.size(),
        LexiconCategory.NEGATIVE, negativeTerms.size());
  }
}
