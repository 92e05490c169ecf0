package uk.ac.ebi.pathways.ranking_service.relevance;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link TermLexicon} with every term tokenized, ready for matching. Immutable, safe to share
 * between concurrent runs.
 */
public final class CompiledLexicon {

  private final Map<LexiconCategory, List<LexiconTerm>> terms;
  private final List<CompiledDiseaseContext> diseaseContexts;

  CompiledLexicon(
      Map<LexiconCategory, List<LexiconTerm>> terms, List<CompiledDiseaseContext> diseaseContexts) {
    EnumMap<LexiconCategory, List<LexiconTerm>> copy = new EnumMap<>(LexiconCategory.class);
    for (LexiconCategory category : LexiconCategory.values()) {
      copy.put(category, List.copyOf(terms.getOrDefault(category, List.of())));
    }
    this.terms = copy;
    this.diseaseContexts = List.copyOf(diseaseContexts);
  }

  public List<LexiconTerm> terms(LexiconCategory category) {
    return terms.get(category);
  }

  public List<CompiledDiseaseContext> diseaseContexts() {
    return diseaseContexts;
  }

  /**
   * A disease context with its labels and terms tokenized.
   *
   * @param label the context label
   * @param labels the label and its synonyms
   * @param terms pathway terms indicating the context
   */
  public record CompiledDiseaseContext(
      String label, List<LexiconTerm> labels, List<LexiconTerm> terms) {

    public CompiledDiseaseContext {
      labels = List.copyOf(labels);
      terms = List.copyOf(terms);
    }
  }
}
