package uk.ac.ebi.pathways.ranking_service.relevance;

import static uk.ac.ebi.pathways.ranking_service.Constants.RELEVANCE_PREFIX;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.analysis.PathwayTextAnalyzer;
import uk.ac.ebi.pathways.ranking_service.exceptions.RankingConfigurationException;

/**
 * Word-boundary matching of lexicon terms against pathway text.
 *
 * <p>Text and terms are tokenized by the same {@link PathwayTextAnalyzer}; a term matches when
 * all its tokens appear consecutively in the text. "heart" matches "Heart development" but not
 * "Heartbeat", while "cardio*" matches both "cardiomyopathy" and "Cardiovascular system".
 */
@Slf4j
@Component
public class TermMatcher {

  private static final String PREFIX_MARKER = "*";

  private final PathwayTextAnalyzer analyzer;

  public TermMatcher(PathwayTextAnalyzer analyzer) {
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
  }

  public List<String> tokenize(String text) {
    return analyzer.tokenize(text);
  }

  /**
   * Tokenizes a single lexicon term.
   *
   * @param term the term, optionally ending in {@code *}
   * @return the compiled term, or {@code null} when the term holds no word characters
   */
  public LexiconTerm compile(String term) {
    if (term == null || term.isBlank()) {
      return null;
    }
    String text = term.trim();
    boolean prefix = text.endsWith(PREFIX_MARKER);
    String body = prefix ? text.substring(0, text.length() - PREFIX_MARKER.length()) : text;
    List<String> tokens = analyzer.tokenize(body);
    if (tokens.isEmpty()) {
      log.warn("Ignoring lexicon term '{}' without word characters", term);
      return null;
    }
    return new LexiconTerm(text, tokens, prefix);
  }

  /** Compiles every term, dropping unusable and repeated ones while keeping the order. */
  public List<LexiconTerm> compileAll(List<String> terms) {
    Map<String, LexiconTerm> compiled = new LinkedHashMap<>();
    for (String term : terms) {
      LexiconTerm lexiconTerm = compile(term);
      if (lexiconTerm != null) {
        compiled.putIfAbsent(key(lexiconTerm), lexiconTerm);
      }
    }
    return List.copyOf(compiled.values());
  }

  /**
   * Compiles a whole lexicon.
   *
   * @param lexicon the lexicon
   * @return the compiled lexicon
   * @throws RankingConfigurationException if the lexicon has no usable direct term, since the
   *     relevance gate could then never pass
   */
  public CompiledLexicon compileLexicon(TermLexicon lexicon) {
    Objects.requireNonNull(lexicon, "lexicon must not be null");

    Map<LexiconCategory, List<LexiconTerm>> terms = new EnumMap<>(LexiconCategory.class);
    for (LexiconCategory category : LexiconCategory.values()) {
      terms.put(category, compileAll(lexicon.terms(category)));
    }
    if (terms.get(LexiconCategory.DIRECT).isEmpty()) {
      throw new RankingConfigurationException(
          RELEVANCE_PREFIX + ".lexicon-location", "defines no usable direct_terms");
    }

    List<CompiledLexicon.CompiledDiseaseContext> contexts = new ArrayList<>();
    for (DiseaseContext context : lexicon.diseaseContexts()) {
      List<String> labels = new ArrayList<>();
      labels.add(context.label());
      labels.addAll(context.synonyms());
      contexts.add(
          new CompiledLexicon.CompiledDiseaseContext(
              context.label(), compileAll(labels), compileAll(context.terms())));
    }
    return new CompiledLexicon(terms, contexts);
  }

  /**
   * Returns the texts of the terms occurring in any of the token sequences, in term order.
   *
   * @param terms the terms to look for
   * @param texts analyzer tokens of each text field, matched separately
   */
  @SafeVarargs
  public final List<String> findMatches(List<LexiconTerm> terms, List<String>... texts) {
    List<String> matches = new ArrayList<>();
    for (LexiconTerm term : terms) {
      for (List<String> text : texts) {
        if (term.occursIn(text)) {
          matches.add(term.text());
          break;
        }
      }
    }
    return matches;
  }

  private static String key(LexiconTerm term) {
    return String.join(" ", term.tokens()) + (term.prefix() ? PREFIX_MARKER : "");
  }
}
