package uk.ac.ebi.pathways.ranking_service.relevance;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.CategoryValues;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.RelevanceSettings;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.model.RelevanceAnnotation;
import uk.ac.ebi.pathways.ranking_service.model.RelevanceBreakdown;

/**
 * Computes the domain relevance of a pathway from its name and description.
 *
 * <p>Each category scores {@code min(matches * weight, cap)}. The sum is multiplied by the
 * disease context boost when a term of the requested context occurs, and by the negative penalty
 * when a negative term occurs, then clamped to [0, 1].
 *
 * <p>The gate is decided separately: only direct terms found in the pathway name count, whatever
 * the score.
 */
@Slf4j
@Component
public class RelevanceScorer {

  private final TermMatcher termMatcher;

  public RelevanceScorer(TermMatcher termMatcher) {
    this.termMatcher = termMatcher;
  }

  /**
   * Resolves the pathway terms that indicate the requested disease context.
   *
   * <p>These are the generic disease context terms occurring in the label, plus the terms of every
   * configured context whose label or synonym occurs in it.
   *
   * @param diseaseContext the free text label, may be null
   * @param lexicon the lexicon of the run
   * @return the context terms, empty when the label is blank or unknown
   */
  public List<LexiconTerm> resolveContextTerms(String diseaseContext, CompiledLexicon lexicon) {
    List<String> labelTokens = termMatcher.tokenize(diseaseContext);
    if (labelTokens.isEmpty()) {
      return List.of();
    }
    Map<String, LexiconTerm> resolved = new LinkedHashMap<>();
    for (LexiconTerm term : lexicon.terms(LexiconCategory.DISEASE_CONTEXT)) {
      if (term.occursIn(labelTokens)) {
        resolved.putIfAbsent(term.text(), term);
      }
    }
    for (CompiledLexicon.CompiledDiseaseContext context : lexicon.diseaseContexts()) {
      boolean selected = context.labels().stream().anyMatch(label -> label.occursIn(labelTokens));
      if (selected) {
        context.labels().forEach(term -> resolved.putIfAbsent(term.text(), term));
        context.terms().forEach(term -> resolved.putIfAbsent(term.text(), term));
      }
    }
    if (resolved.isEmpty()) {
      log.debug("Disease context '{}' matches no lexicon context", diseaseContext);
    }
    return List.copyOf(resolved.values());
  }

  /**
   * Scores one pathway.
   *
   * @param pathway the pathway
   * @param contextTerms terms of the requested disease context, see {@link
   *     #resolveContextTerms(String, CompiledLexicon)}
   * @param lexicon the lexicon of the run
   * @param settings relevance settings of the run
   * @return the relevance annotation
   */
  public RelevanceAnnotation score(
      AggregatedPathway pathway,
      List<LexiconTerm> contextTerms,
      CompiledLexicon lexicon,
      RelevanceSettings settings) {
    List<String> name = termMatcher.tokenize(pathway.name());
    List<String> description = termMatcher.tokenize(pathway.description());

    List<String> directInName =
        termMatcher.findMatches(lexicon.terms(LexiconCategory.DIRECT), name);
    int direct = count(lexicon, LexiconCategory.DIRECT, name, description);
    int process = count(lexicon, LexiconCategory.PROCESS, name, description);
    int pathology = count(lexicon, LexiconCategory.PATHOLOGY, name, description);
    int diseaseContext = count(lexicon, LexiconCategory.DISEASE_CONTEXT, name, description);
    boolean negative = count(lexicon, LexiconCategory.NEGATIVE, name, description) > 0;
    boolean boosted =
        !contextTerms.isEmpty()
            && !termMatcher.findMatches(contextTerms, name, description).isEmpty();

    CategoryValues weights = settings.weights();
    CategoryValues caps = settings.caps();
    double penalty = negative ? settings.negativePenalty() : 1.0;
    RelevanceBreakdown breakdown =
        new RelevanceBreakdown(
            capped(direct, weights.direct(), caps.direct()),
            capped(process, weights.process(), caps.process()),
            capped(pathology, weights.pathology(), caps.pathology()),
            capped(diseaseContext, weights.diseaseContext(), caps.diseaseContext()),
            penalty);

    double score = breakdown.rawScore();
    if (boosted) {
      score *= settings.diseaseContextBoost();
    }
    score *= penalty;
    score = Math.max(0.0, Math.min(1.0, score));

    return new RelevanceAnnotation(
        score, !directInName.isEmpty(), breakdown, boosted, directInName);
  }

  private int count(
      CompiledLexicon lexicon,
      LexiconCategory category,
      List<String> name,
      List<String> description) {
    return termMatcher.findMatches(lexicon.terms(category), name, description).size();
  }

  private static double capped(int matches, double weight, double cap) {
    return Math.min(matches * weight, cap);
  }

  /** Returns the texts of the given terms, for reporting. */
  static List<String> texts(List<LexiconTerm> terms) {
    List<String> texts = new ArrayList<>(terms.size());
    terms.forEach(term -> texts.add(term.text()));
    return texts;
  }
}
