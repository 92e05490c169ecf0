package uk.ac.ebi.pathways.ranking_service.relevance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.RelevanceSettings;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.model.RelevanceAnnotation;

/**
 * Annotates pathways with their domain relevance and applies the relevance gate.
 *
 * <p>A pathway survives if and only if its name contains a direct lexicon term. The relevance
 * score orders the survivors later on but never decides inclusion, so a boosted score on an
 * off-topic pathway cannot let it through. The gate depends on the name alone, which makes
 * filtering an already filtered set a no-op.
 */
@Slf4j
@Component
public class RelevanceFilter {

  private final RelevanceScorer scorer;

  public RelevanceFilter(RelevanceScorer scorer) {
    this.scorer = scorer;
  }

  /**
   * Scores every pathway and splits them into survivors and excluded ones.
   *
   * @param pathways the pruned pathways
   * @param diseaseContext the requested disease context label, may be null
   * @param lexicon the lexicon of the run
   * @param settings relevance settings of the run
   * @return survivors and excluded pathways, each in input order
   */
  public FilterResult filter(
      Collection<AggregatedPathway> pathways,
      String diseaseContext,
      CompiledLexicon lexicon,
      RelevanceSettings settings) {
    Objects.requireNonNull(pathways, "Pathways must not be null");
    Objects.requireNonNull(lexicon, "Lexicon must not be null");
    Objects.requireNonNull(settings, "Relevance settings must not be null");

    List<LexiconTerm> contextTerms = scorer.resolveContextTerms(diseaseContext, lexicon);
    List<AnnotatedPathway> survivors = new ArrayList<>();
    List<AnnotatedPathway> excluded = new ArrayList<>();

    for (AggregatedPathway pathway : pathways) {
      RelevanceAnnotation relevance = scorer.score(pathway, contextTerms, lexicon, settings);
      AnnotatedPathway annotated = new AnnotatedPathway(pathway, relevance);
      if (relevance.passesGate()) {
        survivors.add(annotated);
      } else {
        log.debug(
            "Relevance gate rejected '{}' ({}), score {}",
            pathway.name(),
            pathway.canonicalId(),
            relevance.relevanceScore());
        excluded.add(annotated);
      }
    }

    log.info(
        "Relevance gate kept {} of {} pathways (disease context '{}', {} context terms)",
        survivors.size(),
        pathways.size(),
        diseaseContext,
        contextTerms.size());
    if (survivors.isEmpty() && !pathways.isEmpty()) {
      log.info("No pathway name contains a direct domain term");
    }
    return new FilterResult(survivors, excluded, RelevanceScorer.texts(contextTerms));
  }
}
