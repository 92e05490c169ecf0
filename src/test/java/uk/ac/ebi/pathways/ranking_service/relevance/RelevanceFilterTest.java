package uk.ac.ebi.pathways.ranking_service.relevance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.aggregatedPathway;
import static uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory.genes;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.ac.ebi.pathways.ranking_service.PathwayHitTestDataFactory;
import uk.ac.ebi.pathways.ranking_service.analysis.PathwayTextAnalyzer;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.CategoryValues;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.RelevanceSettings;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.model.RelevanceAnnotation;

class RelevanceFilterTest {

  private RelevanceFilter filter;
  private CompiledLexicon lexicon;
  private RelevanceSettings settings;

  @BeforeEach
  void setUp() {
    TermMatcher matcher = new TermMatcher(new PathwayTextAnalyzer());
    filter = new RelevanceFilter(new RelevanceScorer(matcher));
    lexicon = matcher.compileLexicon(PathwayHitTestDataFactory.cardiacLexicon());
    settings = RankingSettings.defaults().relevance();
  }

  @Nested
  @DisplayName("Relevance gate")
  class Gate {

    @Test
    void pathwayWithDirectTermInNameSurvives() {
      FilterResult result =
          filter.filter(List.of(pathway("Cardiac muscle contraction")), null, lexicon, settings);

      assertThat(result.survivors()).hasSize(1);
      assertThat(result.survivors().get(0).relevance().matchedDirectTerms())
          .containsExactly("cardiac");
    }

    @Test
    void directTermInDescriptionOnlyDoesNotPass() {
      AggregatedPathway pathway =
          pathway("Calcium signaling").toBuilder()
              .description("Calcium handling in the heart")
              .build();

      FilterResult result = filter.filter(List.of(pathway), null, lexicon, settings);

      assertThat(result.survivors()).isEmpty();
      assertThat(result.excluded()).hasSize(1);
      assertThat(result.excluded().get(0).relevance().relevanceScore()).isGreaterThan(0.0);
    }

    @Test
    void boostedOffTopicPathwayIsStillExcluded() {
      RelevanceSettings generous =
          new RelevanceSettings(
              new CategoryValues(0.2, 0.4, 0.1, 0.15),
              new CategoryValues(0.5, 0.5, 0.2, 0.3),
              1.8,
              0.5);

      FilterResult result =
          filter.filter(List.of(pathway("phosphorylation")), "heart failure", lexicon, generous);

      assertThat(result.survivors()).isEmpty();
      RelevanceAnnotation relevance = result.excluded().get(0).relevance();
      assertThat(relevance.diseaseContextBoostApplied()).isTrue();
      assertThat(relevance.relevanceScore()).isGreaterThan(0.5);
      assertThat(relevance.passesGate()).isFalse();
    }

    @Test
    void everySurvivorHasADirectTermInItsName() {
      List<AggregatedPathway> pathways =
          List.of(
              pathway("heart development"),
              pathway("Heartbeat"),
              pathway("cardiovascular system development"),
              pathway("regulation of myocardial contraction"),
              pathway("neuron projection"),
              pathway("protein phosphorylation"));

      FilterResult result = filter.filter(pathways, "heart failure", lexicon, settings);

      assertThat(result.survivingPathways())
          .extracting(AggregatedPathway::name)
          .containsExactly(
              "heart development",
              "cardiovascular system development",
              "regulation of myocardial contraction");
      assertThat(result.survivors()).allMatch(p -> p.relevance().passesGate());
      assertThat(result.excluded()).noneMatch(p -> p.relevance().passesGate());
    }

    @Test
    void filteringIsIdempotent() {
      List<AggregatedPathway> pathways =
          List.of(
              pathway("heart development"),
              pathway("neuron projection"),
              pathway("cardiac neuron development"));

      FilterResult once = filter.filter(pathways, "heart failure", lexicon, settings);
      FilterResult twice =
          filter.filter(once.survivingPathways(), "heart failure", lexicon, settings);

      assertThat(twice.survivors()).isEqualTo(once.survivors());
      assertThat(twice.excluded()).isEmpty();
    }

    @Test
    void noSurvivorsGivesAnEmptyResult() {
      FilterResult result =
          filter.filter(List.of(pathway("protein phosphorylation")), null, lexicon, settings);

      assertThat(result.isEmpty()).isTrue();
    }
  }

  @Nested
  @DisplayName("Relevance score")
  class Score {

    @Test
    void categoriesAddUp() {
      RelevanceAnnotation relevance = score("Cardiac muscle contraction", null);

      assertThat(relevance.breakdown().directTerm()).isCloseTo(0.20, within(1e-12));
      assertThat(relevance.breakdown().processTerm()).isCloseTo(0.08, within(1e-12));
      assertThat(relevance.breakdown().negativePenalty()).isEqualTo(1.0);
      assertThat(relevance.relevanceScore()).isCloseTo(0.28, within(1e-12));
      assertThat(relevance.diseaseContextBoostApplied()).isFalse();
    }

    @Test
    void categoryScoresAreCapped() {
      RelevanceAnnotation relevance = score("cardiac heart myocardial cardiomyopathy", null);

      assertThat(relevance.breakdown().directTerm()).isEqualTo(settings.caps().direct());
    }

    @Test
    void diseaseContextTermBoostsTheScore() {
      RelevanceAnnotation plain = score("Cardiac contractility regulation", null);
      RelevanceAnnotation boosted = score("Cardiac contractility regulation", "heart failure");

      assertThat(boosted.diseaseContextBoostApplied()).isTrue();
      assertThat(boosted.relevanceScore())
          .isCloseTo(plain.relevanceScore() * settings.diseaseContextBoost(), within(1e-12));
    }

    @Test
    void contextSynonymSelectsTheContext() {
      List<AggregatedPathway> pathways = List.of(pathway("Cardiac contractility regulation"));

      FilterResult result = filter.filter(pathways, "HF", lexicon, settings);

      assertThat(result.contextTerms()).contains("heart failure", "contractility");
      assertThat(result.survivors().get(0).relevance().diseaseContextBoostApplied()).isTrue();
    }

    @Test
    void unknownContextAppliesNoBoost() {
      RelevanceAnnotation relevance = score("Cardiac contractility regulation", "osteoporosis");

      assertThat(relevance.diseaseContextBoostApplied()).isFalse();
    }

    @Test
    void negativeTermAppliesThePenalty() {
      RelevanceAnnotation relevance = score("Cardiac neuron development", null);

      assertThat(relevance.breakdown().negativePenalty()).isEqualTo(settings.negativePenalty());
      assertThat(relevance.relevanceScore()).isCloseTo(0.28 * 0.5, within(1e-12));
      assertThat(relevance.passesGate()).isTrue();
    }

    @Test
    void scoreNeverExceedsOne() {
      RelevanceSettings strong =
          new RelevanceSettings(
              new CategoryValues(1.0, 1.0, 1.0, 1.0),
              new CategoryValues(1.0, 1.0, 1.0, 1.0),
              2.0,
              1.0);

      RelevanceAnnotation relevance =
          filter
              .filter(
                  List.of(pathway("Cardiac hypertrophy in heart failure")),
                  "heart failure",
                  lexicon,
                  strong)
              .survivors()
              .get(0)
              .relevance();

      assertThat(relevance.relevanceScore()).isEqualTo(1.0);
    }

    private RelevanceAnnotation score(String name, String diseaseContext) {
      FilterResult result =
          filter.filter(List.of(pathway(name)), diseaseContext, lexicon, settings);
      return result.survivors().isEmpty()
          ? result.excluded().get(0).relevance()
          : result.survivors().get(0).relevance();
    }
  }

  private static AggregatedPathway pathway(String name) {
    return aggregatedPathway("ID:" + name.hashCode(), name, 0.01, 1, genes("G", 5));
  }
}
