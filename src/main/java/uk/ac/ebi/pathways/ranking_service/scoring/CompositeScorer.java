package uk.ac.ebi.pathways.ranking_service.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.ScoringSettings;
import uk.ac.ebi.pathways.ranking_service.evidence.EvidenceProviders;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.model.ScoreComponents;
import uk.ac.ebi.pathways.ranking_service.model.ScoredHypothesis;
import uk.ac.ebi.pathways.ranking_service.relevance.AnnotatedPathway;

/**
 * Computes the composite score of every surviving pathway and ranks them.
 *
 * <pre>
 * composite = -log10(max(p, ε)) × min(n / K, cap) × dbWeight × aggregationWeight × (1 + relevance)
 *           + tissueBonus + literatureBonus
 * </pre>
 *
 * <p>The auxiliary bonuses are additive and individually capped, so missing auxiliary data never
 * zeroes a strong statistical result. A provider that fails is logged and treated as having no
 * data.
 */
@Slf4j
@Component
public class CompositeScorer {

  private static final double LN_5 = Math.log(5.0);

  /**
   * Scores and ranks pathways.
   *
   * @param pathways the pathways that passed the relevance gate
   * @param providers auxiliary evidence of the run
   * @param settings scoring settings of the run
   * @return the hypotheses in rank order, ranks starting at 1
   */
  public List<ScoredHypothesis> score(
      List<AnnotatedPathway> pathways, EvidenceProviders providers, ScoringSettings settings) {
    Objects.requireNonNull(pathways, "Pathways must not be null");
    Objects.requireNonNull(settings, "Scoring settings must not be null");
    EvidenceProviders evidence = providers == null ? EvidenceProviders.none() : providers;

    List<ScoredHypothesis> scored = new ArrayList<>(pathways.size());
    for (AnnotatedPathway annotated : pathways) {
      scored.add(scoreOne(annotated, evidence, settings));
    }
    scored.sort(HypothesisOrdering.RANK_ORDER);

    List<ScoredHypothesis> ranked = new ArrayList<>(scored.size());
    for (int i = 0; i < scored.size(); i++) {
      ranked.add(scored.get(i).withRank(i + 1));
    }
    log.info("Scored and ranked {} pathway hypotheses", ranked.size());
    return List.copyOf(ranked);
  }

  private ScoredHypothesis scoreOne(
      AnnotatedPathway annotated, EvidenceProviders evidence, ScoringSettings settings) {
    AggregatedPathway pathway = annotated.pathway();

    double pValueComponent =
        Math.max(0.0, -Math.log10(Math.max(pathway.combinedPValue(), settings.epsilon())));
    double evidenceComponent =
        Math.min(
            pathway.evidenceGenes().size() / settings.evidenceDivisor(), settings.evidenceCap());
    double dbWeight = settings.dbWeight(pathway.sourceDb());
    double aggregationWeight = aggregationWeight(pathway.supportCount(), settings);
    double relevanceBoost = 1.0 + annotated.relevance().relevanceScore();

    Double tissueRatio = tissueRatio(pathway, evidence);
    Integer citations = citationCount(pathway, evidence);
    double tissueBonus = 0.0;
    if (tissueRatio != null && Double.isFinite(tissueRatio) && tissueRatio > 0.0) {
      tissueBonus = Math.min(tissueRatio * settings.tissueBonusWeight(), settings.tissueBonusCap());
    }
    double literatureBonus = 0.0;
    if (citations != null && citations > 0) {
      literatureBonus =
          Math.min(
              Math.log1p(citations) * settings.literatureBonusWeight(),
              settings.literatureBonusCap());
    }

    ScoreComponents components =
        ScoreComponents.builder()
            .pValueComponent(pValueComponent)
            .evidenceComponent(evidenceComponent)
            .dbWeight(dbWeight)
            .aggregationWeight(aggregationWeight)
            .relevanceBoost(relevanceBoost)
            .tissueSpecificityRatio(tissueRatio)
            .literatureCitationCount(citations)
            .tissueBonus(tissueBonus)
            .literatureBonus(literatureBonus)
            .build();
    double composite = components.statisticalScore() + tissueBonus + literatureBonus;
    double domainGeneScore =
        PathwayDomainScore.compute(pathway.evidenceGenes(), evidence.domainGeneScores());

    log.debug("Pathway {} scored {}: {}", pathway.canonicalId(), composite, components);
    return new ScoredHypothesis(
        0,
        pathway,
        annotated.relevance(),
        components,
        composite,
        domainGeneScore,
        pathway.toLineage());
  }

  /** {@code 1 + 0.5 ln(s) / ln(5)}, capped: 1.0 for one hit, 1.5 at five. */
  static double aggregationWeight(int supportCount, ScoringSettings settings) {
    double weight = 1.0 + 0.5 * Math.log(Math.max(1, supportCount)) / LN_5;
    return Math.min(weight, settings.aggregationWeightCap());
  }

  private Double tissueRatio(AggregatedPathway pathway, EvidenceProviders evidence) {
    if (evidence.tissueSpecificity() == null) {
      return null;
    }
    try {
      OptionalDouble ratio =
          evidence.tissueSpecificity().tissueSpecificityRatio(pathway.evidenceGenes());
      return ratio.isPresent() ? ratio.getAsDouble() : null;
    } catch (RuntimeException e) {
      log.warn(
          "Tissue specificity lookup failed for {}, treating it as no data: {}",
          pathway.canonicalId(),
          e.getMessage());
      return null;
    }
  }

  private Integer citationCount(AggregatedPathway pathway, EvidenceProviders evidence) {
    if (evidence.literatureCitations() == null) {
      return null;
    }
    try {
      OptionalInt count =
          evidence
              .literatureCitations()
              .citationCount(pathway.name(), pathway.contributingSeedGenes());
      return count.isPresent() ? count.getAsInt() : null;
    } catch (RuntimeException e) {
      log.warn(
          "Literature lookup failed for {}, treating it as no data: {}",
          pathway.canonicalId(),
          e.getMessage());
      return null;
    }
  }
}
