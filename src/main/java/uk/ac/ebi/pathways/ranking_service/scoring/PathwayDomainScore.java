package uk.ac.ebi.pathways.ranking_service.scoring;

import static uk.ac.ebi.pathways.ranking_service.Constants.DOMAIN_SCORE_DECAY;
import static uk.ac.ebi.pathways.ranking_service.Constants.DOMAIN_SCORE_TOP_GENES;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;
import uk.ac.ebi.pathways.ranking_service.evidence.DomainGeneScoreProvider;

/**
 * Summarises the curated domain scores of a pathway's evidence genes.
 *
 * <p>Takes the {@value uk.ac.ebi.pathways.ranking_service.Constants#DOMAIN_SCORE_TOP_GENES}
 * highest positive scores and returns their weighted mean, the i-th best gene weighing {@code
 * 0.9^i}. Uncurated genes are ignored; a pathway without curated genes scores 0.
 */
@Slf4j
public final class PathwayDomainScore {

  private PathwayDomainScore() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  public static double compute(Collection<String> genes, DomainGeneScoreProvider provider) {
    if (provider == null || genes.isEmpty()) {
      return 0.0;
    }
    List<Double> scores = new ArrayList<>();
    for (String gene : genes) {
      double score = lookup(gene, provider);
      if (score > 0.0) {
        scores.add(score);
      }
    }
    if (scores.isEmpty()) {
      return 0.0;
    }
    scores.sort(Comparator.reverseOrder());

    double weightedSum = 0.0;
    double weightSum = 0.0;
    double weight = 1.0;
    for (int i = 0; i < Math.min(DOMAIN_SCORE_TOP_GENES, scores.size()); i++) {
      weightedSum += scores.get(i) * weight;
      weightSum += weight;
      weight *= DOMAIN_SCORE_DECAY;
    }
    return weightedSum / weightSum;
  }

  /**
   * Looks up the domain score of one gene.
   *
   * <p>Non-finite scores are ignored and finite ones are clamped to [0, 1]. A provider that fails
   * is logged and treated as having no data for the gene.
   *
   * @param gene normalized gene symbol
   * @param provider the curated lookup, may be null
   * @return the score in [0, 1], 0 without data
   */
  public static double lookup(String gene, DomainGeneScoreProvider provider) {
    if (provider == null) {
      return 0.0;
    }
    OptionalDouble score;
    try {
      score = provider.domainScore(gene);
    } catch (RuntimeException e) {
      log.warn(
          "Domain score lookup failed for {}, treating it as no data: {}", gene, e.getMessage());
      return 0.0;
    }
    if (score == null || score.isEmpty() || !Double.isFinite(score.getAsDouble())) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, score.getAsDouble()));
  }
}
