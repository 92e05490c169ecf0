package uk.ac.ebi.pathways.ranking_service.genes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.GeneRankingSettings;
import uk.ac.ebi.pathways.ranking_service.evidence.DruggabilityProvider;
import uk.ac.ebi.pathways.ranking_service.evidence.EvidenceProviders;
import uk.ac.ebi.pathways.ranking_service.model.DruggabilityTier;
import uk.ac.ebi.pathways.ranking_service.model.ImportantGene;
import uk.ac.ebi.pathways.ranking_service.model.ScoredHypothesis;
import uk.ac.ebi.pathways.ranking_service.scoring.PathwayDomainScore;

/**
 * Ranks the genes of the final pathways by frequency, pathway quality and curated domain score.
 *
 * <p>{@code importance = pathwayCount^1.2 × meanCompositeScore × (1 + domainScore)}, the exponent
 * being configurable. Ties are broken by the higher domain score, then by symbol.
 */
@Slf4j
@Component
public class ImportantGeneRanker {

  private static final Comparator<GeneStats> IMPORTANCE_ORDER =
      Comparator.comparingDouble(GeneStats::importance)
          .reversed()
          .thenComparing(Comparator.comparingDouble(GeneStats::domainScore).reversed())
          .thenComparing(GeneStats::symbol);

  /**
   * Ranks genes.
   *
   * @param hypotheses the final hypotheses in rank order
   * @param providers auxiliary evidence of the run; domain scores default to 0 without a provider
   * @param settings gene ranking settings of the run
   * @return the top genes, ranks starting at 1
   */
  public List<ImportantGene> rank(
      List<ScoredHypothesis> hypotheses,
      EvidenceProviders providers,
      GeneRankingSettings settings) {
    Objects.requireNonNull(hypotheses, "Hypotheses must not be null");
    Objects.requireNonNull(settings, "Gene ranking settings must not be null");
    EvidenceProviders evidence = providers == null ? EvidenceProviders.none() : providers;

    List<ScoredHypothesis> considered =
        hypotheses.subList(0, Math.min(settings.topPathways(), hypotheses.size()));

    Map<String, List<ScoredHypothesis>> pathwaysByGene = new TreeMap<>();
    for (ScoredHypothesis hypothesis : considered) {
      for (String gene : hypothesis.pathway().evidenceGenes()) {
        pathwaysByGene.computeIfAbsent(gene, g -> new ArrayList<>()).add(hypothesis);
      }
    }

    List<GeneStats> stats = new ArrayList<>(pathwaysByGene.size());
    for (Map.Entry<String, List<ScoredHypothesis>> entry : pathwaysByGene.entrySet()) {
      List<ScoredHypothesis> pathways = entry.getValue();
      int count = pathways.size();
      double mean =
          pathways.stream().mapToDouble(ScoredHypothesis::compositeScore).average().orElse(0.0);
      double domain = PathwayDomainScore.lookup(entry.getKey(), evidence.domainGeneScores());
      double importance = Math.pow(count, settings.pathwayCountExponent()) * mean * (1.0 + domain);
      List<String> ids = pathways.stream().map(ScoredHypothesis::canonicalId).toList();
      stats.add(new GeneStats(entry.getKey(), count, mean, domain, importance, ids));
    }
    stats.sort(IMPORTANCE_ORDER);

    int limit = Math.min(settings.topGenes(), stats.size());
    List<ImportantGene> genes = new ArrayList<>(limit);
    for (int i = 0; i < limit; i++) {
      GeneStats gene = stats.get(i);
      genes.add(
          new ImportantGene(
              i + 1,
              gene.symbol(),
              gene.pathwayCount(),
              gene.meanCompositeScore(),
              gene.domainScore(),
              gene.importance(),
              druggability(gene.symbol(), evidence.druggability()),
              gene.pathwayIds()));
    }
    log.info(
        "Ranked {} genes from {} pathways, returning {}",
        stats.size(),
        considered.size(),
        genes.size());
    return List.copyOf(genes);
  }

  private DruggabilityTier druggability(String gene, DruggabilityProvider provider) {
    if (provider == null) {
      return DruggabilityTier.UNKNOWN;
    }
    try {
      Optional<DruggabilityTier> tier = provider.druggability(gene);
      return tier == null ? DruggabilityTier.UNKNOWN : tier.orElse(DruggabilityTier.UNKNOWN);
    } catch (RuntimeException e) {
      log.warn(
          "Druggability lookup failed for {}, treating it as unknown: {}", gene, e.getMessage());
      return DruggabilityTier.UNKNOWN;
    }
  }

  private record GeneStats(
      String symbol,
      int pathwayCount,
      double meanCompositeScore,
      double domainScore,
      double importance,
      List<String> pathwayIds) {}
}
