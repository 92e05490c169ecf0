package uk.ac.ebi.pathways.ranking_service.aggregation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.Constants;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings.AggregationSettings;
import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.model.PathwayHit;
import uk.ac.ebi.pathways.ranking_service.model.PrimaryHit;
import uk.ac.ebi.pathways.ranking_service.model.SecondaryHit;
import uk.ac.ebi.pathways.ranking_service.util.GeneSymbols;

/**
 * Merges pathway hits that share a canonical pathway id into one {@link AggregatedPathway}.
 *
 * <p>Evidence from hits reached through different discovery paths is combined with Fisher's
 * method, so a pathway found independently several times ranks above one found once with the
 * same significance. Identical hit records are counted once.
 *
 * <p>A hit whose p-value is missing, not finite or outside [0, 1] keeps its genes and lineage but
 * contributes a p-value of {@value Constants#NO_EVIDENCE_P_VALUE}.
 */
@Slf4j
@Component
public class LineageAwareAggregator {

  /**
   * Aggregates validated hits.
   *
   * @param hits the hits, each carrying every required field
   * @param seedGenes the normalized seed genes of the run
   * @param settings aggregation settings of the run
   * @return the aggregated pathways and counters
   */
  public AggregationResult aggregate(
      List<PathwayHit> hits, Set<String> seedGenes, AggregationSettings settings) {
    Objects.requireNonNull(hits, "Pathway hits must not be null");
    Objects.requireNonNull(settings, "Aggregation settings must not be null");
    Set<String> seeds = seedGenes == null ? Set.of() : seedGenes;

    Set<PathwayHit> distinctHits = new LinkedHashSet<>(hits);
    int duplicates = hits.size() - distinctHits.size();
    if (duplicates > 0) {
      log.debug("Ignoring {} duplicate pathway hits", duplicates);
    }

    Map<String, List<PathwayHit>> groups = new LinkedHashMap<>();
    Set<String> primaryPathwayIds = new TreeSet<>();
    for (PathwayHit hit : distinctHits) {
      groups.computeIfAbsent(hit.sourcePathwayId(), id -> new ArrayList<>()).add(hit);
      primaryPathwayIds.add(primaryIdOf(hit));
    }
    int primaryCount = Math.max(1, primaryPathwayIds.size());

    AtomicInteger substituted = new AtomicInteger();
    int filtered = 0;
    Map<String, AggregatedPathway> pathways = new LinkedHashMap<>();
    for (Map.Entry<String, List<PathwayHit>> group : groups.entrySet()) {
      AggregatedPathway pathway =
          merge(group.getKey(), group.getValue(), seeds, primaryCount, settings, substituted);
      if (pathway.supportCount() < settings.minSupport()
          || pathway.combinedPValue() > settings.maxCombinedPValue()) {
        log.debug(
            "Filtered aggregated pathway {} (support {}, combined p {})",
            pathway.canonicalId(),
            pathway.supportCount(),
            pathway.combinedPValue());
        filtered++;
        continue;
      }
      pathways.put(pathway.canonicalId(), pathway);
    }

    AggregationStats stats =
        new AggregationStats(hits.size(), duplicates, substituted.get(), pathways.size(), filtered);
    log.info(
        "Aggregated {} pathway hits into {} pathways ({} filtered, {} p-values substituted)",
        hits.size(),
        pathways.size(),
        filtered,
        substituted.get());
    return new AggregationResult(pathways, stats);
  }

  private AggregatedPathway merge(
      String canonicalId,
      List<PathwayHit> group,
      Set<String> seeds,
      int primaryCount,
      AggregationSettings settings,
      AtomicInteger substituted) {
    PathwayHit first = group.get(0);
    String description = null;
    Set<String> evidenceGenes = new TreeSet<>();
    Set<String> primaryIds = new TreeSet<>();
    Set<String> contributingSeeds = new TreeSet<>();
    List<SecondaryHit> secondaries = new ArrayList<>();
    List<Double> pValues = new ArrayList<>(group.size());

    for (PathwayHit hit : group) {
      if (description == null && hit.description() != null && !hit.description().isBlank()) {
        description = hit.description();
      }
      if (hit.sourceDb() != first.sourceDb()) {
        log.debug(
            "Pathway {} reported by {} and {}, keeping {}",
            canonicalId,
            first.sourceDb(),
            hit.sourceDb(),
            first.sourceDb());
      }
      evidenceGenes.addAll(hit.evidenceGenes());
      primaryIds.add(primaryIdOf(hit));
      contributingSeeds.addAll(seedsOf(hit, seeds));
      if (hit instanceof SecondaryHit secondary) {
        secondaries.add(secondary);
      }
      pValues.add(usablePValue(hit, settings.minimumPValue(), substituted));
    }

    int support = group.size();
    double combinedPValue = FisherCombiner.combine(pValues, settings.minimumPValue());
    double consistency = FisherCombiner.consistency(pValues);
    double supportFraction = Math.min(1.0, (double) support / primaryCount);
    double evidenceFraction =
        Math.min(1.0, (double) evidenceGenes.size() / settings.evidenceSaturation());
    double confidence =
        settings.replicationWeight() * supportFraction
            + settings.significanceWeight() * (1.0 - combinedPValue)
            + settings.evidenceWeight() * evidenceFraction
            + settings.consistencyWeight() * consistency;

    return AggregatedPathway.builder()
        .canonicalId(canonicalId)
        .name(first.name())
        .description(description)
        .sourceDb(first.sourceDb())
        .evidenceGenes(GeneSymbols.normalizeAll(evidenceGenes))
        .supportCount(support)
        .sourcePrimaryPathwayIds(Collections.unmodifiableSet(primaryIds))
        .sourceSecondaryInstances(secondaries)
        .hitPValues(pValues)
        .combinedPValue(combinedPValue)
        .aggregationScore(confidence)
        .consistencyScore(consistency)
        .confidenceScore(confidence)
        .supportFraction(supportFraction)
        .contributingSeedGenes(GeneSymbols.normalizeAll(contributingSeeds))
        .build();
  }

  private static String primaryIdOf(PathwayHit hit) {
    return switch (hit.discoveryPath()) {
      case PRIMARY -> hit.sourcePathwayId();
      case SECONDARY -> ((SecondaryHit) hit).originPrimaryPathwayId();
    };
  }

  private static Set<String> seedsOf(PathwayHit hit, Set<String> seeds) {
    if (!hit.contributingSeedGenes().isEmpty() || !(hit instanceof PrimaryHit)) {
      return hit.contributingSeedGenes();
    }
    Set<String> found = new TreeSet<>(hit.evidenceGenes());
    found.retainAll(seeds);
    return found;
  }

  private double usablePValue(PathwayHit hit, double minimumPValue, AtomicInteger substituted) {
    Double p = hit.pValue();
    if (p == null || !Double.isFinite(p) || p < 0.0 || p > 1.0) {
      log.warn(
          "Unusable p-value {} for pathway hit {}, treating it as no evidence",
          p,
          hit.sourcePathwayId());
      substituted.incrementAndGet();
      return Constants.NO_EVIDENCE_P_VALUE;
    }
    if (p < minimumPValue) {
      return minimumPValue;
    }
    return p;
  }
}
