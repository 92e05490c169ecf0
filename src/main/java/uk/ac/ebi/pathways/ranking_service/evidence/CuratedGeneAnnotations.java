package uk.ac.ebi.pathways.ranking_service.evidence;

import static uk.ac.ebi.pathways.ranking_service.Constants.GENES_PREFIX;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.config.RankingProperties;
import uk.ac.ebi.pathways.ranking_service.evidence.dto.GeneAnnotationsDto;
import uk.ac.ebi.pathways.ranking_service.exceptions.RankingConfigurationException;
import uk.ac.ebi.pathways.ranking_service.model.DruggabilityTier;
import uk.ac.ebi.pathways.ranking_service.util.GeneSymbols;

/**
 * Curated domain gene scores and druggability tiers, read from {@code
 * ranking.genes.annotations-location}.
 *
 * <p>The table is loaded once, at startup or on first lookup, and is read-only afterwards. When a
 * gene appears in several druggability lists the most advanced tier wins.
 */
@Slf4j
@Component
public class CuratedGeneAnnotations implements DomainGeneScoreProvider, DruggabilityProvider {

  private final ResourceLoader resourceLoader;
  private final RankingProperties properties;
  private final ObjectMapper objectMapper = new ObjectMapper();

  private volatile Annotations annotations;

  public CuratedGeneAnnotations(ResourceLoader resourceLoader, RankingProperties properties) {
    this.resourceLoader = resourceLoader;
    this.properties = properties;
  }

  /**
   * Loads the annotation table from the configured location.
   *
   * @throws IllegalStateException if the resource cannot be read or holds a score outside [0, 1]
   */
  public synchronized void load() {
    String location = properties.getGenes().getAnnotationsLocation();
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      log.error("Gene annotation resource not found: {}", location);
      throw new IllegalStateException("Resource not found: " + location);
    }

    GeneAnnotationsDto dto;
    try (InputStream in = resource.getInputStream()) {
      dto = objectMapper.readValue(in, GeneAnnotationsDto.class);
    } catch (IOException e) {
      log.error("Failed to read gene annotations from {}", location, e);
      throw new IllegalStateException("Failed to read resource: " + location, e);
    }

    annotations = toAnnotations(dto);
    log.info(
        "Loaded {} curated domain gene scores and {} druggability tiers from {}",
        annotations.scores().size(),
        annotations.tiers().size(),
        location);
  }

  @Override
  public OptionalDouble domainScore(String gene) {
    Double score = current().scores().get(GeneSymbols.normalize(gene));
    return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
  }

  @Override
  public Optional<DruggabilityTier> druggability(String gene) {
    return Optional.ofNullable(current().tiers().get(GeneSymbols.normalize(gene)));
  }

  private Annotations current() {
    Annotations current = annotations;
    if (current == null) {
      synchronized (this) {
        if (annotations == null) {
          load();
        }
        current = annotations;
      }
    }
    return current;
  }

  private Annotations toAnnotations(GeneAnnotationsDto dto) {
    Map<String, Double> scores = new HashMap<>();
    if (dto.getDomainScores() != null) {
      for (Map.Entry<String, Double> entry : dto.getDomainScores().entrySet()) {
        Double score = entry.getValue();
        if (score == null || !Double.isFinite(score) || score < 0.0 || score > 1.0) {
          throw new RankingConfigurationException(
              GENES_PREFIX + ".annotations-location",
              "holds a domain score outside [0, 1] for " + entry.getKey() + ": " + score);
        }
        String gene = GeneSymbols.normalize(entry.getKey());
        if (gene != null) {
          scores.put(gene, score);
        }
      }
    }

    Map<String, DruggabilityTier> tiers = new HashMap<>();
    GeneAnnotationsDto.DruggabilityDto druggability = dto.getDruggability();
    if (druggability != null) {
      // most advanced tier first, later lists never overwrite
      addTier(tiers, druggability.getApproved(), DruggabilityTier.APPROVED);
      addTier(tiers, druggability.getClinicalTrial(), DruggabilityTier.CLINICAL_TRIAL);
      addTier(tiers, druggability.getDruggable(), DruggabilityTier.DRUGGABLE);
    }
    return new Annotations(
        Collections.unmodifiableMap(scores), Collections.unmodifiableMap(tiers));
  }

  private static void addTier(
      Map<String, DruggabilityTier> tiers, List<String> genes, DruggabilityTier tier) {
    if (genes == null) {
      return;
    }
    for (String gene : genes) {
      String symbol = GeneSymbols.normalize(gene);
      if (symbol != null) {
        tiers.putIfAbsent(symbol, tier);
      }
    }
  }

  private record Annotations(Map<String, Double> scores, Map<String, DruggabilityTier> tiers) {}
}
