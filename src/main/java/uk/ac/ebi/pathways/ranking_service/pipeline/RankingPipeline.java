package uk.ac.ebi.pathways.ranking_service.pipeline;

import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import uk.ac.ebi.pathways.ranking_service.aggregation.AggregationResult;
import uk.ac.ebi.pathways.ranking_service.aggregation.HitValidationResult;
import uk.ac.ebi.pathways.ranking_service.aggregation.HitValidator;
import uk.ac.ebi.pathways.ranking_service.aggregation.LineageAwareAggregator;
import uk.ac.ebi.pathways.ranking_service.config.RankingConfigValidator;
import uk.ac.ebi.pathways.ranking_service.config.RankingProperties;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings;
import uk.ac.ebi.pathways.ranking_service.evidence.DomainGeneScoreProvider;
import uk.ac.ebi.pathways.ranking_service.evidence.DruggabilityProvider;
import uk.ac.ebi.pathways.ranking_service.evidence.EvidenceProviders;
import uk.ac.ebi.pathways.ranking_service.evidence.LiteratureCitationProvider;
import uk.ac.ebi.pathways.ranking_service.evidence.TissueSpecificityProvider;
import uk.ac.ebi.pathways.ranking_service.genes.ImportantGeneRanker;
import uk.ac.ebi.pathways.ranking_service.model.ImportantGene;
import uk.ac.ebi.pathways.ranking_service.model.ScoredHypothesis;
import uk.ac.ebi.pathways.ranking_service.pruning.PruningResult;
import uk.ac.ebi.pathways.ranking_service.pruning.RedundancyPruner;
import uk.ac.ebi.pathways.ranking_service.relevance.CompiledLexicon;
import uk.ac.ebi.pathways.ranking_service.relevance.FilterResult;
import uk.ac.ebi.pathways.ranking_service.relevance.LexiconRegistry;
import uk.ac.ebi.pathways.ranking_service.relevance.RelevanceFilter;
import uk.ac.ebi.pathways.ranking_service.relevance.TermMatcher;
import uk.ac.ebi.pathways.ranking_service.scoring.CompositeScorer;

/**
 * Runs the ranking engine: hits, then aggregation, pruning, relevance filtering, scoring and gene
 * ranking.
 *
 * <p>Each stage takes the complete immutable output of the previous one. The settings, lexicon and
 * evidence providers of a run are resolved once at its start and passed explicitly to every stage,
 * so concurrent runs share no mutable state.
 *
 * <p>Settings are validated when the bean starts and again before each run touches any hit; an
 * invalid value raises {@link
 * uk.ac.ebi.pathways.ranking_service.exceptions.RankingConfigurationException}. Malformed hits are
 * excluded and reported. A run where no pathway passes the relevance gate completes with {@link
 * RankingStatus#NO_RELEVANT_PATHWAYS}.
 */
@Slf4j
@Service
public class RankingPipeline {

  private final RankingProperties properties;
  private final RankingConfigValidator configValidator;
  private final HitValidator hitValidator;
  private final LineageAwareAggregator aggregator;
  private final RedundancyPruner pruner;
  private final RelevanceFilter relevanceFilter;
  private final CompositeScorer scorer;
  private final ImportantGeneRanker geneRanker;
  private final LexiconRegistry lexiconRegistry;
  private final TermMatcher termMatcher;
  private final ObjectProvider<TissueSpecificityProvider> tissueSpecificity;
  private final ObjectProvider<LiteratureCitationProvider> literatureCitations;
  private final ObjectProvider<DomainGeneScoreProvider> domainGeneScores;
  private final ObjectProvider<DruggabilityProvider> druggability;
  private final ObjectProvider<StageOutputListener> listeners;

  public RankingPipeline(
      RankingProperties properties,
      RankingConfigValidator configValidator,
      HitValidator hitValidator,
      LineageAwareAggregator aggregator,
      RedundancyPruner pruner,
      RelevanceFilter relevanceFilter,
      CompositeScorer scorer,
      ImportantGeneRanker geneRanker,
      LexiconRegistry lexiconRegistry,
      TermMatcher termMatcher,
      ObjectProvider<TissueSpecificityProvider> tissueSpecificity,
      ObjectProvider<LiteratureCitationProvider> literatureCitations,
      ObjectProvider<DomainGeneScoreProvider> domainGeneScores,
      ObjectProvider<DruggabilityProvider> druggability,
      ObjectProvider<StageOutputListener> listeners) {
    this.properties = properties;
    this.configValidator = configValidator;
    this.hitValidator = hitValidator;
    this.aggregator = aggregator;
    this.pruner = pruner;
    this.relevanceFilter = relevanceFilter;
    this.scorer = scorer;
    this.geneRanker = geneRanker;
    this.lexiconRegistry = lexiconRegistry;
    this.termMatcher = termMatcher;
    this.tissueSpecificity = tissueSpecificity;
    this.literatureCitations = literatureCitations;
    this.domainGeneScores = domainGeneScores;
    this.druggability = druggability;
    this.listeners = listeners;
  }

  /** Fails the application start when a configured value is invalid. */
  @PostConstruct
  public void validateConfiguration() {
    configValidator.validate(currentSettings());
    log.debug("Ranking configuration validated");
  }

  /**
   * Runs the ranking engine on one request.
   *
   * @param request the request
   * @return the ranked hypotheses and genes, with every intermediate stage output
   * @throws uk.ac.ebi.pathways.ranking_service.exceptions.RankingConfigurationException if the
   *     settings or lexicon of the run are invalid
   */
  public RankingResult run(AnalysisRequest request) {
    Objects.requireNonNull(request, "Analysis request must not be null");

    RankingSettings settings =
        request.settings() != null ? request.settings() : currentSettings();
    configValidator.validate(settings);
    CompiledLexicon lexicon =
        request.lexicon() != null
            ? termMatcher.compileLexicon(request.lexicon())
            : lexiconRegistry.getCurrentLexicon();
    EvidenceProviders providers =
        request.providers() != null ? request.providers() : registeredProviders();

    String runId = request.runId() != null ? request.runId() : UUID.randomUUID().toString();
    StagePublisher publisher = new StagePublisher(runId, listeners.orderedStream().toList());
    long startTime = System.currentTimeMillis();
    log.info(
        "Ranking run {} started: {} hits, {} seed genes, disease context '{}'",
        runId,
        request.hits().size(),
        request.seedGenes().size(),
        request.diseaseContext());

    HitValidationResult validation = hitValidator.validate(request.hits());

    AggregationResult aggregation =
        publisher.publish(
            PipelineStage.AGGREGATION,
            aggregator.aggregate(
                validation.accepted(), request.seedGenes(), settings.aggregation()));

    PruningResult pruning =
        publisher.publish(
            PipelineStage.PRUNING,
            pruner.prune(aggregation.pathwayList(), settings.pruning()));

    FilterResult filtered =
        publisher.publish(
            PipelineStage.RELEVANCE_FILTER,
            relevanceFilter.filter(
                pruning.retained(), request.diseaseContext(), lexicon, settings.relevance()));

    List<ScoredHypothesis> hypotheses =
        publisher.publish(
            PipelineStage.SCORING,
            scorer.score(filtered.survivors(), providers, settings.scoring()));

    List<ImportantGene> genes =
        publisher.publish(
            PipelineStage.GENE_RANKING, geneRanker.rank(hypotheses, providers, settings.genes()));

    RankingStatus status =
        hypotheses.isEmpty() ? RankingStatus.NO_RELEVANT_PATHWAYS : RankingStatus.COMPLETED;
    if (status == RankingStatus.NO_RELEVANT_PATHWAYS) {
      log.info("Ranking run {} found no domain relevant pathway", runId);
    }
    log.info(
        "Ranking run {} finished in {}ms: {} hypotheses, {} genes",
        runId,
        System.currentTimeMillis() - startTime,
        hypotheses.size(),
        genes.size());

    return RankingResult.builder()
        .runId(runId)
        .status(status)
        .seedGenes(request.seedGenes())
        .diseaseContext(request.diseaseContext())
        .rejectedHits(validation.rejected())
        .aggregationStats(aggregation.stats())
        .aggregated(aggregation.pathwayList())
        .pruned(pruning.retained())
        .redundant(pruning.redundant())
        .excluded(filtered.excluded())
        .hypotheses(hypotheses)
        .importantGenes(genes)
        .build();
  }

  private RankingSettings currentSettings() {
    return RankingSettings.from(properties);
  }

  private EvidenceProviders registeredProviders() {
    return EvidenceProviders.builder()
        .tissueSpecificity(tissueSpecificity.getIfUnique())
        .literatureCitations(literatureCitations.getIfUnique())
        .domainGeneScores(domainGeneScores.getIfUnique())
        .druggability(druggability.getIfUnique())
        .build();
  }
}
