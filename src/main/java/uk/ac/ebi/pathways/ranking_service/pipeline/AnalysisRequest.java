package uk.ac.ebi.pathways.ranking_service.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.Builder;
import uk.ac.ebi.pathways.ranking_service.config.RankingSettings;
import uk.ac.ebi.pathways.ranking_service.evidence.EvidenceProviders;
import uk.ac.ebi.pathways.ranking_service.model.PathwayHit;
import uk.ac.ebi.pathways.ranking_service.relevance.TermLexicon;
import uk.ac.ebi.pathways.ranking_service.util.GeneSymbols;

/**
 * Input of one ranking run.
 *
 * @param runId identifier of the run, generated when {@code null}
 * @param seedGenes the user supplied seed genes
 * @param diseaseContext free text disease context label, e.g. "heart failure", may be null
 * @param hits pathway hits from the evidence ingestion adapter
 * @param settings settings of this run, the configured ones when {@code null}
 * @param lexicon term lexicon of this run, the configured one when {@code null}
 * @param providers auxiliary evidence of this run, the registered beans when {@code null}
 */
@Builder
public record AnalysisRequest(
    String runId,
    Set<String> seedGenes,
    String diseaseContext,
    List<PathwayHit> hits,
    RankingSettings settings,
    TermLexicon lexicon,
    EvidenceProviders providers) {

  public AnalysisRequest {
    Objects.requireNonNull(hits, "Pathway hits must not be null");
    seedGenes = GeneSymbols.normalizeAll(seedGenes);
    // null entries are kept and reported as malformed hits
    hits = Collections.unmodifiableList(new ArrayList<>(hits));
  }
}
