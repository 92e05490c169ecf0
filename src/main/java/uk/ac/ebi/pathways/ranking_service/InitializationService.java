package uk.ac.ebi.pathways.ranking_service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.ac.ebi.pathways.ranking_service.evidence.CuratedGeneAnnotations;
import uk.ac.ebi.pathways.ranking_service.relevance.LexiconRegistry;

/**
 * Loads the reference data of the ranking engine once the application has started.
 *
 * <p>Loading the term lexicon and the curated gene annotations up front makes a missing or
 * invalid resource fail the startup instead of the first ranking run.
 */
@Slf4j
@Service
public class InitializationService {

  private final LexiconRegistry lexiconRegistry;
  private final CuratedGeneAnnotations geneAnnotations;

  public InitializationService(
      LexiconRegistry lexiconRegistry, CuratedGeneAnnotations geneAnnotations) {
    this.lexiconRegistry = lexiconRegistry;
    this.geneAnnotations = geneAnnotations;
  }

  /**
   * Loads the term lexicon, then the curated gene annotations.
   *
   * @throws IllegalStateException if any resource cannot be loaded
   */
  @EventListener(ApplicationReadyEvent.class)
  public void initialize() {
    log.debug("Application initialization started");

    try {
      lexiconRegistry.loadLexicon();
      geneAnnotations.load();
      log.info("Application initialization completed successfully");

    } catch (Exception e) {
      log.error("Application initialization failed", e);
      throw new IllegalStateException("Failed to initialize ranking reference data", e);
    }
  }
}
