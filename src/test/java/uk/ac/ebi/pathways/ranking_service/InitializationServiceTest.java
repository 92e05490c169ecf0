package uk.ac.ebi.pathways.ranking_service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.ac.ebi.pathways.ranking_service.evidence.CuratedGeneAnnotations;
import uk.ac.ebi.pathways.ranking_service.relevance.LexiconRegistry;

@ExtendWith(MockitoExtension.class)
class InitializationServiceTest {

  @Mock private LexiconRegistry lexiconRegistry;
  @Mock private CuratedGeneAnnotations geneAnnotations;
  @InjectMocks private InitializationService initializationService;

  @Test
  void loadsLexiconThenGeneAnnotations() {
    initializationService.initialize();

    InOrder order = inOrder(lexiconRegistry, geneAnnotations);
    order.verify(lexiconRegistry).loadLexicon();
    order.verify(geneAnnotations).load();
  }

  @Test
  void lexiconFailureStopsInitialization() {
    when(lexiconRegistry.loadLexicon()).thenThrow(new IllegalStateException("Resource not found"));

    assertThatThrownBy(() -> initializationService.initialize())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Failed to initialize ranking reference data")
        .hasRootCauseMessage("Resource not found");
    verify(geneAnnotations, never()).load();
  }

  @Test
  void annotationFailureStopsInitialization() {
    doThrow(new IllegalStateException("bad score")).when(geneAnnotations).load();

    assertThatThrownBy(() -> initializationService.initialize())
        .isInstanceOf(IllegalStateException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }
}
