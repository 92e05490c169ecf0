package uk.ac.ebi.pathways.ranking_service.pipeline;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes stage outputs of one run to the listeners. Refuses to publish a stage twice, so no
 * stage value can be replaced by another one under the same key.
 */
@Slf4j
final class StagePublisher {

  private final String runId;
  private final List<StageOutputListener> listeners;
  private final Set<PipelineStage> published = EnumSet.noneOf(PipelineStage.class);

  StagePublisher(String runId, List<StageOutputListener> listeners) {
    this.runId = runId;
    this.listeners = List.copyOf(listeners);
  }

  <T> T publish(PipelineStage stage, T output) {
    if (!published.add(stage)) {
      throw new IllegalStateException("Stage " + stage + " already published for run " + runId);
    }
    for (StageOutputListener listener : listeners) {
      try {
        listener.onStageCompleted(runId, stage, output);
      } catch (RuntimeException e) {
        log.error("Stage listener failed on {} of run {}", stage, runId, e);
      }
    }
    return output;
  }

  Set<PipelineStage> published() {
    return EnumSet.copyOf(published);
  }
}
