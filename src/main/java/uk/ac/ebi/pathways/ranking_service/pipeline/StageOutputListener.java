package uk.ac.ebi.pathways.ranking_service.pipeline;

/**
 * Receives the final output of each stage of a run, for persistence or progress reporting.
 *
 * <p>Each stage is published at most once per run and only after it completed, so the value
 * received for a stage is always that stage's final value. Outputs are immutable.
 */
@FunctionalInterface
public interface StageOutputListener {

  /**
   * @param runId the run
   * @param stage the completed stage
   * @param output the stage output, see {@link PipelineStage} for its type
   */
  void onStageCompleted(String runId, PipelineStage stage, Object output);
}
