package dev.loom.pipeline;

import dev.loom.fusion.FusionMethod;
import dev.loom.fusion.FusionWeights;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Observability record of one pipeline run. Building it never influences ranking.
 *
 * @param originalQuery the user's query
 * @param searchQueries query strings actually searched, in fan-out order
 * @param stages per-stage counts and timings, in execution order
 * @param topFilteredScores up to five highest scores rejected by the threshold filter
 * @param fusionMethod fusion method configured for the run
 * @param baseWeights configured weights, before any per-query adaptation
 * @param failedSources source searches that failed or timed out, over all query strings
 * @param totalMillis wall-clock time of the whole run
 * @param error message of the failure that aborted the run, or {@code null}
 */
public record PipelineTrace(
    String originalQuery,
    List<String> searchQueries,
    List<StageTrace> stages,
    List<Double> topFilteredScores,
    @Nullable FusionMethod fusionMethod,
    @Nullable FusionWeights baseWeights,
    int failedSources,
    long totalMillis,
    @Nullable String error) {

  public PipelineTrace {
    searchQueries = List.copyOf(searchQueries);
    stages = List.copyOf(stages);
    topFilteredScores = List.copyOf(topFilteredScores);
  }

  public boolean failed() {
    return error != null;
  }
}
