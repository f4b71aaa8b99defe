package dev.loom.pipeline;

import dev.loom.candidate.Candidate;
import java.util.List;

/**
 * Final ranked candidates together with the trace of the run that produced them.
 *
 * @param results final candidates, at most {@code maxResults}
 * @param trace how they were produced
 */
public record RankedContext(List<Candidate> results, PipelineTrace trace) {

  public RankedContext {
    results = List.copyOf(results);
  }
}
