package dev.loom.scoring;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.SourceType;
import dev.loom.candidate.ThresholdRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops candidates whose fused score is below their source's relevance floor.
 *
 * <p>Email candidates use the email threshold; knowledge-base and any other source use the
 * knowledge-base threshold. Must run on fused scores, never on raw per-source scores.
 */
public final class ThresholdFilter {

  private ThresholdFilter() {}

  public static List<Candidate> filter(
      List<Candidate> candidates, double knowledgeBaseThreshold, double emailThreshold) {
    return partition(candidates, knowledgeBaseThreshold, emailThreshold).passed();
  }

  /**
   * Splits candidates into those that pass and those that do not, preserving order in both.
   * Passing candidates get a {@link ThresholdRecord}; rejected ones are returned unchanged.
   */
  public static Outcome partition(
      List<Candidate> candidates, double knowledgeBaseThreshold, double emailThreshold) {
    List<Candidate> passed = new ArrayList<>();
    List<Candidate> rejected = new ArrayList<>();
    for (Candidate candidate : candidates) {
      double threshold = thresholdFor(candidate.source(), knowledgeBaseThreshold, emailThreshold);
      if (candidate.score() >= threshold) {
        passed.add(candidate.recorded(new ThresholdRecord(threshold, candidate.score())));
      } else {
        rejected.add(candidate);
      }
    }
    return new Outcome(passed, rejected);
  }

  static double thresholdFor(
      SourceType source, double knowledgeBaseThreshold, double emailThreshold) {
    return source == SourceType.EMAIL ? emailThreshold : knowledgeBaseThreshold;
  }

  /** Result of {@link #partition}. */
  public record Outcome(List<Candidate> passed, List<Candidate> rejected) {

    public Outcome {
      passed = List.copyOf(passed);
      rejected = List.copyOf(rejected);
    }
  }
}
