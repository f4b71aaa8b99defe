package dev.loom.rerank;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.DiversityRecord;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the top candidate, then each following candidate only when its Jaccard similarity to every
 * kept candidate stays below the threshold.
 */
final class DiversityFilter {

  private static final Logger log = LoggerFactory.getLogger(DiversityFilter.class);

  private DiversityFilter() {}

  static List<Candidate> apply(List<Candidate> candidates, double threshold) {
    List<Candidate> kept = new ArrayList<>();
    for (Candidate candidate : candidates) {
      double maxSimilarity = 0.0;
      boolean diverse = true;
      for (Candidate previous : kept) {
        double similarity = JaccardSimilarity.similarity(candidate.content(), previous.content());
        maxSimilarity = Math.max(maxSimilarity, similarity);
        if (similarity >= threshold) {
          log.debug(
              "Dropped {} as near-duplicate of {} (similarity {})",
              candidate.key(),
              previous.key(),
              similarity);
          diverse = false;
          break;
        }
      }
      if (diverse) {
        kept.add(candidate.recorded(new DiversityRecord(maxSimilarity, candidate.score())));
      }
    }
    return kept;
  }
}
