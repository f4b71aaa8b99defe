package dev.loom.fusion;

import dev.loom.candidate.Candidate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adjusts weighted-fusion weights per query from the two lists' score distributions and the query
 * shape.
 *
 * <ul>
 *   <li>higher mean score: +0.05 to that list, -0.05 to the other
 *   <li>lower variance: +0.03 to that list, -0.03 to the other
 *   <li>{@link QueryType#KEYWORD}: +0.1 keyword; {@link QueryType#SEMANTIC}: +0.1 vector
 * </ul>
 *
 * <p>Each adjusted weight is clamped to [0.3, 0.7], then both are rescaled to sum to 1.
 */
public final class AdaptiveWeightCalculator {

  private static final Logger log = LoggerFactory.getLogger(AdaptiveWeightCalculator.class);

  static final double MEAN_ADJUSTMENT = 0.05;
  static final double VARIANCE_ADJUSTMENT = 0.03;
  static final double QUERY_TYPE_ADJUSTMENT = 0.1;
  static final double MIN_WEIGHT = 0.3;
  static final double MAX_WEIGHT = 0.7;

  private AdaptiveWeightCalculator() {}

  public static FusionWeights calculate(
      List<Candidate> vectorResults,
      List<Candidate> keywordResults,
      String query,
      FusionWeights base) {
    List<Double> vectorScores = vectorResults.stream().map(Candidate::score).toList();
    List<Double> keywordScores = keywordResults.stream().map(Candidate::score).toList();
    double vectorMean = ScoreNormalizer.mean(vectorScores);
    double keywordMean = ScoreNormalizer.mean(keywordScores);
    double vectorVariance = ScoreNormalizer.variance(vectorScores, vectorMean);
    double keywordVariance = ScoreNormalizer.variance(keywordScores, keywordMean);
    QueryType queryType = QueryType.detect(query);

    double shift = vectorMean > keywordMean ? MEAN_ADJUSTMENT : -MEAN_ADJUSTMENT;
    shift += vectorVariance < keywordVariance ? VARIANCE_ADJUSTMENT : -VARIANCE_ADJUSTMENT;
    if (queryType == QueryType.KEYWORD) {
      shift -= QUERY_TYPE_ADJUSTMENT;
    } else if (queryType == QueryType.SEMANTIC) {
      shift += QUERY_TYPE_ADJUSTMENT;
    }

    double vector = clamp(base.vector() + shift);
    double keyword = clamp(base.keyword() - shift);
    double total = vector + keyword;
    FusionWeights adapted = new FusionWeights(vector / total, keyword / total);

    log.debug(
        "Adaptive weights: queryType={}, shift={}, vector={}, keyword={}",
        queryType,
        shift,
        adapted.vector(),
        adapted.keyword());
    return adapted;
  }

  private static double clamp(double weight) {
    return Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, weight));
  }
}
