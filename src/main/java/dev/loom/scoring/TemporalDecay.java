package dev.loom.scoring;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.DecayRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Exponential recency penalty for email candidates.
 *
 * <p>{@code factor = max(minDecay, exp(-days / halfLife * ln 2))} and {@code score *= 0.8 + 0.2 *
 * factor}, so an old email loses at most 20% of its score. Knowledge-base candidates and emails
 * without a timestamp pass through with an unapplied {@link DecayRecord}, as does every candidate
 * when decay is disabled. Timestamps in the future count as zero days old.
 */
public final class TemporalDecay {

  private static final double DAY_SECONDS = Duration.ofDays(1).getSeconds();
  private static final double RETAINED = 0.8;
  private static final double DECAYING = 0.2;

  private TemporalDecay() {}

  /**
   * Applies decay relative to {@code clock}.
   *
   * @return decayed copies in input order
   */
  public static List<Candidate> apply(
      List<Candidate> candidates, DecayOptions options, Clock clock) {
    if (!options.enabled()) {
      return candidates.stream().map(TemporalDecay::unapplied).toList();
    }
    Instant now = clock.instant();
    return candidates.stream().map(candidate -> decay(candidate, options, now)).toList();
  }

  static double decayFactor(double days, DecayOptions options) {
    return Math.max(options.minDecay(), Math.exp(-days / options.halfLifeDays() * Math.log(2)));
  }

  private static Candidate decay(Candidate candidate, DecayOptions options, Instant now) {
    Instant sentAt = candidate.sentAt();
    if (!candidate.isEmail() || sentAt == null) {
      return unapplied(candidate);
    }
    double days = Math.max(0.0, Duration.between(sentAt, now).getSeconds() / DAY_SECONDS);
    double factor = decayFactor(days, options);
    double decayed = candidate.score() * (RETAINED + DECAYING * factor);
    return candidate.rescored(
        decayed, new DecayRecord(true, days, factor, candidate.score(), decayed));
  }

  private static Candidate unapplied(Candidate candidate) {
    return candidate.recorded(
        new DecayRecord(false, 0.0, 1.0, candidate.score(), candidate.score()));
  }
}
