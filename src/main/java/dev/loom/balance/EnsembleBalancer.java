package dev.loom.balance;

import dev.loom.candidate.BalanceRecord;
import dev.loom.candidate.BalanceRecord.Admission;
import dev.loom.candidate.Candidate;
import dev.loom.candidate.SourceType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quota-based selection of the final top-{@code limit} candidates.
 *
 * <p>Algorithm, over candidates sorted best first:
 *
 * <ol>
 *   <li>Quotas: {@code maxEmail = floor(limit * maxEmailRatio)}, {@code maxKb = floor(limit *
 *       maxKnowledgeBaseRatio)}
 *   <li>Single pass: email and knowledge-base candidates are admitted while their source is under
 *       quota, otherwise queued in a per-source overflow; other sources are always admitted
 *   <li>Minimums: top up email, then knowledge base, from overflow up to their minimum counts
 *   <li>Fill: take from the overflow queues alternately, email first, until the limit is reached
 * </ol>
 *
 * <p>The output lists admitted candidates in their input order, so relative rank order is kept.
 */
public final class EnsembleBalancer {

  private static final Logger log = LoggerFactory.getLogger(EnsembleBalancer.class);

  private EnsembleBalancer() {}

  public static List<Candidate> balance(
      List<Candidate> candidates, int limit, BalanceOptions options) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
    }
    if (!options.enabled()) {
      return candidates.stream()
          .limit(limit)
          .map(c -> c.recorded(new BalanceRecord(Admission.TRUNCATION, c.score())))
          .toList();
    }

    int maxEmail = (int) Math.floor(limit * options.maxEmailRatio());
    int maxKnowledgeBase = (int) Math.floor(limit * options.maxKnowledgeBaseRatio());

    Admission[] admissions = new Admission[candidates.size()];
    Deque<Integer> emailOverflow = new ArrayDeque<>();
    Deque<Integer> knowledgeBaseOverflow = new ArrayDeque<>();
    int admitted = 0;
    int emailCount = 0;
    int knowledgeBaseCount = 0;

    for (int i = 0; i < candidates.size() && admitted < limit; i++) {
      SourceType source = candidates.get(i).source();
      if (source == SourceType.EMAIL) {
        if (emailCount < maxEmail) {
          admissions[i] = Admission.QUOTA;
          emailCount++;
          admitted++;
        } else {
          emailOverflow.addLast(i);
        }
      } else if (source == SourceType.KNOWLEDGE_BASE) {
        if (knowledgeBaseCount < maxKnowledgeBase) {
          admissions[i] = Admission.QUOTA;
          knowledgeBaseCount++;
          admitted++;
        } else {
          knowledgeBaseOverflow.addLast(i);
        }
      } else {
        admissions[i] = Admission.UNBOUNDED;
        admitted++;
      }
    }

    while (admitted < limit && emailCount < options.minEmailResults() && !emailOverflow.isEmpty()) {
      admissions[emailOverflow.removeFirst()] = Admission.MINIMUM;
      emailCount++;
      admitted++;
    }
    while (admitted < limit
        && knowledgeBaseCount < options.minKnowledgeBaseResults()
        && !knowledgeBaseOverflow.isEmpty()) {
      admissions[knowledgeBaseOverflow.removeFirst()] = Admission.MINIMUM;
      knowledgeBaseCount++;
      admitted++;
    }

    boolean emailTurn = true;
    while (admitted < limit && !(emailOverflow.isEmpty() && knowledgeBaseOverflow.isEmpty())) {
      boolean takeEmail =
          knowledgeBaseOverflow.isEmpty() || (emailTurn && !emailOverflow.isEmpty());
      Deque<Integer> queue = takeEmail ? emailOverflow : knowledgeBaseOverflow;
      admissions[queue.removeFirst()] = Admission.OVERFLOW;
      admitted++;
      emailTurn = !takeEmail;
    }

    List<Candidate> balanced = new ArrayList<>(admitted);
    for (int i = 0; i < candidates.size(); i++) {
      if (admissions[i] != null) {
        Candidate candidate = candidates.get(i);
        balanced.add(candidate.recorded(new BalanceRecord(admissions[i], candidate.score())));
      }
    }

    log.debug(
        "Balanced {} -> {} candidates (maxEmail={}, maxKb={}, email overflow left={}, kb overflow"
            + " left={})",
        candidates.size(),
        balanced.size(),
        maxEmail,
        maxKnowledgeBase,
        emailOverflow.size(),
        knowledgeBaseOverflow.size());
    return balanced;
  }
}
