package dev.loom.context;

import dev.loom.candidate.Candidate;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders ranked candidates as the context block of an LLM prompt, within a token budget.
 *
 * <p>Tokens are estimated as characters / 4. Candidates are taken in order until the next one would
 * exceed the budget. If the first one alone exceeds it, it is kept with its content cut to the
 * budget: at the last sentence end when that falls past 80% of the allowed length, otherwise
 * mid-text with a trailing {@code ...}.
 *
 * <p>Each candidate renders as {@code [i] title (source):\ncontent}; blocks are separated by a
 * blank line.
 */
@Component
public class ContextFormatter {

  private static final Logger log = LoggerFactory.getLogger(ContextFormatter.class);

  static final double CHARS_PER_TOKEN = 4.0;
  private static final double SENTENCE_CUT_RATIO = 0.8;

  private final int tokenBudget;

  public ContextFormatter(@Value("${loom.context.token-budget:2000}") int tokenBudget) {
    if (tokenBudget < 1) {
      throw new IllegalArgumentException("token budget must be >= 1, got: " + tokenBudget);
    }
    this.tokenBudget = tokenBudget;
  }

  /** Truncates to the budget and renders. Returns an empty string for no candidates. */
  public String formatWithinBudget(@Nullable List<Candidate> candidates) {
    return format(truncate(candidates));
  }

  /**
   * Renders candidates without truncation.
   *
   * @param candidates candidates in prompt order
   * @return the context block, or an empty string for no candidates
   */
  public String format(@Nullable List<Candidate> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return "";
    }
    StringBuilder output = new StringBuilder();
    for (int i = 0; i < candidates.size(); i++) {
      Candidate candidate = candidates.get(i);
      if (i > 0) {
        output.append("\n\n");
      }
      String title = candidate.title().isBlank() ? "Context " + (i + 1) : candidate.title();
      output
          .append('[')
          .append(i + 1)
          .append("] ")
          .append(title)
          .append(" (")
          .append(sourceLabel(candidate))
          .append("):\n")
          .append(candidate.content());
    }
    return output.toString();
  }

  /**
   * Keeps the longest prefix of {@code candidates} whose content fits the token budget.
   *
   * @return the kept candidates; never empty when the input is not
   */
  public List<Candidate> truncate(@Nullable List<Candidate> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return List.of();
    }
    List<Candidate> kept = new ArrayList<>();
    int usedTokens = 0;
    for (Candidate candidate : candidates) {
      int tokens = estimateTokens(candidate.content());
      if (usedTokens + tokens > tokenBudget) {
        if (kept.isEmpty()) {
          kept.add(withContent(candidate, cutText(candidate.content(), tokenBudget)));
        }
        break;
      }
      kept.add(candidate);
      usedTokens += tokens;
    }
    log.debug(
        "Context truncated from {} to {} candidates, ~{} tokens",
        candidates.size(),
        kept.size(),
        usedTokens);
    return kept;
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  static int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  static String cutText(String text, int maxTokens) {
    int maxChars = (int) (maxTokens * CHARS_PER_TOKEN);
    if (text.length() <= maxChars) {
      return text;
    }
    String prefix = text.substring(0, maxChars);
    int lastPeriod = prefix.lastIndexOf('.');
    if (lastPeriod > maxChars * SENTENCE_CUT_RATIO) {
      return prefix.substring(0, lastPeriod + 1);
    }
    return prefix + "...";
  }

  private static String sourceLabel(Candidate candidate) {
    return switch (candidate.source()) {
      case EMAIL -> candidate.sender() != null ? "Email from " + candidate.sender() : "Email";
      case KNOWLEDGE_BASE -> "Knowledge Base";
      case OTHER -> "Other";
    };
  }

  private static Candidate withContent(Candidate candidate, String content) {
    return new Candidate(
        candidate.id(),
        candidate.source(),
        candidate.title(),
        content,
        candidate.score(),
        candidate.sentAt(),
        candidate.fileName(),
        candidate.chunkIndex(),
        candidate.totalChunks(),
        candidate.sender(),
        candidate.scoreHistory());
  }
}
