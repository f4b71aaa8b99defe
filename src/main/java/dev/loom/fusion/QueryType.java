package dev.loom.fusion;

import java.util.regex.Pattern;

/** Coarse query shape used to bias adaptive fusion weights. */
public enum QueryType {
  /** Short or quoted queries; favour keyword search. */
  KEYWORD,
  /** Long natural-language questions; favour vector search. */
  SEMANTIC,
  MIXED;

  private static final Pattern QUESTION_WORD =
      Pattern.compile(
          "\\b(what|how|why|when|where|who|which|can|is|are|do|does)\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern QUOTED = Pattern.compile("\"[^\"]+\"");

  /**
   * Classifies a query: at most 3 words or a quoted phrase is {@link #KEYWORD}; at least 7 words
   * containing a question word is {@link #SEMANTIC}; anything else is {@link #MIXED}.
   */
  public static QueryType detect(String query) {
    String trimmed = query.trim();
    int wordCount = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    if (wordCount <= 3 || QUOTED.matcher(query).find()) {
      return KEYWORD;
    }
    if (wordCount >= 7 && QUESTION_WORD.matcher(query).find()) {
      return SEMANTIC;
    }
    return MIXED;
  }
}
