package dev.loom.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the model's answer to the multi-query prompt into query variants.
 *
 * <p>Tried in order, first success wins:
 *
 * <ol>
 *   <li>the whole answer as a JSON array of strings
 *   <li>a markdown-fenced block ({@code ```json ... ```}) containing a JSON array
 *   <li>the outermost {@code [...]} span as a JSON array
 *   <li>one variant per line, with list numbering, bullets and surrounding quotes stripped
 * </ol>
 *
 * <p>Variants are trimmed, blanks dropped, and the result is capped at {@code count}.
 */
final class VariantParser {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Pattern FENCED =
      Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern BRACKETED = Pattern.compile("\\[.*]", Pattern.DOTALL);
  private static final Pattern LIST_MARKER = Pattern.compile("^(?:\\d+[.)]|[-*•])\\s*");
  private static final Pattern QUOTES = Pattern.compile("^[\"'`]+|[\"'`,]+$");

  private VariantParser() {}

  static List<String> parse(String answer, int count) {
    String content = answer.trim();
    if (content.isEmpty()) {
      return List.of();
    }
    Optional<List<String>> parsed = parseJsonArray(content);
    if (parsed.isEmpty()) {
      Matcher fenced = FENCED.matcher(content);
      if (fenced.find()) {
        parsed = parseJsonArray(fenced.group(1).trim());
      }
    }
    if (parsed.isEmpty()) {
      Matcher bracketed = BRACKETED.matcher(content);
      if (bracketed.find()) {
        parsed = parseJsonArray(bracketed.group());
      }
    }
    List<String> variants = parsed.orElseGet(() -> parseLines(content));
    return variants.stream().map(String::trim).filter(v -> !v.isEmpty()).limit(count).toList();
  }

  private static Optional<List<String>> parseJsonArray(String text) {
    if (!text.startsWith("[")) {
      return Optional.empty();
    }
    try {
      JsonNode node = MAPPER.readTree(text);
      if (node == null || !node.isArray()) {
        return Optional.empty();
      }
      List<String> values = new ArrayList<>();
      for (JsonNode element : node) {
        if (element.isValueNode() && !element.isNull()) {
          values.add(element.asText());
        }
      }
      return Optional.of(values);
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  private static List<String> parseLines(String content) {
    List<String> variants = new ArrayList<>();
    for (String line : content.split("\\R")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("[") || trimmed.startsWith("]")
          || trimmed.startsWith("```")) {
        continue;
      }
      String stripped = LIST_MARKER.matcher(trimmed).replaceFirst("");
      stripped = QUOTES.matcher(stripped).replaceAll("");
      variants.add(stripped);
    }
    return variants;
  }
}
