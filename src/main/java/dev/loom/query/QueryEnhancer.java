package dev.loom.query;

import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rewrites a user query into the set of strings retrieval searches for.
 *
 * <p>Three independent steps, each toggled by {@link EnhancementOptions}:
 *
 * <ol>
 *   <li>Context injection: with non-empty history, the model rewrites the query as a standalone
 *       question from the last {@code maxHistoryTurns} turns
 *   <li>HyDE: the model writes a hypothetical answer to the (possibly rewritten) query
 *   <li>Multi-query: the model paraphrases the (possibly rewritten) query {@code variantCount}
 *       times
 * </ol>
 *
 * <p>A failing step never blocks the others. With {@code fallbackOnError} it degrades: context
 * injection keeps the original query, HyDE yields no document, multi-query yields {@code
 * [enhancedQuery]}. Without it the failure surfaces as {@link EnhancementException}.
 */
@Service
public class QueryEnhancer {

  private static final Logger log = LoggerFactory.getLogger(QueryEnhancer.class);

  private final TextGenerator textGenerator;
  private final EnhancementProperties properties;

  public QueryEnhancer(TextGenerator textGenerator, EnhancementProperties properties) {
    this.textGenerator = textGenerator;
    this.properties = properties;
  }

  /**
   * Enhances {@code query}.
   *
   * @param query the user's query
   * @param history preceding conversation, oldest first; may be empty
   * @param options which steps to run
   * @return the enhanced query; every field falls back to {@code query}
   * @throws EnhancementException when a step fails and {@code fallbackOnError} is false
   */
  public EnhancedQuery enhance(
      String query, List<ConversationTurn> history, EnhancementOptions options) {
    String enhancedQuery = query;
    if (options.contextInjection() && !history.isEmpty() && options.maxHistoryTurns() > 0) {
      enhancedQuery = injectContext(query, history, options);
    }

    String hydeDocument = null;
    if (options.hyde()) {
      hydeDocument = generateHypotheticalDocument(enhancedQuery, options);
    }

    List<String> variants = List.of(query);
    if (options.multiQuery()) {
      variants = generateVariants(enhancedQuery, options);
    }

    EnhancedQuery result = new EnhancedQuery(query, enhancedQuery, hydeDocument, variants);
    log.debug(
        "Enhanced query: rewritten={}, hyde={}, variants={}",
        !enhancedQuery.equals(query),
        hydeDocument != null,
        result.queryVariants().size());
    return result;
  }

  private String injectContext(
      String query, List<ConversationTurn> history, EnhancementOptions options) {
    List<ConversationTurn> recent =
        history.subList(Math.max(0, history.size() - options.maxHistoryTurns()), history.size());
    String historyText =
        recent.stream()
            .map(turn -> turn.sender() + ": " + turn.content())
            .collect(Collectors.joining("\n"));
    EnhancementProperties.Step step = properties.getContextInjection();
    String prompt =
        step.getTemplate().replace("{{HISTORY}}", historyText).replace("{{QUERY}}", query);
    try {
      String rewritten = textGenerator.generate(prompt, step.getTemperature(), step.getMaxTokens());
      return rewritten == null || rewritten.isBlank() ? query : rewritten.trim();
    } catch (RuntimeException e) {
      return degrade("context injection", e, options, query);
    }
  }

  private @Nullable String generateHypotheticalDocument(
      String query, EnhancementOptions options) {
    EnhancementProperties.Step step = properties.getHyde();
    String prompt = step.getTemplate().replace("{{QUERY}}", query);
    try {
      String document = textGenerator.generate(prompt, step.getTemperature(), step.getMaxTokens());
      return document == null || document.isBlank() ? null : document.trim();
    } catch (RuntimeException e) {
      return degrade("HyDE", e, options, null);
    }
  }

  private List<String> generateVariants(String query, EnhancementOptions options) {
    EnhancementProperties.Step step = properties.getMultiQuery();
    String prompt =
        step.getTemplate()
            .replace("{{COUNT}}", Integer.toString(options.variantCount()))
            .replace("{{QUERY}}", query);
    try {
      String answer = textGenerator.generate(prompt, step.getTemperature(), step.getMaxTokens());
      List<String> variants =
          VariantParser.parse(answer == null ? "" : answer, options.variantCount());
      if (variants.isEmpty()) {
        log.warn("Query variant answer could not be parsed, using the query itself");
        return List.of(query);
      }
      return variants;
    } catch (RuntimeException e) {
      return degrade("multi-query", e, options, List.of(query));
    }
  }

  private <T> T degrade(String step, RuntimeException e, EnhancementOptions options, T fallback) {
    if (!options.fallbackOnError()) {
      throw new EnhancementException("Query enhancement step '" + step + "' failed", e);
    }
    log.warn("Query enhancement step '{}' failed, continuing without it: {}", step, e.getMessage());
    return fallback;
  }
}
