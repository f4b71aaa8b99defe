package dev.loom.mcp;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.ScoreRecord;
import dev.loom.context.ContextFormatter;
import dev.loom.pipeline.PipelineTrace;
import dev.loom.pipeline.RankedContext;
import dev.loom.pipeline.RetrievalPipeline;
import dev.loom.pipeline.StageTrace;
import dev.loom.ragconfig.RagConfig;
import dev.loom.ragconfig.RagConfigOverrides;
import dev.loom.ragconfig.RagConfigResolver;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the retrieval pipeline as tools.
 *
 * <p>Tools never throw: every failure is returned to the client as an {@code Error: ...} string.
 */
@Service
public class RetrievalToolService {

  private final RetrievalPipeline pipeline;
  private final RagConfigResolver configResolver;
  private final ContextFormatter contextFormatter;

  public RetrievalToolService(
      RetrievalPipeline pipeline,
      RagConfigResolver configResolver,
      ContextFormatter contextFormatter) {
    this.pipeline = pipeline;
    this.configResolver = configResolver;
    this.contextFormatter = contextFormatter;
  }

  /** Retrieves ranked context from a knowledge base and its emails, formatted for a prompt. */
  @Tool(
      name = "retrieve_context",
      description =
          "Retrieve ranked context passages from a knowledge base and its email corpus. "
              + "Returns numbered passages with title and source, ready to ground an answer.")
  public String retrieveContext(
      @ToolParam(description = "Knowledge base identifier") @Nullable String knowledgeBaseId,
      @ToolParam(description = "Question or search text") @Nullable String query,
      @ToolParam(
              description = "Maximum number of passages (1-100, knowledge base default if absent)",
              required = false)
          @Nullable Integer maxResults) {
    try {
      String error = validate(knowledgeBaseId, query);
      if (error != null) {
        return error;
      }
      RagConfig config = resolve(knowledgeBaseId, maxResults);
      List<Candidate> results = pipeline.retrieveAndRank(query, List.of(), config);
      if (results.isEmpty()) {
        return "No relevant context found in knowledge base '%s' for: %s"
            .formatted(knowledgeBaseId, query);
      }
      return contextFormatter.formatWithinBudget(results);
    } catch (Exception e) {
      return "Error retrieving context: " + e.getMessage();
    }
  }

  /** Runs the pipeline and explains how each result was scored. */
  @Tool(
      name = "explain_ranking",
      description =
          "Run retrieval for a query and explain the ranking: searched query strings, "
              + "per-stage candidate counts and timings, scores dropped by the threshold, "
              + "and the score history of every returned passage.")
  public String explainRanking(
      @ToolParam(description = "Knowledge base identifier") @Nullable String knowledgeBaseId,
      @ToolParam(description = "Question or search text") @Nullable String query) {
    try {
      String error = validate(knowledgeBaseId, query);
      if (error != null) {
        return error;
      }
      RagConfig config = resolve(knowledgeBaseId, null);
      RankedContext context = pipeline.retrieveAndRankWithTrace(query, List.of(), config);
      return describe(context);
    } catch (Exception e) {
      return "Error explaining ranking: " + e.getMessage();
    }
  }

  private RagConfig resolve(String knowledgeBaseId, @Nullable Integer maxResults) {
    if (maxResults == null) {
      return configResolver.resolve(knowledgeBaseId);
    }
    RagConfigOverrides explicit =
        RagConfigOverrides.ofMaxResults(
            Math.max(1, Math.min(RagConfig.MAX_RESULTS_LIMIT, maxResults)));
    return configResolver.resolve(knowledgeBaseId, explicit);
  }

  private static @Nullable String validate(
      @Nullable String knowledgeBaseId, @Nullable String query) {
    if (knowledgeBaseId == null || knowledgeBaseId.isBlank()) {
      return "Error: knowledgeBaseId must not be empty.";
    }
    if (query == null || query.isBlank()) {
      return "Error: Query must not be empty. Provide a question or search text.";
    }
    return null;
  }

  static String describe(RankedContext context) {
    PipelineTrace trace = context.trace();
    StringBuilder sb = new StringBuilder();
    sb.append("Query: ").append(trace.originalQuery()).append('\n');
    if (trace.failed()) {
      sb.append("Pipeline failed: ").append(trace.error()).append('\n');
    }
    sb.append("Searched: ").append(String.join(" | ", trace.searchQueries())).append('\n');
    if (trace.fusionMethod() != null && trace.baseWeights() != null) {
      sb.append(
          String.format(
              Locale.ROOT,
              "Fusion: %s (vector %.2f, keyword %.2f)%n",
              trace.fusionMethod().name().toLowerCase(Locale.ROOT),
              trace.baseWeights().vector(),
              trace.baseWeights().keyword()));
    }
    sb.append("Failed sources: ").append(trace.failedSources()).append('\n');
    sb.append("Stages:\n");
    for (StageTrace stage : trace.stages()) {
      sb.append(
          String.format(
              Locale.ROOT,
              "- %s: %d -> %d (%d ms)%n",
              stage.stage(),
              stage.inputCount(),
              stage.outputCount(),
              stage.millis()));
    }
    if (!trace.topFilteredScores().isEmpty()) {
      sb.append("Top scores below threshold: ");
      sb.append(
          String.join(
              ", ",
              trace.topFilteredScores().stream()
                  .map(s -> String.format(Locale.ROOT, "%.4f", s))
                  .toList()));
      sb.append('\n');
    }
    sb.append("Results:\n");
    List<Candidate> results = context.results();
    if (results.isEmpty()) {
      sb.append("(none)\n");
    }
    for (int i = 0; i < results.size(); i++) {
      Candidate candidate = results.get(i);
      sb.append(
          String.format(
              Locale.ROOT,
              "[%d] %s %s score=%.4f %s%n",
              i + 1,
              candidate.source().wireName(),
              candidate.id(),
              candidate.score(),
              candidate.title()));
      for (ScoreRecord record : candidate.scoreHistory()) {
        sb.append(
            String.format(
                Locale.ROOT,
                "    %s -> %.4f %s%n",
                record.stage().name().toLowerCase(Locale.ROOT),
                record.output(),
                record));
      }
    }
    return sb.toString();
  }
}
