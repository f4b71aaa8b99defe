package dev.loom.pipeline;

import dev.loom.balance.EnsembleBalancer;
import dev.loom.candidate.Candidate;
import dev.loom.fusion.FusionEngine;
import dev.loom.fusion.FusionSettings;
import dev.loom.query.ConversationTurn;
import dev.loom.query.EnhancedQuery;
import dev.loom.query.QueryEnhancer;
import dev.loom.ragconfig.RagConfig;
import dev.loom.rerank.Reranker;
import dev.loom.retrieval.MultiSourceRetriever;
import dev.loom.retrieval.RetrievalOptions;
import dev.loom.retrieval.RetrievedLists;
import dev.loom.scoring.TemporalDecay;
import dev.loom.scoring.ThresholdFilter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Retrieves and ranks grounding context for one chat turn.
 *
 * <p>Stages, in order: query enhancement, multi-source retrieval per query string, per-query
 * fusion, cross-variant merge, threshold filter on fused scores, temporal decay, reranking to
 * {@code maxResults * 2}, ensemble balancing to {@code maxResults}.
 *
 * <p>Lower stages degrade on their own. Anything that still escapes is caught here: the run
 * returns no candidates rather than failing the chat turn.
 */
@Service
public class RetrievalPipeline {

  private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);

  static final int MAX_QUERY_LENGTH = 10_000;
  static final int TOP_FILTERED_SCORES = 5;

  private final QueryEnhancer queryEnhancer;
  private final MultiSourceRetriever retriever;
  private final Clock clock;

  public RetrievalPipeline(
      QueryEnhancer queryEnhancer, MultiSourceRetriever retriever, Clock clock) {
    this.queryEnhancer = queryEnhancer;
    this.retriever = retriever;
    this.clock = clock;
  }

  /**
   * Returns the final ranked candidates, best first within each source's admission order.
   *
   * @param query the user's query
   * @param history preceding conversation turns, oldest first
   * @param config resolved configuration of the knowledge base
   * @return at most {@code config.maxResults()} candidates; empty if the run failed
   */
  public List<Candidate> retrieveAndRank(
      String query, List<ConversationTurn> history, RagConfig config) {
    return retrieveAndRankWithTrace(query, history, config).results();
  }

  /** Same as {@link #retrieveAndRank} and also returns the run's trace. */
  public RankedContext retrieveAndRankWithTrace(
      String query, List<ConversationTurn> history, RagConfig config) {
    Run run = new Run(query, config);
    try {
      List<Candidate> results = run.execute(history == null ? List.of() : history);
      return new RankedContext(results, run.trace(null));
    } catch (RuntimeException e) {
      log.warn("Retrieval pipeline failed, continuing without context: {}", e.getMessage(), e);
      return new RankedContext(List.of(), run.trace(e.getMessage()));
    }
  }

  static void validateQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("query must not be blank");
    }
    if (query.length() > MAX_QUERY_LENGTH) {
      throw new IllegalArgumentException(
          "query must be at most " + MAX_QUERY_LENGTH + " characters, got: " + query.length());
    }
  }

  /** State of a single invocation; never shared. */
  private final class Run {

    private final String query;
    private final @Nullable RagConfig config;
    private final long startNanos = System.nanoTime();
    private final List<StageTrace> stages = new ArrayList<>();
    private List<String> searchQueries = List.of();
    private List<Double> topFilteredScores = List.of();
    private int failedSources;

    Run(@Nullable String query, @Nullable RagConfig config) {
      this.query = query == null ? "" : query;
      this.config = config;
    }

    List<Candidate> execute(List<ConversationTurn> history) {
      validateQuery(query);
      RagConfig config = Objects.requireNonNull(this.config, "config");

      long t = System.nanoTime();
      EnhancedQuery enhanced = queryEnhancer.enhance(query, history, config.enhancement());
      searchQueries = enhanced.searchQueries();
      stage("enhance", 1, searchQueries.size(), t);

      t = System.nanoTime();
      FusionSettings fusion = config.fusion();
      RetrievalOptions options =
          new RetrievalOptions(
              config.knowledgeBaseId(),
              config.maxResults() * 2,
              config.knowledgeBaseThreshold(),
              fusion.hybridEnabled());
      List<RetrievedLists> retrieved = retriever.retrieve(searchQueries, options);
      int retrievedCount = 0;
      for (RetrievedLists lists : retrieved) {
        retrievedCount += lists.size();
        failedSources += lists.failedSources();
      }
      stage("retrieve", searchQueries.size(), retrievedCount, t);

      t = System.nanoTime();
      List<List<Candidate>> fusedPerQuery = new ArrayList<>(retrieved.size());
      int fusedCount = 0;
      for (RetrievedLists lists : retrieved) {
        List<Candidate> fused =
            FusionEngine.fuse(lists.vector(), lists.keyword(), fusion, lists.query());
        fusedPerQuery.add(fused);
        fusedCount += fused.size();
      }
      stage("fuse", retrievedCount, fusedCount, t);

      t = System.nanoTime();
      List<Candidate> merged = FusionEngine.mergeVariants(fusedPerQuery, fusion.combineMethod());
      stage("merge", fusedCount, merged.size(), t);

      t = System.nanoTime();
      ThresholdFilter.Outcome outcome =
          ThresholdFilter.partition(
              merged, config.knowledgeBaseThreshold(), config.emailThreshold());
      topFilteredScores =
          outcome.rejected().stream()
              .map(Candidate::score)
              .sorted(Comparator.reverseOrder())
              .limit(TOP_FILTERED_SCORES)
              .toList();
      stage("threshold", merged.size(), outcome.passed().size(), t);

      t = System.nanoTime();
      List<Candidate> decayed =
          byScoreDescending(TemporalDecay.apply(outcome.passed(), config.decay(), clock));
      stage("decay", outcome.passed().size(), decayed.size(), t);

      t = System.nanoTime();
      List<Candidate> reranked =
          Reranker.rerank(query, decayed, config.rerank(), config.maxResults() * 2);
      stage("rerank", decayed.size(), reranked.size(), t);

      t = System.nanoTime();
      List<Candidate> balanced =
          EnsembleBalancer.balance(reranked, config.maxResults(), config.balance());
      stage("balance", reranked.size(), balanced.size(), t);

      long emails = balanced.stream().filter(Candidate::isEmail).count();
      log.info(
          "Retrieved context for knowledge base {}: queries={}, retrieved={}, afterThreshold={}, "
              + "final={} (kb={}, email={}), failedSources={}, elapsed={}ms",
          config.knowledgeBaseId(),
          searchQueries.size(),
          retrievedCount,
          outcome.passed().size(),
          balanced.size(),
          balanced.size() - emails,
          emails,
          failedSources,
          elapsedMillis(startNanos));
      return balanced;
    }

    PipelineTrace trace(@Nullable String error) {
      FusionSettings fusion = config == null ? null : config.fusion();
      return new PipelineTrace(
          query,
          searchQueries,
          stages,
          topFilteredScores,
          fusion == null ? null : fusion.method(),
          fusion == null ? null : fusion.weights(),
          failedSources,
          elapsedMillis(startNanos),
          error);
    }

    private void stage(String name, int in, int out, long stageStart) {
      StageTrace trace = new StageTrace(name, in, out, elapsedMillis(stageStart));
      stages.add(trace);
      log.debug("Stage {}: {} -> {} in {}ms", name, in, out, trace.millis());
    }
  }

  private static List<Candidate> byScoreDescending(List<Candidate> candidates) {
    return candidates.stream()
        .sorted(Comparator.comparingDouble(Candidate::score).reversed())
        .toList();
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }
}
