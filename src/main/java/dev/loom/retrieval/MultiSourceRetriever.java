package dev.loom.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.loom.candidate.Candidate;
import dev.loom.candidate.SourceType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs every source search for the fan-out query strings.
 *
 * <p>For each query string the knowledge-base and email vector searches, and with keyword search
 * enabled the two keyword searches, are submitted together and collected only after all of them
 * finish. Query strings themselves are searched concurrently unless {@code
 * loom.retrieval.parallel-variants} is false; results always come back in fan-out order.
 *
 * <p>Failure isolation: a search that throws, is rejected by the pool, or misses the shared
 * deadline contributes an empty list for its source only and is logged. Nothing here throws.
 */
@Service
public class MultiSourceRetriever {

  private static final Logger log = LoggerFactory.getLogger(MultiSourceRetriever.class);

  private final VectorSearch vectorSearch;
  private final KeywordSearch keywordSearch;
  private final QueryEmbedder queryEmbedder;
  private final Executor executor;
  private final Duration timeout;
  private final boolean parallelVariants;

  public MultiSourceRetriever(
      VectorSearch vectorSearch,
      KeywordSearch keywordSearch,
      QueryEmbedder queryEmbedder,
      @Qualifier("retrievalExecutor") Executor executor,
      @Value("${loom.retrieval.timeout:10s}") Duration timeout,
      @Value("${loom.retrieval.parallel-variants:true}") boolean parallelVariants) {
    this.vectorSearch = vectorSearch;
    this.keywordSearch = keywordSearch;
    this.queryEmbedder = queryEmbedder;
    this.executor = executor;
    this.timeout = timeout;
    this.parallelVariants = parallelVariants;
  }

  /**
   * Retrieves raw candidate lists for every query string.
   *
   * @param queries distinct query strings in fan-out order
   * @param options shared search parameters
   * @return one entry per query, in input order
   */
  public List<RetrievedLists> retrieve(List<String> queries, RetrievalOptions options) {
    Map<String, Embedding> embeddings = queryEmbedder.embedAll(queries);
    long deadline = System.nanoTime() + timeout.toNanos();

    List<RetrievedLists> results = new ArrayList<>(queries.size());
    if (parallelVariants) {
      List<PendingQuery> pending =
          queries.stream().map(q -> submit(q, embeddings.get(q), options)).toList();
      pending.forEach(p -> results.add(p.await(deadline)));
    } else {
      for (String query : queries) {
        results.add(submit(query, embeddings.get(query), options).await(deadline));
      }
    }
    return results;
  }

  private PendingQuery submit(
      String query, @Nullable Embedding embedding, RetrievalOptions options) {
    String kb = options.knowledgeBaseId();
    int limit = options.limit();
    double hint = options.thresholdHint();

    CompletableFuture<List<Candidate>> kbVector = skipped();
    CompletableFuture<List<Candidate>> emailVector = skipped();
    if (embedding != null) {
      kbVector =
          async(() -> vectorSearch.search(SourceType.KNOWLEDGE_BASE, kb, embedding, limit, hint));
      emailVector = async(() -> vectorSearch.search(SourceType.EMAIL, kb, embedding, limit, hint));
    }

    CompletableFuture<List<Candidate>> kbKeyword = skipped();
    CompletableFuture<List<Candidate>> emailKeyword = skipped();
    if (options.keywordSearch()) {
      kbKeyword = async(() -> keywordSearch.search(SourceType.KNOWLEDGE_BASE, kb, query, limit));
      emailKeyword = async(() -> keywordSearch.search(SourceType.EMAIL, kb, query, limit));
    }
    return new PendingQuery(
        query, embedding == null, kbVector, emailVector, kbKeyword, emailKeyword);
  }

  private CompletableFuture<List<Candidate>> async(Supplier<List<Candidate>> search) {
    try {
      return CompletableFuture.supplyAsync(search, executor);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static CompletableFuture<List<Candidate>> skipped() {
    return CompletableFuture.completedFuture(List.of());
  }

  /** The four in-flight searches of one query string. */
  private record PendingQuery(
      String query,
      boolean embeddingMissing,
      CompletableFuture<List<Candidate>> kbVector,
      CompletableFuture<List<Candidate>> emailVector,
      CompletableFuture<List<Candidate>> kbKeyword,
      CompletableFuture<List<Candidate>> emailKeyword) {

    RetrievedLists await(long deadlineNanos) {
      List<Candidate> kbVectorHits = collect("knowledge-base vector", kbVector, deadlineNanos);
      List<Candidate> emailVectorHits = collect("email vector", emailVector, deadlineNanos);
      List<Candidate> kbKeywordHits = collect("knowledge-base keyword", kbKeyword, deadlineNanos);
      List<Candidate> emailKeywordHits = collect("email keyword", emailKeyword, deadlineNanos);
      int failures = embeddingMissing ? 2 : 0;
      for (CompletableFuture<List<Candidate>> future :
          List.of(kbVector, emailVector, kbKeyword, emailKeyword)) {
        if (future.isCompletedExceptionally()) {
          failures++;
        }
      }
      return new RetrievedLists(
          query, kbVectorHits, emailVectorHits, kbKeywordHits, emailKeywordHits, failures);
    }

    private static List<Candidate> collect(
        String source, CompletableFuture<List<Candidate>> future, long deadlineNanos) {
      long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
      try {
        List<Candidate> hits = future.get(remaining, TimeUnit.NANOSECONDS);
        return hits == null ? List.of() : hits;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        future.cancel(true);
        log.warn("Interrupted while waiting for {} search", source);
      } catch (TimeoutException e) {
        future.cancel(true);
        log.warn("{} search timed out, continuing without it", source);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("{} search failed, continuing without it: {}", source, cause.getMessage());
      }
      return List.of();
    }
  }
}
