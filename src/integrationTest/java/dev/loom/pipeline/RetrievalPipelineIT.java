package dev.loom.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.loom.BaseIntegrationTest;
import dev.loom.candidate.Candidate;
import dev.loom.candidate.SourceType;
import dev.loom.mcp.RetrievalToolService;
import dev.loom.ragconfig.KnowledgeBase;
import dev.loom.ragconfig.KnowledgeBaseRepository;
import dev.loom.ragconfig.RagConfig;
import dev.loom.ragconfig.RagConfigResolver;
import dev.loom.retrieval.KeywordSearch;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class RetrievalPipelineIT extends BaseIntegrationTest {

  static final String REFUND_TEXT =
      "Annual plans can be refunded within 30 days of purchase. "
          + "After that period the remaining months are credited to the account.";
  static final String ROUTING_TEXT =
      "Support tickets are routed to the billing team when they mention invoices or payments.";
  static final String OTHER_KB_TEXT =
      "Annual plans of the partner programme are never refunded.";
  static final String EMAIL_TEXT =
      "Hi, I bought the annual plan last week and would like a refund please.";

  @Autowired RetrievalPipeline pipeline;

  @Autowired RagConfigResolver configResolver;

  @Autowired KnowledgeBaseRepository knowledgeBaseRepository;

  @Autowired KeywordSearch keywordSearch;

  @Autowired RetrievalToolService tools;

  @Autowired EmbeddingModel embeddingModel;

  @BeforeEach
  void seed() {
    knowledgeBaseRepository.saveAndFlush(
        new KnowledgeBase("kb1", "Support", "{\"emailThreshold\": 0.3, \"maxResults\": 3}"));
    seed(knowledgeBaseStore, REFUND_TEXT, Metadata.from("knowledge_base_id", "kb1")
        .put("file_name", "refunds.md"));
    seed(knowledgeBaseStore, ROUTING_TEXT, Metadata.from("knowledge_base_id", "kb1")
        .put("file_name", "routing.md"));
    seed(knowledgeBaseStore, OTHER_KB_TEXT, Metadata.from("knowledge_base_id", "kb2")
        .put("file_name", "partners.md"));
    seed(emailStore, EMAIL_TEXT, Metadata.from("knowledge_base_id", "kb1")
        .put("subject", "Refund request")
        .put("sent_at", "2025-01-10T09:00:00Z"));
  }

  private void seed(EmbeddingStore<TextSegment> store, String text, Metadata metadata) {
    TextSegment segment = TextSegment.from(text, metadata);
    store.add(embeddingModel.embed(segment).content(), segment);
  }

  @Test
  void retrievesFromBothCorporaScopedToKnowledgeBase() {
    RagConfig config = configResolver.resolve("kb1");

    RankedContext context =
        pipeline.retrieveAndRankWithTrace(
            "Can I get a refund on an annual plan?", List.of(), config);

    assertThat(context.trace().failed()).isFalse();
    assertThat(context.results()).isNotEmpty().hasSizeLessThanOrEqualTo(3);
    assertThat(context.results()).extracting(Candidate::content).doesNotContain(OTHER_KB_TEXT);
    assertThat(context.results().get(0).content()).isIn(REFUND_TEXT, EMAIL_TEXT);
    assertThat(context.results())
        .extracting(Candidate::source)
        .contains(SourceType.KNOWLEDGE_BASE);
  }

  @Test
  void keywordSearchMatchesExactTermsWithinKnowledgeBase() {
    List<Candidate> hits = keywordSearch.search(SourceType.KNOWLEDGE_BASE, "kb1", "invoices", 5);

    assertThat(hits).extracting(Candidate::content).containsExactly(ROUTING_TEXT);
    assertThat(hits.get(0).fileName()).isEqualTo("routing.md");
    assertThat(hits.get(0).score()).isPositive();
  }

  @Test
  void retrieveContextToolReturnsFormattedPassages() {
    String result = tools.retrieveContext("kb1", "refund for annual plan", null);

    assertThat(result).startsWith("[1] ").contains("refund");
  }

  @Test
  void unknownKnowledgeBaseFindsNothing() {
    String result = tools.retrieveContext("missing", "refund for annual plan", null);

    assertThat(result).startsWith("No relevant context found in knowledge base 'missing'");
  }
}
