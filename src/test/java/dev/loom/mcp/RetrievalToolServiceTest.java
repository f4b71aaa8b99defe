package dev.loom.mcp;

import static dev.loom.fixture.CandidateBuilder.kb;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.FusionRecord;
import dev.loom.context.ContextFormatter;
import dev.loom.fixture.CandidateBuilder;
import dev.loom.fixture.RagConfigs;
import dev.loom.fusion.FusionMethod;
import dev.loom.fusion.FusionWeights;
import dev.loom.pipeline.PipelineTrace;
import dev.loom.pipeline.RankedContext;
import dev.loom.pipeline.RetrievalPipeline;
import dev.loom.pipeline.StageTrace;
import dev.loom.ragconfig.RagConfig;
import dev.loom.ragconfig.RagConfigOverrides;
import dev.loom.ragconfig.RagConfigResolver;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrievalToolServiceTest {

  private static final RagConfig CONFIG = RagConfigs.plain("kb1", 5);

  @Mock RetrievalPipeline pipeline;
  @Mock RagConfigResolver configResolver;

  private RetrievalToolService tools;

  @BeforeEach
  void setUp() {
    tools = new RetrievalToolService(pipeline, configResolver, new ContextFormatter(2000));
  }

  @Test
  void retrieve_context_formats_results() {
    given(configResolver.resolve("kb1")).willReturn(CONFIG);
    Candidate hit =
        CandidateBuilder.knowledgeBase("k1")
            .title("refunds.md")
            .content("Refunds take 30 days.")
            .build();
    given(pipeline.retrieveAndRank("refund policy", List.of(), CONFIG)).willReturn(List.of(hit));

    String result = tools.retrieveContext("kb1", "refund policy", null);

    assertThat(result).isEqualTo("[1] refunds.md (Knowledge Base):\nRefunds take 30 days.");
  }

  @Test
  void retrieve_context_reports_empty_result() {
    given(configResolver.resolve("kb1")).willReturn(CONFIG);
    given(pipeline.retrieveAndRank(eq("refund policy"), anyList(), any())).willReturn(List.of());

    assertThat(tools.retrieveContext("kb1", "refund policy", null))
        .isEqualTo("No relevant context found in knowledge base 'kb1' for: refund policy");
  }

  @Test
  void retrieve_context_clamps_max_results() {
    given(configResolver.resolve(eq("kb1"), any(RagConfigOverrides.class))).willReturn(CONFIG);
    given(pipeline.retrieveAndRank(eq("q"), anyList(), any())).willReturn(List.of());

    tools.retrieveContext("kb1", "q", 500);

    ArgumentCaptor<RagConfigOverrides> overrides =
        ArgumentCaptor.forClass(RagConfigOverrides.class);
    verify(configResolver).resolve(eq("kb1"), overrides.capture());
    assertThat(overrides.getValue().maxResults()).isEqualTo(RagConfig.MAX_RESULTS_LIMIT);
  }

  @Test
  void retrieve_context_validates_arguments() {
    assertThat(tools.retrieveContext(" ", "q", null))
        .isEqualTo("Error: knowledgeBaseId must not be empty.");
    assertThat(tools.retrieveContext("kb1", "", null))
        .isEqualTo("Error: Query must not be empty. Provide a question or search text.");
    verifyNoInteractions(pipeline, configResolver);
  }

  @Test
  void retrieve_context_turns_exceptions_into_error_text() {
    given(configResolver.resolve("kb1")).willThrow(new IllegalStateException("database gone"));

    assertThat(tools.retrieveContext("kb1", "q", null))
        .isEqualTo("Error retrieving context: database gone");
  }

  @Test
  void explain_ranking_describes_trace_and_history() {
    given(configResolver.resolve("kb1")).willReturn(CONFIG);
    Candidate hit =
        kb("k1", 0.9).recorded(new FusionRecord("vector_only", 1, null, 0.9, 0.0, false, 0.9));
    PipelineTrace trace =
        new PipelineTrace(
            "refund policy",
            List.of("refund policy", "money back"),
            List.of(new StageTrace("threshold", 4, 1, 0)),
            List.of(0.12),
            FusionMethod.WEIGHTED,
            new FusionWeights(0.6, 0.4),
            1,
            12,
            null);
    given(pipeline.retrieveAndRankWithTrace("refund policy", List.of(), CONFIG))
        .willReturn(new RankedContext(List.of(hit), trace));

    String explanation = tools.explainRanking("kb1", "refund policy");

    assertThat(explanation)
        .contains("Query: refund policy")
        .contains("Searched: refund policy | money back")
        .contains("Fusion: weighted (vector 0.60, keyword 0.40)")
        .contains("Failed sources: 1")
        .contains("- threshold: 4 -> 1 (0 ms)")
        .contains("Top scores below threshold: 0.1200")
        .contains("[1] knowledge_base k1 score=0.9000")
        .contains("    fusion -> 0.9000 FusionRecord[method=vector_only");
  }

  @Test
  void explain_ranking_reports_pipeline_failure() {
    given(configResolver.resolve("kb1")).willReturn(CONFIG);
    PipelineTrace trace =
        new PipelineTrace("q", List.of(), List.of(), List.of(), null, null, 0, 3, "boom");
    given(pipeline.retrieveAndRankWithTrace("q", List.of(), CONFIG))
        .willReturn(new RankedContext(List.of(), trace));

    assertThat(tools.explainRanking("kb1", "q"))
        .contains("Pipeline failed: boom")
        .contains("Results:")
        .contains("(none)")
        .doesNotContain("Fusion:");
  }
}
