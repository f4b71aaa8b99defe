package dev.loom.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryEmbedderTest {

  private static final Embedding FIRST = Embedding.from(new float[] {1f, 0f});
  private static final Embedding SECOND = Embedding.from(new float[] {0f, 1f});

  @Mock EmbeddingModel embeddingModel;

  @Test
  void embedsAllQueriesInOneBatchWithPrefix() {
    given(embeddingModel.embedAll(anyList())).willReturn(Response.from(List.of(FIRST, SECOND)));
    QueryEmbedder embedder = new QueryEmbedder(embeddingModel, "query: ");

    Map<String, Embedding> embeddings = embedder.embedAll(List.of("a", "b"));

    assertThat(embeddings).containsExactly(Map.entry("a", FIRST), Map.entry("b", SECOND));
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<TextSegment>> segments = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(segments.capture());
    assertThat(segments.getValue())
        .extracting(TextSegment::text)
        .containsExactly("query: a", "query: b");
  }

  @Test
  void fallsBackToSingleEmbeddingsWhenBatchFails() {
    given(embeddingModel.embedAll(anyList())).willThrow(new IllegalStateException("batch"));
    given(embeddingModel.embed("query: a")).willReturn(Response.from(FIRST));
    given(embeddingModel.embed("query: b")).willThrow(new IllegalStateException("bad input"));
    QueryEmbedder embedder = new QueryEmbedder(embeddingModel, "query: ");

    Map<String, Embedding> embeddings = embedder.embedAll(List.of("a", "b"));

    assertThat(embeddings).containsOnlyKeys("a");
  }

  @Test
  void noQueriesMeansNoModelCall() {
    QueryEmbedder embedder = new QueryEmbedder(embeddingModel, "query: ");

    assertThat(embedder.embedAll(List.of())).isEmpty();
  }
}
