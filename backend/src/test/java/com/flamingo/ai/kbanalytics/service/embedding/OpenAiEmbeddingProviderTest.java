package com.flamingo.ai.kbanalytics.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.kbanalytics.exception.ExternalServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpenAiEmbeddingProvider Tests")
class OpenAiEmbeddingProviderTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private OpenAiEmbeddingProvider provider;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);

    provider = new OpenAiEmbeddingProvider(embeddingModel, meterRegistry, 3, "test-embedding");
  }

  @Test
  @DisplayName("Should return the model vector and count the success")
  void shouldEmbedText() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f, 0.2f, 0.3f));

    float[] vector = provider.embed("Kafka consumer groups");

    assertThat(vector).containsExactly(0.1f, 0.2f, 0.3f);
    verify(meterRegistry.counter("embedding.requests.success")).increment();
    assertThat(provider.dimensions()).isEqualTo(3);
    assertThat(provider.modelName()).isEqualTo("test-embedding");
  }

  @Test
  @DisplayName("Should truncate very long text before embedding")
  void shouldTruncateLongText() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(1f, 0f, 0f));

    provider.embed("a".repeat(6000));

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(OpenAiEmbeddingProvider.MAX_CHARS_PER_EMBEDDING);
  }

  @Test
  @DisplayName("Should reject vectors of the wrong dimension")
  void shouldRejectDimensionMismatch() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f, 0.2f));

    assertThatThrownBy(() -> provider.embed("short"))
        .isInstanceOf(ExternalServiceException.class)
        .hasMessageContaining("2 dimensions")
        .hasMessageContaining("expected 3");
    verify(counter, never()).increment();
  }

  @Test
  @DisplayName("Should embed null text as empty input")
  void shouldHandleNullText() {
    when(embeddingModel.embed("")).thenReturn(createResponse(0f, 0f, 1f));

    assertThat(provider.embed(null)).containsExactly(0f, 0f, 1f);
  }

  private static Response<Embedding> createResponse(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
