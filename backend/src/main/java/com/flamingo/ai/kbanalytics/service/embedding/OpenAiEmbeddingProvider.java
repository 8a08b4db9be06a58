package com.flamingo.ai.kbanalytics.service.embedding;

import com.flamingo.ai.kbanalytics.exception.ExternalServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Embedding provider backed by the LangChain4j OpenAI embedding model. */
@Service
@Slf4j
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense CJK text
  static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;
  private final int dimensions;
  private final String modelName;

  public OpenAiEmbeddingProvider(
      EmbeddingModel embeddingModel,
      MeterRegistry meterRegistry,
      @Value("${langchain4j.openai.embedding-model.dimensions:1536}") int dimensions,
      @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
          String modelName) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
    this.dimensions = dimensions;
    this.modelName = modelName;
  }

  @Override
  @Timed(value = "embedding.embed", description = "Time to embed a document")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  public float[] embed(String text) {
    String input = text == null ? "" : text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }

    Response<Embedding> response = embeddingModel.embed(input);
    float[] vector = response.content().vector();
    if (vector == null || vector.length != dimensions) {
      throw new ExternalServiceException(
          "embedding",
          "Embedding provider returned "
              + (vector == null ? "no vector" : vector.length + " dimensions")
              + ", expected "
              + dimensions);
    }
    meterRegistry.counter("embedding.requests.success").increment();
    return vector;
  }

  @Override
  public int dimensions() {
    return dimensions;
  }

  @Override
  public String modelName() {
    return modelName;
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker engaged: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    if (t instanceof ExternalServiceException external) {
      throw external;
    }
    throw new ExternalServiceException("embedding", "Embedding provider call failed", t);
  }
}
