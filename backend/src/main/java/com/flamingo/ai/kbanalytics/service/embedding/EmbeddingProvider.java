package com.flamingo.ai.kbanalytics.service.embedding;

/** Produces a fixed-length embedding vector for a text. */
public interface EmbeddingProvider {

  /**
   * Embeds {@code text}.
   *
   * @return the vector, always of {@link #dimensions()} length
   * @throws com.flamingo.ai.kbanalytics.exception.ExternalServiceException if the provider is
   *     unreachable or returns a malformed vector
   */
  float[] embed(String text);

  int dimensions();

  String modelName();
}
