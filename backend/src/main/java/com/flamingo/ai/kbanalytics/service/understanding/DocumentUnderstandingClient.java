package com.flamingo.ai.kbanalytics.service.understanding;

import com.flamingo.ai.kbanalytics.agent.DocumentUnderstandingAgent;
import com.flamingo.ai.kbanalytics.agent.dto.DocumentUnderstandingResult;
import com.flamingo.ai.kbanalytics.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Calls the document understanding agent behind the shared OpenAI circuit breaker. */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentUnderstandingClient {

  static final int MAX_CONTENT_CHARS = 12000;

  private final DocumentUnderstandingAgent agent;
  private final MeterRegistry meterRegistry;

  @Timed(value = "understanding.analyze", description = "Time to analyze a document with the LLM")
  @CircuitBreaker(name = "openai", fallbackMethod = "analyzeFallback")
  public DocumentUnderstandingResult analyze(String title, String content) {
    String body = content == null ? "" : content;
    if (body.length() > MAX_CONTENT_CHARS) {
      log.debug(
          "Truncating content from {} to {} chars for analysis",
          body.length(),
          MAX_CONTENT_CHARS);
      body = body.substring(0, MAX_CONTENT_CHARS);
    }
    DocumentUnderstandingResult result = agent.analyze(title == null ? "" : title, body);
    if (result == null) {
      throw new ExternalServiceException("understanding", "Agent returned no result");
    }
    meterRegistry.counter("understanding.requests", "status", "success").increment();
    return result;
  }

  @SuppressWarnings("unused")
  private DocumentUnderstandingResult analyzeFallback(String title, String content, Throwable t) {
    log.error("Document analysis failed, circuit breaker engaged: {}", t.getMessage());
    meterRegistry.counter("understanding.requests", "status", "failure").increment();
    if (t instanceof ExternalServiceException external) {
      throw external;
    }
    throw new ExternalServiceException("understanding", "Document analysis failed", t);
  }
}
