package com.flamingo.ai.kbanalytics.api.rest;

import com.flamingo.ai.kbanalytics.api.dto.response.DocumentUnderstandingResponse;
import com.flamingo.ai.kbanalytics.domain.entity.DocumentUnderstanding;
import com.flamingo.ai.kbanalytics.service.embedding.DocumentEmbeddingService;
import com.flamingo.ai.kbanalytics.service.embedding.EmbeddingResult;
import com.flamingo.ai.kbanalytics.service.understanding.DocumentUnderstandingService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for refreshing a document's embedding and AI analysis. */
@RestController
@RequestMapping("/api/embeddings")
@RequiredArgsConstructor
@Slf4j
public class EmbeddingController {

  private final DocumentEmbeddingService documentEmbeddingService;
  private final DocumentUnderstandingService documentUnderstandingService;

  /**
   * Embeds a document and stores the vector, replacing any earlier one.
   *
   * @param documentId the document ID
   * @return what was stored
   */
  @PostMapping("/documents/{documentId}")
  public ResponseEntity<EmbeddingResult> embedDocument(@PathVariable UUID documentId) {
    log.info("Embedding document {}", documentId);
    return ResponseEntity.ok(documentEmbeddingService.embedDocument(documentId));
  }

  /**
   * Extracts summary, topics, technologies and insights for a document.
   *
   * @param documentId the document ID
   * @return the stored analysis
   */
  @PostMapping("/documents/{documentId}/understanding")
  public ResponseEntity<DocumentUnderstandingResponse> analyzeDocument(
      @PathVariable UUID documentId) {
    DocumentUnderstanding understanding = documentUnderstandingService.analyzeDocument(documentId);
    return ResponseEntity.ok(DocumentUnderstandingResponse.fromEntity(understanding));
  }
}
