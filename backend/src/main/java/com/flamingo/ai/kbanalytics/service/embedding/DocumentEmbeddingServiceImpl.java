package com.flamingo.ai.kbanalytics.service.embedding;

import com.flamingo.ai.kbanalytics.domain.entity.DocumentEmbedding;
import com.flamingo.ai.kbanalytics.domain.entity.KnowledgeDocument;
import com.flamingo.ai.kbanalytics.domain.repository.DocumentEmbeddingRepository;
import com.flamingo.ai.kbanalytics.domain.repository.KnowledgeDocumentRepository;
import com.flamingo.ai.kbanalytics.exception.DocumentNotFoundException;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of DocumentEmbeddingService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentEmbeddingServiceImpl implements DocumentEmbeddingService {

  private final KnowledgeDocumentRepository documentRepository;
  private final DocumentEmbeddingRepository embeddingRepository;
  private final EmbeddingProvider embeddingProvider;

  @Override
  @Transactional
  public EmbeddingResult embedDocument(UUID documentId) {
    KnowledgeDocument document =
        documentRepository
            .findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));

    String text =
        document.getTitle() + "\n\n" + (document.getContent() == null ? "" : document.getContent());
    float[] vector = embeddingProvider.embed(text);

    Optional<DocumentEmbedding> existing = embeddingRepository.findByDocumentId(documentId);
    DocumentEmbedding embedding;
    if (existing.isPresent()) {
      embedding = existing.get();
      embedding.replaceVector(vector, embeddingProvider.modelName());
    } else {
      embedding =
          DocumentEmbedding.builder()
              .documentId(documentId)
              .vector(vector)
              .model(embeddingProvider.modelName())
              .dimensions(vector.length)
              .build();
    }
    embeddingRepository.save(embedding);

    log.info(
        "{} embedding for document {} ({} dimensions)",
        existing.isPresent() ? "Replaced" : "Stored",
        documentId,
        vector.length);
    return new EmbeddingResult(
        documentId,
        embeddingProvider.modelName(),
        vector.length,
        existing.isPresent(),
        LocalDateTime.now());
  }
}
