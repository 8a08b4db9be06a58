package com.flamingo.ai.kbanalytics.domain.repository;

import com.flamingo.ai.kbanalytics.domain.entity.DocumentEmbedding;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for persisted document embeddings. */
@Repository
public interface DocumentEmbeddingRepository extends JpaRepository<DocumentEmbedding, UUID> {

  Optional<DocumentEmbedding> findByDocumentId(UUID documentId);

  List<DocumentEmbedding> findByDocumentIdIn(Collection<UUID> documentIds);
}
