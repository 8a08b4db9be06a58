package com.flamingo.ai.kbanalytics.domain.repository;

import com.flamingo.ai.kbanalytics.domain.entity.DocumentUnderstanding;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for AI-extracted document metadata. */
@Repository
public interface DocumentUnderstandingRepository
    extends JpaRepository<DocumentUnderstanding, UUID> {

  Optional<DocumentUnderstanding> findByDocumentId(UUID documentId);

  List<DocumentUnderstanding> findByDocumentIdIn(Collection<UUID> documentIds);
}
