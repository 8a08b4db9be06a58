package com.flamingo.ai.kbanalytics.domain.repository;

import com.flamingo.ai.kbanalytics.domain.entity.KnowledgeDocument;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Read access to knowledge-base documents. */
@Repository
public interface KnowledgeDocumentRepository extends JpaRepository<KnowledgeDocument, UUID> {

  /** Most recently updated documents first, ties broken by id for a stable order. */
  @Query("SELECT d FROM KnowledgeDocument d ORDER BY d.updatedAt DESC, d.id ASC")
  List<KnowledgeDocument> findRecentlyUpdated(Pageable pageable);

  List<KnowledgeDocument> findByCategoryId(UUID categoryId);

  List<KnowledgeDocument> findByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(LocalDateTime from);

  List<KnowledgeDocument> findByAuthorIdIsNotNull();
}
