package com.flamingo.ai.kbanalytics.service.corpus;

import com.flamingo.ai.kbanalytics.domain.entity.DocumentEmbedding;
import com.flamingo.ai.kbanalytics.domain.entity.DocumentUnderstanding;
import com.flamingo.ai.kbanalytics.domain.entity.KnowledgeDocument;
import com.flamingo.ai.kbanalytics.domain.repository.DocumentEmbeddingRepository;
import com.flamingo.ai.kbanalytics.domain.repository.DocumentUnderstandingRepository;
import com.flamingo.ai.kbanalytics.domain.repository.KnowledgeDocumentRepository;
import com.flamingo.ai.kbanalytics.exception.DocumentNotFoundException;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Joins documents, embeddings and understanding rows into {@link DocumentProfile}s. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorpusServiceImpl implements CorpusService {

  private final KnowledgeDocumentRepository documentRepository;
  private final DocumentEmbeddingRepository embeddingRepository;
  private final DocumentUnderstandingRepository understandingRepository;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "corpus.recent", description = "Time to load recently updated documents")
  public List<DocumentProfile> getRecentProfiles(int maxDocuments) {
    List<KnowledgeDocument> documents =
        documentRepository.findRecentlyUpdated(PageRequest.of(0, maxDocuments));
    return toProfiles(documents);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "corpus.all", description = "Time to load the corpus")
  public List<DocumentProfile> getProfiles(UUID categoryId) {
    List<KnowledgeDocument> documents =
        categoryId == null
            ? documentRepository.findAll()
            : documentRepository.findByCategoryId(categoryId);
    List<DocumentProfile> profiles = toProfiles(documents);
    return profiles.stream()
        .sorted(Comparator.comparing(profile -> profile.documentId().toString()))
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public List<DocumentProfile> getProfilesCreatedSince(LocalDateTime from) {
    return toProfiles(documentRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(from));
  }

  @Override
  @Transactional(readOnly = true)
  public List<DocumentProfile> getAuthoredProfiles() {
    return toProfiles(documentRepository.findByAuthorIdIsNotNull());
  }

  @Override
  @Transactional(readOnly = true)
  public DocumentProfile getProfile(UUID documentId) {
    KnowledgeDocument document =
        documentRepository
            .findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    return toProfiles(List.of(document)).get(0);
  }

  @Override
  @Transactional(readOnly = true)
  public long countDocuments() {
    return documentRepository.count();
  }

  @Override
  @Transactional(readOnly = true)
  public long countEmbeddedDocuments() {
    return embeddingRepository.count();
  }

  private List<DocumentProfile> toProfiles(List<KnowledgeDocument> documents) {
    if (documents.isEmpty()) {
      return List.of();
    }
    List<UUID> ids = documents.stream().map(KnowledgeDocument::getId).toList();

    Map<UUID, DocumentEmbedding> embeddings =
        embeddingRepository.findByDocumentIdIn(ids).stream()
            .collect(Collectors.toMap(DocumentEmbedding::getDocumentId, Function.identity()));
    Map<UUID, DocumentUnderstanding> understandings =
        understandingRepository.findByDocumentIdIn(ids).stream()
            .collect(Collectors.toMap(DocumentUnderstanding::getDocumentId, Function.identity()));

    log.debug(
        "Loaded corpus snapshot: {} documents, {} embedded, {} analyzed",
        documents.size(),
        embeddings.size(),
        understandings.size());

    return documents.stream()
        .map(
            document ->
                toProfile(
                    document,
                    embeddings.get(document.getId()),
                    understandings.get(document.getId())))
        .toList();
  }

  private DocumentProfile toProfile(
      KnowledgeDocument document,
      DocumentEmbedding embedding,
      DocumentUnderstanding understanding) {
    DocumentProfile.DocumentProfileBuilder builder =
        DocumentProfile.builder()
            .documentId(document.getId())
            .title(document.getTitle())
            .content(document.getContent())
            .authorId(document.getAuthorId())
            .authorName(document.getAuthorName())
            .authorEmail(document.getAuthorEmail())
            .categoryId(document.getCategoryId())
            .createdAt(document.getCreatedAt())
            .updatedAt(document.getUpdatedAt())
            .vector(embedding != null ? embedding.getVector() : null);

    if (understanding != null) {
      builder
          .summary(understanding.getSummary())
          .topics(understanding.getTopics())
          .technologies(understanding.getTechnologies())
          .insights(understanding.getInsights());
    }
    return builder.build();
  }
}
