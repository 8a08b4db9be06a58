package com.flamingo.ai.kbanalytics.service.understanding;

import com.flamingo.ai.kbanalytics.agent.dto.DocumentUnderstandingResult;
import com.flamingo.ai.kbanalytics.domain.entity.DocumentUnderstanding;
import com.flamingo.ai.kbanalytics.domain.entity.KnowledgeDocument;
import com.flamingo.ai.kbanalytics.domain.repository.DocumentUnderstandingRepository;
import com.flamingo.ai.kbanalytics.domain.repository.KnowledgeDocumentRepository;
import com.flamingo.ai.kbanalytics.exception.DocumentNotFoundException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of DocumentUnderstandingService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentUnderstandingServiceImpl implements DocumentUnderstandingService {

  private final KnowledgeDocumentRepository documentRepository;
  private final DocumentUnderstandingRepository understandingRepository;
  private final DocumentUnderstandingClient understandingClient;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String analyzerModel;

  @Override
  @Transactional
  public DocumentUnderstanding analyzeDocument(UUID documentId) {
    KnowledgeDocument document =
        documentRepository
            .findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));

    DocumentUnderstandingResult result =
        understandingClient.analyze(document.getTitle(), document.getContent());

    DocumentUnderstanding understanding =
        understandingRepository
            .findByDocumentId(documentId)
            .orElseGet(() -> DocumentUnderstanding.builder().documentId(documentId).build());
    understanding.setSummary(result.summary());
    understanding.setTopics(cleanLabels(result.topics()));
    understanding.setTechnologies(cleanLabels(result.technologies()));
    understanding.setInsights(cleanLabels(result.insights()));
    understanding.setAnalyzerModel(analyzerModel);
    understanding.setAnalyzedAt(LocalDateTime.now());

    DocumentUnderstanding saved = understandingRepository.save(understanding);
    log.info(
        "Analyzed document {}: {} topics, {} technologies, {} insights",
        documentId,
        saved.getTopics().size(),
        saved.getTechnologies().size(),
        saved.getInsights().size());
    return saved;
  }

  /** Trims labels and drops blanks and exact duplicates, keeping the agent's order. */
  static List<String> cleanLabels(List<String> labels) {
    if (labels == null) {
      return new ArrayList<>();
    }
    LinkedHashSet<String> cleaned = new LinkedHashSet<>();
    for (String label : labels) {
      if (label != null && !label.isBlank()) {
        cleaned.add(label.trim());
      }
    }
    return new ArrayList<>(cleaned);
  }
}
