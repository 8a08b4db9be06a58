package com.flamingo.ai.kbanalytics.api.dto.response;

import com.flamingo.ai.kbanalytics.domain.entity.DocumentUnderstanding;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored document analysis. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentUnderstandingResponse {

  private UUID documentId;
  private String summary;
  private List<String> topics;
  private List<String> technologies;
  private List<String> insights;
  private String analyzerModel;
  private LocalDateTime analyzedAt;

  /** Creates a response from a DocumentUnderstanding entity. */
  public static DocumentUnderstandingResponse fromEntity(DocumentUnderstanding understanding) {
    return DocumentUnderstandingResponse.builder()
        .documentId(understanding.getDocumentId())
        .summary(understanding.getSummary())
        .topics(understanding.getTopics())
        .technologies(understanding.getTechnologies())
        .insights(understanding.getInsights())
        .analyzerModel(understanding.getAnalyzerModel())
        .analyzedAt(understanding.getAnalyzedAt())
        .build();
  }
}
