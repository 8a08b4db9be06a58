package com.flamingo.ai.kbanalytics.service.corpus;

import com.flamingo.ai.kbanalytics.service.similarity.EmbeddedDocument;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.Builder;

/**
 * Immutable per-document view joining the document row, its AI-extracted metadata and its
 * embedding. {@code vector} is null when the document has not been embedded.
 */
@Builder(toBuilder = true)
public record DocumentProfile(
    UUID documentId,
    String title,
    String content,
    UUID authorId,
    String authorName,
    String authorEmail,
    UUID categoryId,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    String summary,
    List<String> topics,
    List<String> technologies,
    List<String> insights,
    float[] vector) {

  public DocumentProfile {
    topics = topics == null ? List.of() : List.copyOf(topics);
    technologies = technologies == null ? List.of() : List.copyOf(technologies);
    insights = insights == null ? List.of() : List.copyOf(insights);
  }

  public boolean hasEmbedding() {
    return vector != null && vector.length > 0;
  }

  public EmbeddedDocument toEmbedded() {
    return new EmbeddedDocument(documentId, vector);
  }

  public String displayTitle() {
    return title == null || title.isBlank() ? "Untitled" : title;
  }

  /** First extracted topic, used as the document's topic assignment. */
  public String primaryTopic() {
    return topics.isEmpty() ? null : topics.get(0);
  }
}
