package com.flamingo.ai.kbanalytics.domain.entity;

import com.flamingo.ai.kbanalytics.domain.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** AI-extracted metadata for a document: topics, technologies and insights. */
@Entity
@Table(name = "document_understanding")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentUnderstanding {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true)
  private UUID documentId;

  @Column(columnDefinition = "TEXT")
  private String summary;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> topics = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> technologies = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> insights = new ArrayList<>();

  private String analyzerModel;

  private LocalDateTime analyzedAt;
}
