package com.flamingo.ai.kbanalytics.domain.entity;

import com.flamingo.ai.kbanalytics.domain.converter.FloatArrayConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One embedding vector per document; re-embedding overwrites the row in place. */
@Entity
@Table(name = "document_embeddings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentEmbedding {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true)
  private UUID documentId;

  /** Embedding vector stored as a JSON array. */
  @Convert(converter = FloatArrayConverter.class)
  @Column(columnDefinition = "TEXT", nullable = false)
  private float[] vector;

  private String model;

  private Integer dimensions;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Replaces the stored vector, keeping the row identity. */
  public void replaceVector(float[] newVector, String newModel) {
    this.vector = newVector;
    this.model = newModel;
    this.dimensions = newVector.length;
  }
}
