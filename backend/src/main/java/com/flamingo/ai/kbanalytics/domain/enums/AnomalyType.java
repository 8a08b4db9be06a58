package com.flamingo.ai.kbanalytics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of deviation that made a document stand out from the corpus. */
public enum AnomalyType {
  /** Embedding far from the corpus centroid. */
  CONTENT_OUTLIER,

  /** Word count far from the corpus mean. */
  LENGTH_ANOMALY,

  /** Embedding far from documents sharing its primary topic. */
  TOPIC_MISMATCH,

  /** Sentence length, word length or punctuation unlike the rest of the corpus. */
  STYLE_DEVIATION,

  /** Created far outside the corpus time distribution. */
  TEMPORAL_ANOMALY;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
