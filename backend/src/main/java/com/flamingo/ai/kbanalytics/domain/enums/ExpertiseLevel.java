package com.flamingo.ai.kbanalytics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Discrete expertise classification derived from a per-topic document count. */
public enum ExpertiseLevel {
  /** 0 to 2 documents. */
  BEGINNER,

  /** 3 to 7 documents. */
  INTERMEDIATE,

  /** 8 to 15 documents. */
  ADVANCED,

  /** 16 or more documents. */
  EXPERT;

  /** Maps a document count to its level. Negative counts are treated as zero. */
  public static ExpertiseLevel fromDocCount(long count) {
    if (count <= 2) {
      return BEGINNER;
    }
    if (count <= 7) {
      return INTERMEDIATE;
    }
    if (count <= 15) {
      return ADVANCED;
    }
    return EXPERT;
  }

  public boolean isAtLeast(ExpertiseLevel other) {
    return ordinal() >= other.ordinal();
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
