package com.flamingo.ai.kbanalytics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** How close two documents flagged as duplicates are, by cosine similarity and authorship. */
public enum DuplicateType {
  /** Similarity above 0.95. */
  EXACT_DUPLICATE,

  /** Similarity above 0.8, same author. */
  AUTHOR_NEAR_DUPLICATE,

  /** Similarity above 0.8, different or unknown authors. */
  CROSS_AUTHOR_NEAR_DUPLICATE,

  /** Similarity above 0.6. */
  SIMILAR_CONTENT,

  /** Anything lower that still met the requested threshold. */
  POTENTIAL_DUPLICATE;

  private static final double EXACT = 0.95;
  private static final double NEAR = 0.8;
  private static final double SIMILAR = 0.6;

  public static DuplicateType classify(double similarity, boolean sameAuthor) {
    if (similarity > EXACT) {
      return EXACT_DUPLICATE;
    }
    if (similarity > NEAR) {
      return sameAuthor ? AUTHOR_NEAR_DUPLICATE : CROSS_AUTHOR_NEAR_DUPLICATE;
    }
    if (similarity > SIMILAR) {
      return SIMILAR_CONTENT;
    }
    return POTENTIAL_DUPLICATE;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
