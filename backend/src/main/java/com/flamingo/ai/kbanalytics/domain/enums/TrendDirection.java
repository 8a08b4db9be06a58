package com.flamingo.ai.kbanalytics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Direction of a trend over the analysis window. */
public enum TrendDirection {
  UP,
  DOWN,
  STABLE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
