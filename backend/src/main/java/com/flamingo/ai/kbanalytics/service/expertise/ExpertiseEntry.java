package com.flamingo.ai.kbanalytics.service.expertise;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.kbanalytics.domain.enums.ExpertiseLevel;
import java.util.UUID;

/** Number of distinct documents a user wrote on one topic or technology. */
public record ExpertiseEntry(UUID userId, String topic, long documentCount) {

  /** Always derived from {@code documentCount}. */
  @JsonProperty("level")
  public ExpertiseLevel level() {
    return ExpertiseLevel.fromDocCount(documentCount);
  }
}
