package com.flamingo.ai.kbanalytics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of node in the knowledge graph. */
public enum NodeType {
  DOCUMENT("doc"),
  TOPIC("topic"),
  TECHNOLOGY("tech"),
  PERSON("person"),
  INSIGHT("insight");

  private final String idPrefix;

  NodeType(String idPrefix) {
    this.idPrefix = idPrefix;
  }

  /** Builds a node id such as {@code topic-rust} from a normalized key. */
  public String nodeId(String key) {
    return idPrefix + "-" + key;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
