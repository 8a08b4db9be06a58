package com.flamingo.ai.kbanalytics.service.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.kbanalytics.domain.enums.NodeType;
import java.util.List;
import java.util.UUID;

/**
 * A node of the knowledge graph. {@code documentId} and {@code summary} are only set on document
 * nodes and are omitted from the JSON form when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphNode(
    String id,
    String label,
    @JsonProperty("type") NodeType nodeType,
    UUID documentId,
    long documentCount,
    String summary,
    List<String> topics) {

  public GraphNode {
    topics = topics == null ? List.of() : List.copyOf(topics);
  }

  public static GraphNode document(
      UUID documentId, String title, String summary, List<String> topics) {
    return new GraphNode(
        NodeType.DOCUMENT.nodeId(documentId.toString()),
        title,
        NodeType.DOCUMENT,
        documentId,
        0,
        summary,
        topics);
  }

  public static GraphNode derived(NodeType type, String key, String label, long documentCount) {
    return new GraphNode(type.nodeId(key), label, type, null, documentCount, null, List.of());
  }
}
