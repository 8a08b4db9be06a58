package com.flamingo.ai.kbanalytics.service.graph;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An undirected edge, stored once per node pair. {@code label} is set on similarity edges only and
 * renders the weight as a percentage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphEdge(String id, String source, String target, double weight, String label) {

  public static GraphEdge similarity(int index, String source, String target, double weight) {
    return new GraphEdge(
        "sim-" + index, source, target, weight, Math.round(weight * 100) + "%");
  }

  public static GraphEdge membership(int index, String source, String target, double weight) {
    return new GraphEdge("e-" + index, source, target, weight, null);
  }

  /** Key identifying the unordered endpoint pair. */
  public String pairKey() {
    return source.compareTo(target) <= 0 ? source + "|" + target : target + "|" + source;
  }
}
