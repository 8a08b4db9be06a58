package com.flamingo.ai.kbanalytics.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Clustering algorithm requested by the caller.
 *
 * <p>Only {@link #KMEANS} has a dedicated implementation. The other tags are accepted and run as
 * k-means; the result reports both the requested and the effective algorithm.
 */
public enum ClusteringAlgorithm {
  KMEANS("kmeans", true),
  DBSCAN("dbscan", false),
  HIERARCHICAL("hierarchical", false),
  SPECTRAL("spectral", false);

  private final String wireName;
  private final boolean implemented;

  ClusteringAlgorithm(String wireName, boolean implemented) {
    this.wireName = wireName;
    this.implemented = implemented;
  }

  public boolean isImplemented() {
    return implemented;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  @JsonCreator
  public static ClusteringAlgorithm fromWireName(String value) {
    if (value == null) {
      return null;
    }
    for (ClusteringAlgorithm algorithm : values()) {
      if (algorithm.wireName.equalsIgnoreCase(value) || algorithm.name().equalsIgnoreCase(value)) {
        return algorithm;
      }
    }
    throw new IllegalArgumentException("Unknown clustering algorithm: " + value);
  }
}
