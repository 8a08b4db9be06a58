package com.flamingo.ai.kbanalytics.service.clustering;

import java.util.List;
import java.util.UUID;

/**
 * One cluster of a clustering run. {@code centroid} is the mean of the members' vectors.
 *
 * @param memberDocumentIds member ids in ascending id order
 */
public record DocumentCluster(
    int id,
    String name,
    String description,
    float[] centroid,
    int documentCount,
    List<UUID> memberDocumentIds,
    List<String> keywords) {

  public DocumentCluster withLabels(String newName, String newDescription, List<String> labels) {
    return new DocumentCluster(
        id,
        newName,
        newDescription,
        centroid,
        documentCount,
        memberDocumentIds,
        List.copyOf(labels));
  }
}
