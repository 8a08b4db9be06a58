package com.flamingo.ai.kbanalytics.api.dto.request;

import com.flamingo.ai.kbanalytics.domain.enums.ClusteringAlgorithm;
import com.flamingo.ai.kbanalytics.service.clustering.StartClusteringCommand;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for submitting a clustering job. Every field is optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartClusteringRequest {

  @Positive(message = "numClusters must be positive")
  @Max(value = 1000, message = "numClusters must be at most 1000")
  private Integer numClusters;

  private ClusteringAlgorithm algorithm;

  private UUID categoryId;

  @Min(value = 1, message = "minDocuments must be at least 1")
  private Integer minDocuments;

  public StartClusteringCommand toCommand() {
    return new StartClusteringCommand(numClusters, algorithm, categoryId, minDocuments);
  }
}
