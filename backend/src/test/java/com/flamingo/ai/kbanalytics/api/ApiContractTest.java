package com.flamingo.ai.kbanalytics.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.kbanalytics.api.rest.EmbeddingController;
import com.flamingo.ai.kbanalytics.api.rest.HealthController;
import com.flamingo.ai.kbanalytics.api.rest.KnowledgeGraphController;
import com.flamingo.ai.kbanalytics.api.rest.MlAnalyticsController;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify controllers stay mapped to the published paths:
 *
 * <ul>
 *   <li>GET /api/knowledge-graph - Build the knowledge graph
 *   <li>GET /api/knowledge-graph/team-expertise - Team expertise map
 *   <li>POST /api/ml/clustering - Submit a clustering job
 *   <li>GET /api/ml/clustering/{jobId} - Poll a job
 *   <li>GET /api/ml/clustering/{jobId}/result - Fetch a completed result
 *   <li>GET /api/ml/documents/{documentId}/similar - Similar documents
 *   <li>GET /api/ml/duplicates - Duplicate detection
 *   <li>GET /api/ml/trends - Trend analysis
 *   <li>GET /api/ml/anomalies - Anomaly detection
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("KnowledgeGraphController API contract")
  class KnowledgeGraphControllerContract {

    @Test
    @DisplayName("should be mapped to /api/knowledge-graph")
    void shouldBeMappedToKnowledgeGraph() {
      RequestMapping mapping = KnowledgeGraphController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/knowledge-graph");
    }

    @Test
    @DisplayName("should expose the team expertise map")
    void shouldExposeTeamExpertise() {
      assertThat(getPaths(KnowledgeGraphController.class)).contains("/team-expertise");
    }
  }

  @Nested
  @DisplayName("MlAnalyticsController API contract")
  class MlAnalyticsControllerContract {

    @Test
    @DisplayName("should be mapped to /api/ml")
    void shouldBeMappedToApiMl() {
      RequestMapping mapping = MlAnalyticsController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/ml");
    }

    @Test
    @DisplayName("should expose clustering, similarity, duplicate, trend and anomaly endpoints")
    void shouldExposeAnalyticsEndpoints() {
      assertThat(getPaths(MlAnalyticsController.class))
          .contains(
              "/clustering/{jobId}",
              "/clustering/{jobId}/result",
              "/documents/{documentId}/similar",
              "/duplicates",
              "/trends",
              "/anomalies");
      assertThat(postPaths(MlAnalyticsController.class)).containsExactly("/clustering");
    }
  }

  @Nested
  @DisplayName("EmbeddingController API contract")
  class EmbeddingControllerContract {

    @Test
    @DisplayName("should be mapped to /api/embeddings")
    void shouldBeMappedToApiEmbeddings() {
      RequestMapping mapping = EmbeddingController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/embeddings");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }

  private static String[] getPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(method -> method.getAnnotation(GetMapping.class))
        .filter(mapping -> mapping != null)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toArray(String[]::new);
  }

  private static String[] postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(method -> method.getAnnotation(PostMapping.class))
        .filter(mapping -> mapping != null)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toArray(String[]::new);
  }
}
