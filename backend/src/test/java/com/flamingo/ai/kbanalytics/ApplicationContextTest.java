package com.flamingo.ai.kbanalytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.kbanalytics.service.anomaly.AnomalyService;
import com.flamingo.ai.kbanalytics.service.clustering.ClusteringService;
import com.flamingo.ai.kbanalytics.service.embedding.DocumentEmbeddingService;
import com.flamingo.ai.kbanalytics.service.expertise.ExpertiseService;
import com.flamingo.ai.kbanalytics.service.graph.KnowledgeGraphService;
import com.flamingo.ai.kbanalytics.service.similarity.SimilarDocumentService;
import com.flamingo.ai.kbanalytics.service.trend.TrendService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Integration test that verifies the Spring application context loads correctly. Uses @MockitoBean
 * for the OpenAI models so the test can run without an API key.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ClusteringService.class)).isNotNull();
    assertThat(applicationContext.getBean(SimilarDocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(KnowledgeGraphService.class)).isNotNull();
    assertThat(applicationContext.getBean(ExpertiseService.class)).isNotNull();
    assertThat(applicationContext.getBean(TrendService.class)).isNotNull();
    assertThat(applicationContext.getBean(AnomalyService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentEmbeddingService.class)).isNotNull();
  }
}
