package com.flamingo.ai.kbanalytics.config;

import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

  private final AnalyticsConfig analyticsConfig;

  @Bean(name = "clusteringExecutor")
  public Executor clusteringExecutor() {
    AnalyticsConfig.Clustering clustering = analyticsConfig.getClustering();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(clustering.getCorePoolSize());
    executor.setMaxPoolSize(clustering.getMaxPoolSize());
    executor.setQueueCapacity(clustering.getQueueCapacity());
    executor.setThreadNamePrefix("clustering-");
    executor.initialize();
    return executor;
  }
}
