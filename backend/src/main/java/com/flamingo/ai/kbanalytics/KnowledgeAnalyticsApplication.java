package com.flamingo.ai.kbanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the knowledge-base semantic analytics service. */
@SpringBootApplication
public class KnowledgeAnalyticsApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeAnalyticsApplication.class, args);
  }
}
