package com.flamingo.ai.kbanalytics.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the semantic analytics engine. */
@Configuration
@ConfigurationProperties(prefix = "analytics")
@Getter
@Setter
public class AnalyticsConfig {

  private Graph graph = new Graph();
  private Clustering clustering = new Clustering();
  private Similarity similarity = new Similarity();
  private Trend trend = new Trend();
  private Anomaly anomaly = new Anomaly();
  private Expertise expertise = new Expertise();

  @Getter
  @Setter
  public static class Graph {
    private double defaultThreshold = 0.5;
    private int defaultMaxEdges = 5;

    /** Upper bound for the per-node similarity edge cap. */
    private int maxEdgesHardCap = 20;

    private int defaultMaxDocuments = 100;
  }

  @Getter
  @Setter
  public static class Clustering {
    /** Upper bound of the cluster counts tried when a request names none. */
    private int maxAutoClusters = 8;

    private int minDocuments = 3;
    private int maxIterations = 100;
    private int keywordsPerCluster = 5;

    /** How long a finished job stays queryable. */
    private Duration jobRetention = Duration.ofHours(24);

    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 50;
  }

  @Getter
  @Setter
  public static class Similarity {
    private int defaultLimit = 10;
    private int maxLimit = 50;
    private double defaultMinSimilarity = 0.5;
    private int sharedKeywordLimit = 5;

    /** Default lower bound for two documents to be reported as duplicates. */
    private double duplicateThreshold = 0.8;

    private int duplicateMaxDocuments = 1000;
  }

  @Getter
  @Setter
  public static class Trend {
    private int defaultDays = 30;
    private int maxDays = 365;

    /** Growth rates within +/- this band classify as STABLE. */
    private double stableBand = 0.1;

    private int topTopics = 10;
    private int topKeywords = 10;
  }

  @Getter
  @Setter
  public static class Anomaly {
    /** Minimum |z| a deviation needs to be reported. */
    private double significanceFloor = 2.0;

    private double minStdDev = 1.0;
    private int minCorpusSize = 3;
    private int maxResults = 50;
  }

  @Getter
  @Setter
  public static class Expertise {
    private int maxAreasPerMember = 10;
    private int topTechnologies = 5;
    private int topTopics = 5;
  }
}
