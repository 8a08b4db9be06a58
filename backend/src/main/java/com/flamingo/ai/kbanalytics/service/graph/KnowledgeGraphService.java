package com.flamingo.ai.kbanalytics.service.graph;

/** Service interface for building the knowledge graph. */
public interface KnowledgeGraphService {

  /**
   * Builds the graph over the most recently updated documents. The whole request fails if any step
   * fails; partial graphs are never returned.
   *
   * @param query validated build parameters
   * @return the graph
   */
  KnowledgeGraph buildGraph(KnowledgeGraphQuery query);
}
