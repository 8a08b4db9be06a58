package com.flamingo.ai.kbanalytics.api.rest;

import com.flamingo.ai.kbanalytics.config.AnalyticsConfig;
import com.flamingo.ai.kbanalytics.service.expertise.ExpertiseService;
import com.flamingo.ai.kbanalytics.service.expertise.TeamExpertiseMap;
import com.flamingo.ai.kbanalytics.service.graph.KnowledgeGraph;
import com.flamingo.ai.kbanalytics.service.graph.KnowledgeGraphQuery;
import com.flamingo.ai.kbanalytics.service.graph.KnowledgeGraphService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the knowledge graph and the team expertise map. */
@RestController
@RequestMapping("/api/knowledge-graph")
@RequiredArgsConstructor
@Slf4j
public class KnowledgeGraphController {

  private final KnowledgeGraphService knowledgeGraphService;
  private final ExpertiseService expertiseService;
  private final AnalyticsConfig analyticsConfig;

  /**
   * Builds the knowledge graph over the most recently updated documents.
   *
   * @param threshold minimum similarity for a document-document edge, in [0, 1]
   * @param maxEdges maximum similarity edges per document
   * @param maxDocuments number of recent documents to include
   * @return nodes, edges and build metadata
   */
  @GetMapping
  public ResponseEntity<KnowledgeGraph> getKnowledgeGraph(
      @RequestParam(required = false) Double threshold,
      @RequestParam(required = false) Integer maxEdges,
      @RequestParam(required = false) Boolean includeTopics,
      @RequestParam(required = false) Boolean includeTechnologies,
      @RequestParam(required = false) Boolean includeInsights,
      @RequestParam(required = false) Boolean includePeople,
      @RequestParam(required = false) Integer maxDocuments) {
    KnowledgeGraphQuery query =
        KnowledgeGraphQuery.resolve(
            threshold,
            maxEdges,
            includeTopics,
            includeTechnologies,
            includeInsights,
            includePeople,
            maxDocuments,
            analyticsConfig.getGraph());
    return ResponseEntity.ok(knowledgeGraphService.buildGraph(query));
  }

  /** Returns who knows what across all authored documents. */
  @GetMapping("/team-expertise")
  public ResponseEntity<TeamExpertiseMap> getTeamExpertise() {
    return ResponseEntity.ok(expertiseService.buildTeamExpertiseMap());
  }
}
