package com.flamingo.ai.kbanalytics.service.graph;

import com.flamingo.ai.kbanalytics.service.corpus.CorpusService;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import com.flamingo.ai.kbanalytics.service.expertise.ExpertiseService;
import com.flamingo.ai.kbanalytics.service.expertise.TeamExpertiseMap;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of KnowledgeGraphService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeGraphServiceImpl implements KnowledgeGraphService {

  private final CorpusService corpusService;
  private final ExpertiseService expertiseService;
  private final GraphBuilder graphBuilder;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "graph.build", description = "Time to build the knowledge graph")
  public KnowledgeGraph buildGraph(KnowledgeGraphQuery query) {
    log.info(
        "Building knowledge graph: threshold={}, maxEdges={}, maxDocuments={}",
        query.threshold(),
        query.maxEdges(),
        query.maxDocuments());

    List<DocumentProfile> documents = corpusService.getRecentProfiles(query.maxDocuments());
    TeamExpertiseMap expertise =
        query.includePeople() ? expertiseService.buildTeamExpertiseMap() : null;

    KnowledgeGraph graph = graphBuilder.build(documents, query, expertise);
    meterRegistry.summary("graph.nodes").record(graph.nodes().size());
    meterRegistry.summary("graph.edges").record(graph.edges().size());
    return graph;
  }
}
