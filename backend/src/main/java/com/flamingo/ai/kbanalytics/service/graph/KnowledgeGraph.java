package com.flamingo.ai.kbanalytics.service.graph;

import java.util.List;

/** A fully built graph. Every edge endpoint is the id of a node in {@code nodes}. */
public record KnowledgeGraph(List<GraphNode> nodes, List<GraphEdge> edges, GraphMeta meta) {}
