package com.flamingo.ai.kbanalytics.service.graph;

/** Parameters and totals describing how a graph was built. */
public record GraphMeta(
    int totalDocuments,
    double similarityThreshold,
    int maxEdgesPerNode,
    int totalNodes,
    int totalEdges) {}
