package com.flamingo.ai.kbanalytics.service.similarity;

import java.util.UUID;

/** One ranked hit from a similarity query. */
public record SimilarityMatch(UUID documentId, double similarity) {}
