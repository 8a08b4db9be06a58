package com.flamingo.ai.kbanalytics.service.embedding;

import java.time.LocalDateTime;
import java.util.UUID;

/** Outcome of (re-)embedding one document. */
public record EmbeddingResult(
    UUID documentId, String model, int dimensions, boolean replaced, LocalDateTime embeddedAt) {}
