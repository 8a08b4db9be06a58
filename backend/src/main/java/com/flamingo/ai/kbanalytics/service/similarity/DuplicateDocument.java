package com.flamingo.ai.kbanalytics.service.similarity;

import java.time.LocalDateTime;
import java.util.UUID;

/** One side of a duplicate pair. */
public record DuplicateDocument(
    UUID documentId, String title, UUID authorId, String authorName, LocalDateTime createdAt) {}
