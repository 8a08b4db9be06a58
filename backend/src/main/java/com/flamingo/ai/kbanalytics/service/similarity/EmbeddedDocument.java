package com.flamingo.ai.kbanalytics.service.similarity;

import java.util.UUID;

/** A document id paired with its embedding vector, the unit the engine computes over. */
public record EmbeddedDocument(UUID documentId, float[] vector) {}
