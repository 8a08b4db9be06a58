package com.flamingo.ai.kbanalytics.service.similarity;

import java.util.List;
import java.util.UUID;

/** A document similar to the query document, with the labels both share. */
public record DocumentSimilarity(
    UUID documentId, String title, double similarityScore, List<String> sharedKeywords) {}
