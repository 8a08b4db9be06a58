package com.flamingo.ai.kbanalytics.service.expertise;

import java.util.List;
import java.util.UUID;

/** One authored document with the labels extracted from it. */
public record AuthorshipRecord(
    UUID userId,
    String username,
    String email,
    UUID documentId,
    List<String> topics,
    List<String> technologies) {}
