package com.flamingo.ai.kbanalytics.service.similarity;

import com.flamingo.ai.kbanalytics.domain.enums.DuplicateType;

/** Two documents whose embeddings are at least as similar as the requested threshold. */
public record DocumentDuplicate(
    DuplicateDocument document1,
    DuplicateDocument document2,
    double similarity,
    DuplicateType duplicateType) {}
