package com.flamingo.ai.kbanalytics.service.similarity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Duplicate pairs, most similar first, with summary statistics.
 *
 * @param documentsAnalyzed embedded documents compared
 * @param averageSimilarity mean similarity over the returned pairs, 0 when there are none
 */
public record DuplicateReport(
    List<DocumentDuplicate> duplicates,
    int totalDuplicates,
    int documentsAnalyzed,
    double averageSimilarity,
    double threshold,
    LocalDateTime generatedAt) {}
