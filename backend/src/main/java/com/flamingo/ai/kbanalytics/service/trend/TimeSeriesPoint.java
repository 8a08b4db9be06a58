package com.flamingo.ai.kbanalytics.service.trend;

import java.time.LocalDateTime;

/** Count for the bucket starting at {@code timestamp}. */
public record TimeSeriesPoint(LocalDateTime timestamp, long value) {}
