package com.flamingo.ai.kbanalytics.service.trend;

import com.fasterxml.jackson.annotation.JsonValue;

/** Bucket width implied by the length of the analysis window. */
public enum TrendGranularity {
  DAY(1),
  WEEK(7),
  MONTH(30);

  private final int days;

  TrendGranularity(int days) {
    this.days = days;
  }

  public int getDays() {
    return days;
  }

  /** Up to 14 days: daily buckets. Up to 90 days: weekly. Longer: 30-day buckets. */
  public static TrendGranularity forWindow(int windowDays) {
    if (windowDays <= 14) {
      return DAY;
    }
    if (windowDays <= 90) {
      return WEEK;
    }
    return MONTH;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
