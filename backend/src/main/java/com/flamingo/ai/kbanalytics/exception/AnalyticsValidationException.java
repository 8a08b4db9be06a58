package com.flamingo.ai.kbanalytics.exception;

/** Exception thrown when an analytics request carries out-of-range or insufficient input. */
public class AnalyticsValidationException extends RuntimeException {

  public AnalyticsValidationException(String message) {
    super(message);
  }

  public String getUserMessage() {
    return getMessage();
  }
}
