package com.flamingo.ai.kbanalytics.exception;

/** Exception thrown when a numeric operation receives no input, such as the centroid of nothing. */
public class EmptyInputException extends RuntimeException {

  public EmptyInputException(String message) {
    super(message);
  }
}
