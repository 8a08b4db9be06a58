package com.flamingo.ai.kbanalytics.exception;

/** Exception thrown when vectors of different lengths are combined. */
public class DimensionMismatchException extends RuntimeException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super("Vector dimension mismatch: expected " + expected + " but was " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
