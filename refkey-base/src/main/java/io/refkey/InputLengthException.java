/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;

/**
 * A candidate token did not have the expected number of characters
 * (after trimming).
 */
@SuppressWarnings("serial")
public class InputLengthException extends InputValidationException {
  
  private final int expected;
  private final int actual;

  public InputLengthException(int expected, int actual) {
    super("token must be exactly %d characters; given %d".formatted(expected, actual));
    this.expected = expected;
    this.actual = actual;
  }
  
  
  /** Returns the required length. */
  public int getExpected() {
    return expected;
  }
  
  /** Returns the length of the (trimmed) input. */
  public int getActual() {
    return actual;
  }

}
