/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;

/**
 * A request was rejected because a required attribute is missing or
 * malformed. Nothing was derived, rendered or recorded.
 */
@SuppressWarnings("serial")
public class InputValidationException extends RefkeyException {

  public InputValidationException(String message) {
    super(message);
  }

  public InputValidationException(String message, Throwable cause) {
    super(message, cause);
  }

}
