/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;

/**
 * Base exception in the <code>refkey</code> modules. None of its subclasses
 * are fatal: they either reject a request or report a failed write.
 */
@SuppressWarnings("serial")
public class RefkeyException extends RuntimeException {

  public RefkeyException(String message) {
    super(message);
  }

  public RefkeyException(Throwable cause) {
    super(cause);
  }

  public RefkeyException(String message, Throwable cause) {
    super(message, cause);
  }

}
