/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.json;

import io.refkey.RefkeyException;

/**
 * Malformed or unexpected JSON.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends RefkeyException {

  public JsonParsingException(String message) {
    super(message);
  }

  public JsonParsingException(Throwable cause) {
    super(cause);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
