/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;

import io.refkey.RefkeyException;

/**
 * Failure writing the history's backing store. When thrown from a mutation,
 * the previously persisted state is unchanged.
 */
@SuppressWarnings("serial")
public class StorageException extends RefkeyException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }

}
