/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.template;

import io.refkey.RefkeyException;

/**
 * A template could not be parsed: an unclosed <code>{</code> or a lone
 * <code>}</code>. Rendering was aborted; no output was produced.
 */
@SuppressWarnings("serial")
public class TemplateSyntaxException extends RefkeyException {
  
  private final int offset;

  /**
   * @param message     detail message
   * @param offset      zero-based character offset of the offending brace
   */
  public TemplateSyntaxException(String message, int offset) {
    super(message + " (at offset " + offset + ")");
    this.offset = offset;
  }
  
  
  /** Returns the zero-based character offset where parsing failed. */
  public int getOffset() {
    return offset;
  }

}
