/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.issue;


import io.refkey.Token;
import io.refkey.history.HistoryEntry;
import io.refkey.template.MessagePayload;

/**
 * The products of issuing a token for an event.
 * 
 * @param entry             the entry recorded in the history
 * @param message           subject and rendered body
 * @param qrPayload         the {@code mailto:} link to encode as a scannable image
 * @param suggestedFilename suggested filename for that image
 */
public record Issuance(
    HistoryEntry entry, MessagePayload message, String qrPayload, String suggestedFilename) {
  
  /** Returns the issued token. Not for display. */
  public Token token() {
    return entry.token();
  }

}
