/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;


import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

import io.refkey.EventAttributes;
import io.refkey.InputValidationException;
import io.refkey.Token;

/**
 * Record of one issued token. Entries are immutable; the ledger only ever
 * appends them or clears them all.
 * <p>
 * The entry holds the participants in display form. Its token can always be
 * re-derived from its other fields (given the secret), which is how a ledger
 * is {@linkplain HistoryAudit audited}.
 * </p>
 * 
 * @param issuedAt        when the token was issued (local time)
 * @param participantA    display form, stripped
 * @param participantB    display form, stripped
 * @param date            event date
 * @param time            event time (minute precision)
 * @param token           the issued token
 */
public record HistoryEntry(
    LocalDateTime issuedAt,
    String participantA,
    String participantB,
    LocalDate date,
    LocalTime time,
    Token token) {
  
  
  /**
   * Creates an entry for the given event and token.
   */
  public static HistoryEntry of(LocalDateTime issuedAt, EventAttributes attributes, Token token) {
    return new HistoryEntry(
        issuedAt,
        attributes.participantA(),
        attributes.participantB(),
        attributes.date(),
        attributes.time(),
        token);
  }
  
  
  /**
   * @throws InputValidationException if a name is blank, or a field is missing
   */
  public HistoryEntry {
    if (issuedAt == null)
      throw new InputValidationException("missing issued_at");
    Objects.requireNonNull(token, "null token");
    var attributes = new EventAttributes(participantA, participantB, date, time);
    participantA = attributes.participantA();
    participantB = attributes.participantB();
    time = attributes.time();
  }
  
  
  /** Returns the event attributes this entry's token was derived from. */
  public EventAttributes attributes() {
    return new EventAttributes(participantA, participantB, date, time);
  }
  
  
  /** Tells whether the entry was issued on the given day. */
  public boolean issuedOn(LocalDate day) {
    return issuedAt.toLocalDate().equals(day);
  }

}
