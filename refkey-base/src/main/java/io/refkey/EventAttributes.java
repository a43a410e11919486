/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;


import static io.refkey.RefkeyConstants.DATE_FORMAT;
import static io.refkey.RefkeyConstants.TIME_FORMAT;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * The attributes a token binds: two participant names, a date and a
 * time of day. Names are kept in their display form (stripped, otherwise as
 * entered); the time is truncated to the minute.
 * <p>
 * Two instances with different surface text may still be
 * {@linkplain #isEquivalent(EventAttributes) equivalent}, in which case they
 * derive the same token.
 * </p>
 * 
 * @param participantA    first participant (home team), not blank
 * @param participantB    second participant, not blank
 * @param date            event date
 * @param time            event time of day
 */
public record EventAttributes(
    String participantA, String participantB, LocalDate date, LocalTime time) {
  
  
  /**
   * Creates an instance from text fields.
   * 
   * @param date  {@code YYYY-MM-DD}
   * @param time  {@code HH:MM}
   * 
   * @throws InputValidationException
   *         if a name is blank, or the date or time does not parse
   */
  public static EventAttributes parse(
      String participantA, String participantB, String date, String time)
          throws InputValidationException {
    return new EventAttributes(
        participantA, participantB, parseDate(date), parseTime(time));
  }
  
  
  /**
   * Parses a {@code YYYY-MM-DD} date.
   * 
   * @throws InputValidationException if missing or malformed
   */
  public static LocalDate parseDate(String date) throws InputValidationException {
    if (date == null || date.isBlank())
      throw new InputValidationException("missing event date");
    try {
      return LocalDate.parse(date.strip(), DATE_FORMAT);
    } catch (DateTimeParseException dtpx) {
      throw new InputValidationException(
          "date must be YYYY-MM-DD: \"" + date + "\"", dtpx);
    }
  }
  
  
  /**
   * Parses an {@code HH:MM} (24-hour) time.
   * 
   * @throws InputValidationException if missing or malformed
   */
  public static LocalTime parseTime(String time) throws InputValidationException {
    if (time == null || time.isBlank())
      throw new InputValidationException("missing event time");
    try {
      return LocalTime.parse(time.strip(), TIME_FORMAT);
    } catch (DateTimeParseException dtpx) {
      throw new InputValidationException(
          "time must be HH:MM (24-hour): \"" + time + "\"", dtpx);
    }
  }
  
  
  /**
   * @throws InputValidationException
   *         if a name is {@code null} or blank, or date or time is {@code null}
   */
  public EventAttributes {
    participantA = requireName(participantA, "participant_a");
    participantB = requireName(participantB, "participant_b");
    if (date == null)
      throw new InputValidationException("missing event date");
    if (time == null)
      throw new InputValidationException("missing event time");
    time = time.truncatedTo(ChronoUnit.MINUTES);
  }
  
  
  private static String requireName(String name, String field) {
    if (name == null || name.isBlank())
      throw new InputValidationException("missing " + field);
    return name.strip();
  }
  
  
  /** Returns the canonical form of {@linkplain #participantA()}. */
  public String canonicalA() {
    return Canonicalizer.canonicalize(participantA);
  }
  
  /** Returns the canonical form of {@linkplain #participantB()}. */
  public String canonicalB() {
    return Canonicalizer.canonicalize(participantB);
  }
  
  /** Returns the date as {@code YYYY-MM-DD}. */
  public String dateString() {
    return DATE_FORMAT.format(date);
  }
  
  /** Returns the time as {@code HH:MM}. */
  public String timeString() {
    return TIME_FORMAT.format(time);
  }
  
  
  /**
   * Tells whether the given instance derives the same token as this one:
   * same canonical names (in the same positions), same date and time.
   */
  public boolean isEquivalent(EventAttributes other) {
    return
        date.equals(other.date) &&
        time.equals(other.time) &&
        canonicalA().equals(other.canonicalA()) &&
        canonicalB().equals(other.canonicalB());
  }
  
  
  /**
   * Returns a filename-friendly label for the event. For example,
   * {@code les aigles rouges_vs_les lions bleus_2025-06-20_18h30}.
   */
  public String matchLabel() {
    return canonicalA() + "_vs_" + canonicalB() + "_" + dateString() + "_" +
        timeString().replace(':', 'h');
  }
  
  
  /**
   * Returns the suggested filename for the scannable image of this event's
   * message payload.
   */
  public String suggestedImageFilename() {
    return "QR_Arbitre_" + matchLabel() + ".png";
  }

}
