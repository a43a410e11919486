/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.template;


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.refkey.EventAttributes;
import io.refkey.Token;

/**
 * The five variables a message template may reference. Written in a template
 * as the name in braces, e.g. <code>{token}</code>.
 */
public enum Placeholder {
  
  PARTICIPANT_A("participant_a"),
  PARTICIPANT_B("participant_b"),
  EVENT_DATE("event_date"),
  EVENT_TIME("event_time"),
  TOKEN("token");
  
  
  private final String varName;
  
  private Placeholder(String varName) {
    this.varName = varName;
  }
  
  
  /** Returns the variable name, as written between braces. */
  public String varName() {
    return varName;
  }
  
  
  /** Returns the placeholder as it appears in a template. */
  public String placeholder() {
    return "{" + varName + "}";
  }
  
  
  /** Looks up the placeholder with the given variable name. */
  public static Optional<Placeholder> forName(String varName) {
    for (var p : values())
      if (p.varName.equals(varName))
        return Optional.of(p);
    return Optional.empty();
  }
  
  
  /**
   * Returns the variable bindings for the given event and token. Values are
   * display forms (not canonical): names as entered, {@code YYYY-MM-DD},
   * {@code HH:MM}, and the token.
   * 
   * @return read-only, ordered as the enum
   */
  public static Map<String, String> variables(EventAttributes attributes, Token token) {
    return variables(
        attributes.participantA(),
        attributes.participantB(),
        attributes.dateString(),
        attributes.timeString(),
        token.value());
  }
  
  
  /**
   * Returns the variable bindings for the given display values.
   * 
   * @return read-only, ordered as the enum
   */
  public static Map<String, String> variables(
      String participantA, String participantB, String date, String time, String token) {
    var map = new LinkedHashMap<String, String>();
    map.put(PARTICIPANT_A.varName, participantA);
    map.put(PARTICIPANT_B.varName, participantB);
    map.put(EVENT_DATE.varName, date);
    map.put(EVENT_TIME.varName, time);
    map.put(TOKEN.varName, token);
    return Collections.unmodifiableMap(map);
  }
  
  
  /**
   * Sample bindings used to preview a template.
   */
  public final static Map<String, String> SAMPLE_VARIABLES =
      variables("Les Aigles Rouges", "Les Lions Bleus", "2025-06-20", "18:30", "ABC123DEF0");

}
