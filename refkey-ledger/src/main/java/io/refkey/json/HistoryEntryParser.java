/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.json;


import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import org.json.simple.JSONObject;

import io.refkey.EventAttributes;
import io.refkey.RefkeyException;
import io.refkey.Token;
import io.refkey.history.HistoryEntry;

/**
 * JSON mapping of {@linkplain HistoryEntry}. Example:
 * <pre>
 * {
 *   "issued_at": "2025-06-20T17:02:11.482913",
 *   "participant_a": "Les Aigles Rouges",
 *   "participant_b": "Les Lions Bleus",
 *   "date": "2025-06-20",
 *   "time": "18:30",
 *   "token": "5F6898FCDC"
 * }
 * </pre>
 * <p>
 * Histories written by the earlier desktop tool used different names
 * ({@code timestamp}, {@code equipe1}, {@code equipe2}, {@code heure},
 * {@code security_key}); these are accepted on read but never written.
 * </p>
 */
public class HistoryEntryParser implements JsonEntityParser<HistoryEntry> {
  
  /** Stateless instance. */
  public final static HistoryEntryParser INSTANCE = new HistoryEntryParser();
  
  
  public final static String ISSUED_AT = "issued_at";
  public final static String PARTICIPANT_A = "participant_a";
  public final static String PARTICIPANT_B = "participant_b";
  public final static String DATE = "date";
  public final static String TIME = "time";
  public final static String TOKEN = "token";
  
  final static String LEGACY_ISSUED_AT = "timestamp";
  final static String LEGACY_PARTICIPANT_A = "equipe1";
  final static String LEGACY_PARTICIPANT_B = "equipe2";
  final static String LEGACY_TIME = "heure";
  final static String LEGACY_TOKEN = "security_key";
  
  
  

  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(HistoryEntry entry, JSONObject jObj) {
    jObj.put(ISSUED_AT, DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(entry.issuedAt()));
    jObj.put(PARTICIPANT_A, entry.participantA());
    jObj.put(PARTICIPANT_B, entry.participantB());
    var attributes = entry.attributes();
    jObj.put(DATE, attributes.dateString());
    jObj.put(TIME, attributes.timeString());
    jObj.put(TOKEN, entry.token().value());
    return jObj;
  }
  

  @Override
  public HistoryEntry toEntity(JSONObject jObj) throws JsonParsingException {
    String issuedAt = JsonUtils.getString(jObj, true, ISSUED_AT, LEGACY_ISSUED_AT);
    String a = JsonUtils.getString(jObj, true, PARTICIPANT_A, LEGACY_PARTICIPANT_A);
    String b = JsonUtils.getString(jObj, true, PARTICIPANT_B, LEGACY_PARTICIPANT_B);
    String date = JsonUtils.getString(jObj, DATE, true);
    String time = JsonUtils.getString(jObj, true, TIME, LEGACY_TIME);
    String token = JsonUtils.getString(jObj, true, TOKEN, LEGACY_TOKEN);
    
    try {
      return HistoryEntry.of(
          parseTimestamp(issuedAt),
          EventAttributes.parse(a, b, date, time),
          new Token(token));
    
    } catch (RefkeyException rx) {
      throw new JsonParsingException("illegal history entry " + jObj + ": " + rx.getMessage(), rx);
    }
  }
  
  
  private LocalDateTime parseTimestamp(String issuedAt) throws JsonParsingException {
    try {
      return LocalDateTime.parse(issuedAt, DateTimeFormatter.ISO_DATE_TIME);
    } catch (DateTimeParseException dtpx) {
      throw new JsonParsingException(
          "'" + ISSUED_AT + "' is not an ISO-8601 timestamp: " + issuedAt, dtpx);
    }
  }

}
