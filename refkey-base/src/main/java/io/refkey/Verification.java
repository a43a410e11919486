/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;


import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Outcome of a {@linkplain Verifier#verify(EventAttributes, String) verification}.
 * 
 * @param attributes      the event the token was checked against
 * @param candidate       the claimed token (trimmed, uppercased)
 * @param valid           {@code true} iff the candidate is the derived token
 * @param expectedMasked  the derived token with all but its last 4 digits masked
 */
public record Verification(
    EventAttributes attributes, String candidate, boolean valid, String expectedMasked) {
  
  private final static DateTimeFormatter STAMP =
      DateTimeFormatter.ofPattern("dd/MM/uuuu 'at' HH:mm:ss", Locale.ROOT);
  
  private final static String RULE = "=".repeat(50);
  
  
  /**
   * Returns a human readable, multi-line report.
   * 
   * @param verifiedAt  time stamp printed at the bottom
   */
  public String report(LocalDateTime verifiedAt) {
    var s = new StringBuilder(512);
    s.append("VERIFICATION DETAILS").append('\n')
     .append(RULE).append('\n').append('\n')
     .append("RESULT: ").append(valid ? "VALID" : "INVALID").append('\n').append('\n')
     .append("TOKENS:").append('\n')
     .append("   - provided : ").append(candidate).append('\n')
     .append("   - expected : ").append(expectedMasked).append('\n').append('\n')
     .append("MATCH:").append('\n')
     .append("   - participant A : ").append(attributes.participantA()).append('\n')
     .append("   - participant B : ").append(attributes.participantB()).append('\n')
     .append("   - date          : ").append(attributes.dateString()).append('\n')
     .append("   - time          : ").append(attributes.timeString()).append('\n')
     .append('\n')
     .append("Verified on ").append(STAMP.format(verifiedAt)).append('\n');
    if (!valid) {
      s.append('\n')
       .append("The token does not match this event. Possible causes: a typing")
       .append(" mistake, incorrect match details, or an attempted fraud.").append('\n');
    }
    return s.toString();
  }

}
