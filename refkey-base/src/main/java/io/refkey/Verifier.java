/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;


import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Checks a claimed token against the one derived from the given attributes.
 * Verification is a pure query: nothing is recorded.
 * 
 * @see Verification
 */
public class Verifier {
  
  private final TokenDeriver deriver;
  
  
  /** Creates an instance using the {@linkplain TokenDeriver#defaultInstance() default deriver}. */
  public Verifier() {
    this(TokenDeriver.defaultInstance());
  }

  /**
   * @param deriver     the token deriver (its secret and token length
   *                    must match the issuer's)
   */
  public Verifier(TokenDeriver deriver) {
    this.deriver = Objects.requireNonNull(deriver, "null deriver");
  }
  
  
  /**
   * Verifies the candidate token. The candidate is trimmed and uppercased
   * before comparison.
   * 
   * @param attributes  the event the token is claimed for
   * @param candidate   the claimed token
   * 
   * @return the outcome; its diagnostic never reveals the full expected token
   * 
   * @throws InputLengthException
   *         if the trimmed candidate is not exactly {@linkplain TokenDeriver#tokenLength()}
   *         characters
   */
  public Verification verify(EventAttributes attributes, String candidate)
      throws InputLengthException {
    Objects.requireNonNull(attributes, "null attributes");
    
    String claimed = candidate == null ? "" : candidate.strip().toUpperCase();
    if (claimed.length() != deriver.tokenLength())
      throw new InputLengthException(deriver.tokenLength(), claimed.length());
    
    Token expected = deriver.derive(attributes);
    boolean valid = MessageDigest.isEqual(
        expected.value().getBytes(StandardCharsets.UTF_8),
        claimed.getBytes(StandardCharsets.UTF_8));
    
    return new Verification(attributes, claimed, valid, expected.masked());
  }
  
  
  /**
   * Verifies the candidate token for the given fields.
   * 
   * @throws InputValidationException
   *         if a name is blank, date or time missing, or the candidate is
   *         the wrong length ({@linkplain InputLengthException})
   *         
   * @see #verify(EventAttributes, String)
   */
  public Verification verify(
      String participantA, String participantB, LocalDate date, LocalTime time,
      String candidate) throws InputValidationException {
    return verify(new EventAttributes(participantA, participantB, date, time), candidate);
  }

}
