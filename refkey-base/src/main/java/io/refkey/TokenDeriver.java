/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;


import static io.refkey.RefkeyConstants.FIELD_DELIMITER;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

import io.refkey.hash.Digest;

/**
 * Derives a token from {@linkplain EventAttributes event attributes} and a
 * secret. The hashed string is
 * <pre>
 *    canonical_a;canonical_b;YYYY-MM-DD;HH:MM;SECRET
 * </pre>
 * encoded in UTF-8. The token is the first {@linkplain #tokenLength()} hex
 * digits of its SHA-256 hash, uppercased.
 * <p>
 * Field order and delimiter are part of the contract: changing either (or the
 * secret) changes every token ever issued. Swapping the two participants
 * yields a different token, unless their canonical forms are the same.
 * </p>
 * <p>
 * Instances are immutable and safe to share.
 * </p>
 */
public class TokenDeriver {
  
  /**
   * Returns an instance using the built-in secret and the standard
   * {@value RefkeyConstants#TOKEN_LENGTH}-digit token length.
   */
  public static TokenDeriver defaultInstance() {
    return DEFAULT;
  }
  
  private final static TokenDeriver DEFAULT =
      new TokenDeriver(RefkeyConstants.DEFAULT_SECRET);
  
  
  
  private final String secret;
  private final int tokenLength;
  private final Digest digest;
  
  
  /**
   * Creates an instance with the standard token length.
   * 
   * @param secret      not empty
   */
  public TokenDeriver(String secret) {
    this(secret, RefkeyConstants.TOKEN_LENGTH);
  }
  
  
  /**
   * Creates an SHA-256 instance.
   * 
   * @param secret      not empty
   * @param tokenLength between {@value RefkeyConstants#MIN_TOKEN_LENGTH} and
   *                    {@linkplain RefkeyConstants#MAX_TOKEN_LENGTH} (inclusive)
   */
  public TokenDeriver(String secret, int tokenLength) {
    this(secret, tokenLength, RefkeyConstants.DIGEST);
  }
  
  
  /**
   * Full constructor.
   * 
   * @param secret      not empty
   * @param tokenLength between {@value RefkeyConstants#MIN_TOKEN_LENGTH} and
   *                    the digest's hex width (inclusive)
   * @param digest      hashing algorithm
   */
  public TokenDeriver(String secret, int tokenLength, Digest digest) {
    this.secret = Objects.requireNonNull(secret, "null secret");
    this.digest = Objects.requireNonNull(digest, "null digest");
    this.tokenLength = tokenLength;
    
    if (secret.isEmpty())
      throw new IllegalArgumentException("empty secret");
    if (tokenLength < RefkeyConstants.MIN_TOKEN_LENGTH || tokenLength > digest.hexWidth())
      throw new IllegalArgumentException(
          "token length %d out of bounds [%d, %d]".formatted(
              tokenLength, RefkeyConstants.MIN_TOKEN_LENGTH, digest.hexWidth()));
  }
  
  
  /** Returns the number of hex digits in derived tokens. */
  public int tokenLength() {
    return tokenLength;
  }
  
  
  /**
   * Derives the token for the given attributes.
   */
  public Token derive(EventAttributes attributes) {
    String hex = digest.hexDigest(hashInput(attributes));
    return new Token(hex.substring(0, tokenLength).toUpperCase());
  }
  
  
  /**
   * Derives the token for the given fields.
   * 
   * @throws InputValidationException if a name is blank, or date or time is missing
   * @see #derive(EventAttributes)
   */
  public Token derive(
      String participantA, String participantB, LocalDate date, LocalTime time)
          throws InputValidationException {
    return derive(new EventAttributes(participantA, participantB, date, time));
  }
  
  
  /**
   * Tells whether the given token is the one derived from the given attributes.
   */
  public boolean reproduces(EventAttributes attributes, Token token) {
    return derive(attributes).equals(token);
  }
  
  
  /** Contains the secret: never log or return this. */
  String hashInput(EventAttributes attributes) {
    return new StringBuilder(96)
        .append(attributes.canonicalA()).append(FIELD_DELIMITER)
        .append(attributes.canonicalB()).append(FIELD_DELIMITER)
        .append(attributes.dateString()).append(FIELD_DELIMITER)
        .append(attributes.timeString()).append(FIELD_DELIMITER)
        .append(secret)
        .toString();
  }

}
