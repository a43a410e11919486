/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;


import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Locale;

import io.refkey.hash.Digest;
import io.refkey.hash.Digests;

/**
 * Library constants.
 */
public class RefkeyConstants {
  
  // no-one calls
  private RefkeyConstants() {  }
  
  
  /** Logger name. */
  public final static String LOG_NAME = "io.refkey";
  
  /**
   * Digest used by the library is statically defined here. Currently SHA-256.
   * 
   * @see Digests#SHA_256
   */
  public final static Digest DIGEST = Digests.SHA_256;
  
  /**
   * The built-in secret mixed into every token. Changing it changes every
   * token ever issued.
   */
  public final static String DEFAULT_SECRET = "HANDBALL_ARBITRE_2025_SECRET_SALT";
  
  /** Number of hex digits in a token (the transcribed, wire-level length). */
  public final static int TOKEN_LENGTH = 10;
  
  /** Minimum configurable token length. */
  public final static int MIN_TOKEN_LENGTH = 8;
  
  /** Maximum configurable token length: the full SHA-256 hex width. */
  public final static int MAX_TOKEN_LENGTH = DIGEST.hexWidth();
  
  /** Trailing token digits shown in diagnostics. */
  public final static int VISIBLE_TOKEN_DIGITS = 4;
  
  /** Character standing in for a redacted token digit. */
  public final static char MASK_CHAR = '*';
  
  /** Field delimiter in the hashed string. */
  public final static char FIELD_DELIMITER = ';';
  
  /** {@code YYYY-MM-DD}, locale independent. */
  public final static DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT);
  
  /** {@code HH:MM}, 24-hour, zero-padded, locale independent. */
  public final static DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("HH:mm", Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT);

}
