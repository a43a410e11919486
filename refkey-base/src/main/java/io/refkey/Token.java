/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;


import static io.refkey.RefkeyConstants.MASK_CHAR;
import static io.refkey.RefkeyConstants.MAX_TOKEN_LENGTH;
import static io.refkey.RefkeyConstants.VISIBLE_TOKEN_DIGITS;

/**
 * A short, uppercase, hexadecimal token. Tokens are meant to be read out,
 * typed in, or scanned, so their text is the whole contract.
 * 
 * @param value uppercase hex digits
 * 
 * @see TokenDeriver
 */
public record Token(String value) {
  
  
  /**
   * @throws InputValidationException
   *         if empty, too long, or contains anything but {@code 0-9A-F}
   */
  public Token {
    if (value == null || value.isEmpty())
      throw new InputValidationException("empty token");
    if (value.length() > MAX_TOKEN_LENGTH)
      throw new InputValidationException(
          "token too long (%d chars): %s".formatted(value.length(), value));
    for (int index = value.length(); index-- > 0; ) {
      char c = value.charAt(index);
      if (!(c >= '0' && c <= '9' || c >= 'A' && c <= 'F'))
        throw new InputValidationException(
            "illegal token character '" + c + "' at index " + index + ": " + value);
    }
  }
  
  
  /** Returns the number of characters in the token. */
  public int length() {
    return value.length();
  }
  
  
  /**
   * Returns a redacted version of the token that shows only its last
   * {@value RefkeyConstants#VISIBLE_TOKEN_DIGITS} characters. For a 10-digit
   * token, {@code ******1A2B}. Tokens no longer than that are masked entirely.
   */
  public String masked() {
    int len = value.length();
    int hidden = len > VISIBLE_TOKEN_DIGITS ? len - VISIBLE_TOKEN_DIGITS : len;
    return String.valueOf(MASK_CHAR).repeat(hidden) + value.substring(hidden);
  }
  
  
  /** Returns the {@linkplain #value()}. */
  @Override
  public String toString() {
    return value;
  }

}
