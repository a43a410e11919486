/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.template;


import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds {@code mailto:} links from a {@linkplain MessagePayload}. The link is
 * the opaque string an external encoder turns into a scannable image.
 * <p>
 * Subject and body are percent-encoded as UTF-8. Letters, digits,
 * {@code -_.~} and {@code /} are left as is; everything else (space
 * included) is escaped, e.g. space as {@code %20} and newline as {@code %0A}.
 * </p>
 */
public class MailtoLink {
  
  private MailtoLink() {  }  // never
  
  /** Default recipient. */
  public final static String DEFAULT_RECIPIENT = "moi@handball.com";
  
  private final static char[] HEX = "0123456789ABCDEF".toCharArray();
  
  
  /**
   * Returns the {@code mailto:} link for the given recipient and payload.
   * 
   * @param recipient   email address (not encoded)
   */
  public static String toLink(String recipient, MessagePayload payload) {
    Objects.requireNonNull(recipient, "null recipient");
    return
        "mailto:" + recipient +
        "?subject=" + percentEncode(payload.subject()) +
        "&body=" + percentEncode(payload.body());
  }
  
  
  /**
   * Percent-encodes the UTF-8 bytes of the given text.
   */
  public static String percentEncode(String text) {
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    var out = new StringBuilder(bytes.length * 3 / 2);
    for (byte b : bytes) {
      int c = b & 0xff;
      if (isUnreserved(c))
        out.append((char) c);
      else
        out.append('%').append(HEX[c >> 4]).append(HEX[c & 0xf]);
    }
    return out.toString();
  }
  
  
  private static boolean isUnreserved(int c) {
    return
        c >= 'a' && c <= 'z' ||
        c >= 'A' && c <= 'Z' ||
        c >= '0' && c <= '9' ||
        c == '-' || c == '_' || c == '.' || c == '~' || c == '/';
  }

}
