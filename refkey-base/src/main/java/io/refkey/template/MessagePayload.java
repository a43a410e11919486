/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.template;


import java.util.Objects;

/**
 * A subject and body pair, handed to whatever delivers the message.
 * 
 * @param subject     not {@code null}
 * @param body        the rendered template
 * 
 * @see MailtoLink
 */
public record MessagePayload(String subject, String body) {
  
  /** Default subject line. */
  public final static String DEFAULT_SUBJECT = "Versement IBAN";
  
  public MessagePayload {
    Objects.requireNonNull(subject, "null subject");
    Objects.requireNonNull(body, "null body");
  }

}
