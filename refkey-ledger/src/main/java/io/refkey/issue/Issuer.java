/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.issue;


import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

import io.refkey.EventAttributes;
import io.refkey.RefkeyConstants;
import io.refkey.Token;
import io.refkey.TokenDeriver;
import io.refkey.history.HistoryEntry;
import io.refkey.history.HistoryLedger;
import io.refkey.history.StorageException;
import io.refkey.template.MailtoLink;
import io.refkey.template.MessagePayload;
import io.refkey.template.Template;
import io.refkey.template.TemplateRenderer;
import io.refkey.template.TemplateSyntaxException;

/**
 * Issues tokens: derives the token, renders the message, and records the
 * event in the history, in that order. If rendering fails nothing is
 * recorded.
 */
public class Issuer {
  
  private final TokenDeriver deriver;
  private final HistoryLedger ledger;
  private final Clock clock;
  private final String recipient;
  private final String subject;
  
  
  /**
   * Creates an instance using the system clock and the default mail recipient
   * and subject.
   */
  public Issuer(TokenDeriver deriver, HistoryLedger ledger) {
    this(deriver, ledger, Clock.systemDefaultZone(),
        MailtoLink.DEFAULT_RECIPIENT, MessagePayload.DEFAULT_SUBJECT);
  }
  
  
  /**
   * Full constructor.
   * 
   * @param deriver     token deriver
   * @param ledger      where issuances are recorded
   * @param clock       stamps history entries
   * @param recipient   mail recipient of the message
   * @param subject     mail subject of the message
   */
  public Issuer(
      TokenDeriver deriver, HistoryLedger ledger, Clock clock,
      String recipient, String subject) {
    this.deriver = Objects.requireNonNull(deriver, "null deriver");
    this.ledger = Objects.requireNonNull(ledger, "null ledger");
    this.clock = Objects.requireNonNull(clock, "null clock");
    this.recipient = Objects.requireNonNull(recipient, "null recipient");
    this.subject = Objects.requireNonNull(subject, "null subject");
  }
  
  
  public TokenDeriver getDeriver() {
    return deriver;
  }
  
  
  public HistoryLedger getLedger() {
    return ledger;
  }
  
  
  /**
   * Issues a token for the given event.
   * 
   * @param attributes  the event
   * @param template    message template
   * 
   * @throws TemplateSyntaxException
   *         if the template does not parse (nothing is recorded)
   * @throws StorageException
   *         if the issuance could not be recorded
   */
  public Issuance issue(EventAttributes attributes, Template template)
      throws TemplateSyntaxException, StorageException {
    
    Token token = deriver.derive(attributes);
    
    String body = TemplateRenderer.INSTANCE.render(template.text(), attributes, token);
    var message = new MessagePayload(subject, body);
    String qrPayload = MailtoLink.toLink(recipient, message);
    
    var entry = HistoryEntry.of(LocalDateTime.now(clock), attributes, token);
    ledger.append(entry);
    
    System.getLogger(RefkeyConstants.LOG_NAME).log(
        Level.DEBUG, "issued token for " + attributes.matchLabel());
    
    return new Issuance(entry, message, qrPayload, attributes.suggestedImageFilename());
  }

}
