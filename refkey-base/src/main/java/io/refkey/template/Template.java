/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.template;


import java.util.Map;
import java.util.Objects;

/**
 * A user-editable message template. Persisting it is up to the caller;
 * {@linkplain #defaultTemplate()} is what a reset restores.
 * 
 * @param text  the template text (may be empty)
 */
public record Template(String text) {
  
  /** Built-in template text. */
  public final static String DEFAULT_TEXT =
      """
      Hello,
      
      I am the referee for the following match:
      
      - Team 1 : {participant_a}
      - Team 2 : {participant_b}
      - Date : {event_date}
      - Time : {event_time}
      
      Security key : {token}
      
      IBAN : _______________________
      
      (or attach a PDF containing your IBAN)
      
      Thank you.""";
  
  private final static Template DEFAULT = new Template(DEFAULT_TEXT);
  
  
  /** Upper bound (inclusive) of a {@linkplain Size#SHORT SHORT} template. */
  public final static int SHORT_MAX = 500;
  
  /** Upper bound (inclusive) of a {@linkplain Size#MEDIUM MEDIUM} template. */
  public final static int MEDIUM_MAX = 1000;
  
  /**
   * Size class of a template, by character count.
   */
  public enum Size {
    SHORT,
    MEDIUM,
    LONG;
  }
  
  
  /** Returns the built-in template. */
  public static Template defaultTemplate() {
    return DEFAULT;
  }
  
  
  public Template {
    Objects.requireNonNull(text, "null text");
  }
  
  
  /** Tells whether this is the built-in template. */
  public boolean isDefault() {
    return DEFAULT_TEXT.equals(text);
  }
  
  
  /** Returns the number of characters in the template. */
  public int charCount() {
    return text.length();
  }
  
  
  public Size size() {
    int count = charCount();
    if (count > MEDIUM_MAX)
      return Size.LONG;
    return count > SHORT_MAX ? Size.MEDIUM : Size.SHORT;
  }
  
  
  /**
   * Renders this template.
   * 
   * @see TemplateRenderer#render(String, Map)
   */
  public String render(Map<String, String> variables) throws TemplateSyntaxException {
    return TemplateRenderer.INSTANCE.render(text, variables);
  }
  
  
  /** Renders this template with the {@linkplain Placeholder#SAMPLE_VARIABLES sample bindings}. */
  public String preview() throws TemplateSyntaxException {
    return render(Placeholder.SAMPLE_VARIABLES);
  }

}
