/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.template;


import java.util.Map;
import java.util.Objects;

import io.refkey.EventAttributes;
import io.refkey.Token;

/**
 * Substitutes the five {@linkplain Placeholder placeholders} in a
 * user-supplied template. This is a plain scanner: nothing in the template
 * is ever evaluated.
 * 
 * <h2>Syntax</h2>
 * <ul>
 * <li><code>{name}</code> where <em>name</em> is one of the five variable names
 * is replaced with its value.</li>
 * <li>Any other braced text, e.g. <code>{iban}</code>, is copied as is.</li>
 * <li><code>{{</code> and <code>}}</code> stand for literal braces.</li>
 * <li>A <code>{</code> with no closing brace (or another <code>{</code> before it),
 * and a lone <code>}</code>, are syntax errors.</li>
 * </ul>
 */
public class TemplateRenderer {
  
  /** Instances are stateless. */
  public final static TemplateRenderer INSTANCE = new TemplateRenderer();
  
  
  
  /**
   * Renders the template with the given bindings.
   * 
   * @param template    the template text
   * @param variables   bindings for exactly the five variable names
   * 
   * @return the rendered text
   * 
   * @throws TemplateSyntaxException if the template does not parse
   * @throws IllegalArgumentException
   *         if {@code variables} is not a binding of exactly the five names
   */
  public String render(String template, Map<String, String> variables)
      throws TemplateSyntaxException {
    Objects.requireNonNull(template, "null template");
    checkVariables(variables);
    
    final int len = template.length();
    StringBuilder out = new StringBuilder(len + 64);
    
    for (int index = 0; index < len; ) {
      char c = template.charAt(index);
      
      if (c == '{') {
        if (index + 1 < len && template.charAt(index + 1) == '{') {
          out.append('{');
          index += 2;
          continue;
        }
        int close = closingBrace(template, index);
        String name = template.substring(index + 1, close);
        if (Placeholder.forName(name).isPresent())
          out.append(variables.get(name));
        else
          out.append(template, index, close + 1);
        index = close + 1;
        
      } else if (c == '}') {
        if (index + 1 < len && template.charAt(index + 1) == '}') {
          out.append('}');
          index += 2;
          continue;
        }
        throw new TemplateSyntaxException("single '}' encountered in template", index);
      
      } else {
        out.append(c);
        ++index;
      }
    }
    
    return out.toString();
  }
  
  
  /**
   * Renders the template for the given event and token.
   * 
   * @see Placeholder#variables(EventAttributes, Token)
   */
  public String render(String template, EventAttributes attributes, Token token)
      throws TemplateSyntaxException {
    return render(template, Placeholder.variables(attributes, token));
  }
  
  
  /**
   * Checks the template parses, without rendering it.
   * 
   * @throws TemplateSyntaxException if it doesn't
   */
  public void validate(String template) throws TemplateSyntaxException {
    render(template, Placeholder.SAMPLE_VARIABLES);
  }
  
  
  
  private int closingBrace(String template, int open) {
    for (int index = open + 1; index < template.length(); ++index) {
      char c = template.charAt(index);
      if (c == '}')
        return index;
      if (c == '{')
        throw new TemplateSyntaxException("'{' inside placeholder", index);
    }
    throw new TemplateSyntaxException("unclosed '{' in template", open);
  }
  
  
  private void checkVariables(Map<String, String> variables) {
    Objects.requireNonNull(variables, "null variables");
    if (variables.size() != Placeholder.values().length)
      throw new IllegalArgumentException(
          "expected bindings for exactly %d variables: %s"
          .formatted(Placeholder.values().length, variables.keySet()));
    for (var p : Placeholder.values()) {
      if (variables.get(p.varName()) == null)
        throw new IllegalArgumentException("missing binding for " + p.placeholder());
    }
  }

}
