/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey;


import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Collapses free-text names into a comparison-stable form. Names that differ
 * only in case, accents, punctuation or spacing canonicalize to the same
 * string, so a re-typed name yields the same token.
 * 
 * <h2>Steps</h2>
 * <ol>
 * <li>Strip leading and trailing whitespace; lowercase.</li>
 * <li>Decompose (NFD) and drop combining marks: {@code é} becomes {@code e}.</li>
 * <li>Drop every character that is not {@code a-z}, {@code 0-9} or whitespace.</li>
 * <li>Collapse whitespace runs to a single space; strip again.</li>
 * </ol>
 * <p>
 * The function is total and idempotent. Canonical forms are hash input only:
 * they are never displayed.
 * </p>
 */
public class Canonicalizer {
  
  private Canonicalizer() {  }  // never
  
  
  private final static Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");
  
  private final static Pattern NOT_ALNUM_OR_SPACE =
      Pattern.compile("[^a-z0-9\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  
  private final static Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  
  
  /**
   * Returns the canonical form of the given text.
   * 
   * @param text        may be {@code null} (treated as empty)
   * 
   * @return not {@code null}; empty if nothing survives
   */
  public static String canonicalize(String text) {
    if (text == null || text.isEmpty())
      return "";
    
    String s = text.strip().toLowerCase(Locale.ROOT);
    s = Normalizer.normalize(s, Normalizer.Form.NFD);
    s = COMBINING_MARKS.matcher(s).replaceAll("");
    s = NOT_ALNUM_OR_SPACE.matcher(s).replaceAll("");
    s = WHITESPACE.matcher(s).replaceAll(" ");
    return s.strip();
  }
  
  
  /**
   * Tells whether the two names canonicalize identically.
   */
  public static boolean equivalent(String a, String b) {
    return canonicalize(a).equals(canonicalize(b));
  }

}
