/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.hash;

/**
 * The hashing algorithms we use are gathered here. The point is you
 * should be able to swap one out for another.
 */
public class Digests {
  
  
  /**
   * SHA-256 spec. Hash width: 32 bytes.
   */
  public final static Digest SHA_256 = new Digest() {

    @Override
    public int hashWidth() {
      return 32;
    }

    @Override
    public String hashAlgo() {
      return "SHA-256";
    }
    
  };
  
  
  
  // no instances
  private Digests() {  }

}
