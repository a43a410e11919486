/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.hash;


import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Specifies a hashing method. Token derivation only ever sees this interface,
 * so the algorithm can be swapped in one place.
 * 
 * @see Digests
 */
public interface Digest {
  
  
  /**
   * Returns the number of bytes used to form a hash.
   * 
   * @see MessageDigest#getDigestLength()
   */
  int hashWidth();
  
  
  /**
   * Returns the name of the hashing algorithm.
   * 
   * @see MessageDigest#getAlgorithm()
   */
  String hashAlgo();
  
  
  /**
   * Returns the number of hex digits in a full hash. (Twice the hash width.)
   */
  default int hexWidth() {
    return 2 * hashWidth();
  }
  
  
  /**
   * Creates and returns a new <code>MessageDigest</code>. The
   * returned instance has this digest's width and algorithm.
   */
  default MessageDigest newDigest() {
    String algo = hashAlgo();
    try {
      
      MessageDigest digest = MessageDigest.getInstance(algo);
      assert digest.getDigestLength() == hashWidth();
      
      return digest;
      
    } catch (NoSuchAlgorithmException nsax) {
      throw new RuntimeException("on creating digest with algo " + algo, nsax);
    }
  }
  
  
  /**
   * Hashes the UTF-8 encoding of the given text and returns the result
   * as lowercase hex digits ({@linkplain #hexWidth()} of them).
   */
  default String hexDigest(String text) {
    byte[] hash = newDigest().digest(text.getBytes(StandardCharsets.UTF_8));
    return HexFormat.of().formatHex(hash);
  }

}
