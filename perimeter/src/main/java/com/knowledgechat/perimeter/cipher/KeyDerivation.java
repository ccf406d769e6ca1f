package com.knowledgechat.perimeter.cipher;

/**
 * Turns the configured encryption secret into AES key bytes.
 */
public interface KeyDerivation {

  /**
   * Derive key bytes. Must be deterministic for a given secret.
   *
   * @param secret the configured secret
   * @return the key bytes
   */
  byte[] deriveKey(String secret);

  /**
   * Length of the derived key in bytes.
   *
   * @return the int
   */
  int keyLength();
}
