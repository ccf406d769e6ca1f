package com.knowledgechat.perimeter.failure;

/**
 * Why a perimeter operation failed.
 */
public enum FailureKind {

  /**
   * A secret is missing or unusable. Should have been stopped at boot.
   */
  CONFIGURATION,

  /**
   * Malformed caller input.
   */
  VALIDATION,

  /**
   * The state token could not be decoded or is structurally incomplete.
   */
  INVALID_STATE,

  /**
   * The state token signature does not match its payload.
   */
  SIGNATURE_MISMATCH,

  /**
   * The state token is older than its validity window.
   */
  EXPIRED,

  /**
   * An encrypted value does not have the iv:tag:ciphertext shape.
   */
  FORMAT,

  /**
   * Authenticated decryption failed: tampered data or the wrong key.
   */
  AUTHENTICATION;

  /**
   * Integrity failures are possible attack signals and get logged louder.
   *
   * @return the boolean
   */
  public boolean isIntegrityFailure() {
    return this == SIGNATURE_MISMATCH || this == AUTHENTICATION;
  }
}
