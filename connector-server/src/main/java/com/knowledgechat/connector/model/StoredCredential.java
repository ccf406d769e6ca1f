package com.knowledgechat.connector.model;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * A row of OAUTH_CREDENTIAL. Both tokens are in the cipher's encoded form; nothing here is plaintext.
 */
@Value.Immutable
public interface StoredCredential {

  /**
   * Subject id.
   *
   * @return the string
   */
  String subjectId();

  /**
   * Source type wire name.
   *
   * @return the string
   */
  String sourceType();

  /**
   * Encrypted access token.
   *
   * @return the string
   */
  String accessTokenEnc();

  /**
   * Encrypted refresh token.
   *
   * @return the string
   */
  String refreshTokenEnc();

  /**
   * Scope.
   *
   * @return the string
   */
  String scope();

  /**
   * Expires at.
   *
   * @return the instant
   */
  Instant expiresAt();

  /**
   * Updated at.
   *
   * @return the instant
   */
  Instant updatedAt();

}
