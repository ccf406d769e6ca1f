package com.knowledgechat.connector.model;

import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Tokens as the provider returned them, before encryption.
 */
@Value.Immutable
public interface ProviderTokens {

  /**
   * Access token.
   *
   * @return the string
   */
  @Value.Redacted
  String accessToken();

  /**
   * Refresh token. Providers only send one on the first consent or a forced re-consent.
   *
   * @return the optional
   */
  @Value.Redacted
  Optional<String> refreshToken();

  /**
   * When the access token stops working.
   *
   * @return the instant
   */
  Instant expiresAt();

  /**
   * Space separated granted scopes.
   *
   * @return the string
   */
  String scope();

}
