package com.knowledgechat.perimeter.model;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * The fields carried by a validated state token.
 */
@Value.Immutable
public interface OAuthState {

  /**
   * The user that started the flow.
   *
   * @return the subject id
   */
  String subjectId();

  /**
   * The integration being connected.
   *
   * @return the source type
   */
  SourceType sourceType();

  /**
   * When the token was minted, in epoch millis.
   *
   * @return the issued at epoch ms
   */
  long issuedAtEpochMs();

  /**
   * Issued at as an instant.
   *
   * @return the instant
   */
  @Value.Derived
  default Instant issuedAt() {
    return Instant.ofEpochMilli(issuedAtEpochMs());
  }
}
