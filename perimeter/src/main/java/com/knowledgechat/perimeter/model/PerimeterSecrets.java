package com.knowledgechat.perimeter.model;

import java.util.Map;
import org.immutables.value.Value;

/**
 * Secret material fixed at process start. Empty values mean the secret was never configured; the codec
 * and cipher then refuse to work rather than fall back to anything weaker.
 */
@Value.Immutable
public interface PerimeterSecrets {

  /**
   * Environment variable holding the state token signing secret.
   */
  String SIGNING_SECRET_VARIABLE = "JWT_SECRET";

  /**
   * Environment variable holding the credential encryption secret.
   */
  String ENCRYPTION_SECRET_VARIABLE = "ENCRYPTION_KEY";

  /**
   * Reads both secrets from a validated environment.
   *
   * @param environment name/value pairs.
   * @return the secrets.
   */
  static PerimeterSecrets fromEnvironment(final Map<String, String> environment) {
    return ImmutablePerimeterSecrets.builder()
        .signingSecret(environment.getOrDefault(SIGNING_SECRET_VARIABLE, ""))
        .encryptionSecret(environment.getOrDefault(ENCRYPTION_SECRET_VARIABLE, ""))
        .build();
  }

  /**
   * HMAC key for state tokens.
   *
   * @return the string
   */
  @Value.Redacted
  String signingSecret();

  /**
   * Input to the key derivation for the credential cipher.
   *
   * @return the string
   */
  @Value.Redacted
  String encryptionSecret();

  /**
   * Has signing secret.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean hasSigningSecret() {
    return !signingSecret().isEmpty();
  }

  /**
   * Has encryption secret.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean hasEncryptionSecret() {
    return !encryptionSecret().isEmpty();
  }
}
