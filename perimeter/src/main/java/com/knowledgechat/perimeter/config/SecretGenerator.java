package com.knowledgechat.perimeter.config;

import java.security.SecureRandom;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.binary.Hex;

/**
 * Produces replacement suggestions for weak secrets.
 */
@Singleton
public class SecretGenerator {

  /**
   * Random bytes per suggestion; hex doubles the length.
   */
  public static final int SECRET_BYTES = 32;

  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Secret generator.
   *
   * @param secureRandom the secure random
   */
  @Inject
  public SecretGenerator(final SecureRandom secureRandom) {
    this.secureRandom = secureRandom;
  }

  /**
   * Generate a hex encoded random secret.
   *
   * @return the string
   */
  public String generate() {
    final byte[] bytes = new byte[SECRET_BYTES];
    secureRandom.nextBytes(bytes);
    return Hex.encodeHexString(bytes);
  }
}
