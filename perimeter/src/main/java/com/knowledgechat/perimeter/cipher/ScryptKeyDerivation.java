package com.knowledgechat.perimeter.cipher;

import java.nio.charset.StandardCharsets;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.generators.SCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * scrypt with a fixed salt, so one secret always yields the same key. Rotating the secret makes every
 * stored ciphertext unreadable; stored refresh tokens are re-issued by the provider over time.
 *
 * <p>Parameters match node's {@code crypto.scryptSync(secret, 'salt', 32)} defaults so rows written by
 * the earlier service still decrypt.</p>
 */
@Singleton
public class ScryptKeyDerivation implements KeyDerivation {

  private static final Logger log = LoggerFactory.getLogger(ScryptKeyDerivation.class);

  private static final byte[] SALT = "salt".getBytes(StandardCharsets.UTF_8);
  private static final int COST = 16384;
  private static final int BLOCK_SIZE = 8;
  private static final int PARALLELIZATION = 1;
  private static final int KEY_LENGTH = 32;

  /**
   * Instantiates a new Scrypt key derivation.
   */
  @Inject
  public ScryptKeyDerivation() {
    log.info("ScryptKeyDerivation()");
  }

  @Override
  public byte[] deriveKey(final String secret) {
    log.trace("deriveKey()");
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("Cannot derive a key from an empty secret");
    }
    return SCrypt.generate(secret.getBytes(StandardCharsets.UTF_8), SALT, COST, BLOCK_SIZE, PARALLELIZATION, KEY_LENGTH);
  }

  @Override
  public int keyLength() {
    return KEY_LENGTH;
  }
}
