package com.knowledgechat.perimeter.cipher;

import com.knowledgechat.perimeter.failure.FailureKind;
import com.knowledgechat.perimeter.failure.Outcome;
import com.knowledgechat.perimeter.model.PerimeterSecrets;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256-GCM for OAuth tokens at rest.
 *
 * <p>Encoded form: {@code base64(iv):base64(tag):base64(ciphertext)}, 16 byte iv, 16 byte tag.</p>
 */
@Singleton
public class CredentialCipher {

  private static final Logger log = LoggerFactory.getLogger(CredentialCipher.class);

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int IV_LENGTH = 16;
  private static final int TAG_LENGTH = 16;
  private static final String SEPARATOR = ":";

  private final Optional<SecretKey> key;
  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Credential cipher. The key is derived once here.
   *
   * @param secrets       the secrets
   * @param keyDerivation the key derivation
   * @param secureRandom  source of initialization vectors
   */
  @Inject
  public CredentialCipher(final PerimeterSecrets secrets,
                          final KeyDerivation keyDerivation,
                          final SecureRandom secureRandom) {
    log.info("CredentialCipher({}, {})", secrets, keyDerivation);
    this.secureRandom = secureRandom;
    if (secrets.hasEncryptionSecret()) {
      this.key = Optional.of(new SecretKeySpec(keyDerivation.deriveKey(secrets.encryptionSecret()), "AES"));
    } else {
      log.error("No encryption secret configured; credentials cannot be encrypted or decrypted");
      this.key = Optional.empty();
    }
  }

  /**
   * Encrypt a token with a fresh iv.
   *
   * @param plaintext the token, non-empty
   * @return the encoded value, or the failure
   */
  public Outcome<String> encrypt(final String plaintext) {
    log.trace("encrypt()");
    if (key.isEmpty()) {
      return Outcome.failure(FailureKind.CONFIGURATION, "encryption secret is not configured");
    }
    if (plaintext == null || plaintext.isEmpty()) {
      return Outcome.failure(FailureKind.VALIDATION, "plaintext must be a non-empty string");
    }
    try {
      final byte[] iv = new byte[IV_LENGTH];
      secureRandom.nextBytes(iv);

      final Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key.get(), new GCMParameterSpec(TAG_LENGTH * 8, iv));
      final byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      // JCA appends the tag to the ciphertext.
      final byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH);
      final byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH, sealed.length);

      final Base64.Encoder encoder = Base64.getEncoder();
      return Outcome.success(encoder.encodeToString(iv) + SEPARATOR
          + encoder.encodeToString(tag) + SEPARATOR
          + encoder.encodeToString(ciphertext));
    } catch (GeneralSecurityException e) {
      log.error("Encryption failed", e);
      return Outcome.failure(FailureKind.CONFIGURATION, "cipher unavailable: " + e.getMessage());
    }
  }

  /**
   * Decrypt an encoded value. A failure here is never to be ignored.
   *
   * @param encoded the iv:tag:ciphertext value
   * @return the plaintext, or the failure
   */
  public Outcome<String> decrypt(final String encoded) {
    log.trace("decrypt()");
    if (key.isEmpty()) {
      return Outcome.failure(FailureKind.CONFIGURATION, "encryption secret is not configured");
    }
    if (encoded == null || encoded.isEmpty()) {
      return Outcome.failure(FailureKind.VALIDATION, "encrypted value must be a non-empty string");
    }
    final String[] parts = encoded.split(SEPARATOR, -1);
    if (parts.length != 3) {
      return Outcome.failure(FailureKind.FORMAT, "expected 3 fields, found " + parts.length);
    }
    final byte[] iv;
    final byte[] tag;
    final byte[] ciphertext;
    try {
      final Base64.Decoder decoder = Base64.getDecoder();
      iv = decoder.decode(parts[0]);
      tag = decoder.decode(parts[1]);
      ciphertext = decoder.decode(parts[2]);
    } catch (IllegalArgumentException e) {
      return Outcome.failure(FailureKind.FORMAT, "field is not base64");
    }
    if (iv.length == 0) {
      return Outcome.failure(FailureKind.FORMAT, "empty initialization vector");
    }
    if (tag.length != TAG_LENGTH) {
      log.warn("Rejecting encrypted value with a {} byte tag", tag.length);
      return Outcome.failure(FailureKind.AUTHENTICATION, "authentication tag has the wrong length");
    }
    try {
      final Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key.get(), new GCMParameterSpec(TAG_LENGTH * 8, iv));
      final byte[] sealed = new byte[ciphertext.length + TAG_LENGTH];
      System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
      System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_LENGTH);
      return Outcome.success(new String(cipher.doFinal(sealed), StandardCharsets.UTF_8));
    } catch (AEADBadTagException e) {
      log.warn("Authenticated decryption failed: tampered value or wrong key");
      return Outcome.failure(FailureKind.AUTHENTICATION, "authentication tag verification failed");
    } catch (GeneralSecurityException e) {
      log.error("Decryption failed", e);
      return Outcome.failure(FailureKind.CONFIGURATION, "cipher unavailable: " + e.getMessage());
    }
  }
}
