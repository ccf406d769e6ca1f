package com.knowledgechat.connector.manager;

import com.knowledgechat.connector.client.TokenExchangeClient;
import com.knowledgechat.connector.dao.CredentialDao;
import com.knowledgechat.connector.exception.CredentialNotFoundException;
import com.knowledgechat.connector.exception.InvalidGrantException;
import com.knowledgechat.connector.exception.ReconnectRequiredException;
import com.knowledgechat.connector.exception.TokenExchangeException;
import com.knowledgechat.connector.model.ImmutableStoredCredential;
import com.knowledgechat.connector.model.ProviderTokens;
import com.knowledgechat.connector.model.StoredCredential;
import com.knowledgechat.perimeter.cipher.CredentialCipher;
import com.knowledgechat.perimeter.model.SourceType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps provider tokens encrypted at rest and hands out usable access tokens. Any cipher failure
 * surfaces as a {@link com.knowledgechat.perimeter.failure.PerimeterException}; a stored value that does
 * not decrypt is never used.
 */
@Singleton
public class CredentialManager {

  /**
   * Access tokens this close to expiry are refreshed before use.
   */
  public static final Duration REFRESH_MARGIN = Duration.ofMinutes(1);

  private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

  private final CredentialDao credentialDao;
  private final CredentialCipher credentialCipher;
  private final TokenExchangeClient tokenExchangeClient;
  private final Clock clock;

  /**
   * Instantiates a new Credential manager.
   *
   * @param credentialDao       the credential dao
   * @param credentialCipher    the credential cipher
   * @param tokenExchangeClient the token exchange client
   * @param clock               the clock
   */
  @Inject
  public CredentialManager(final CredentialDao credentialDao,
                           final CredentialCipher credentialCipher,
                           final TokenExchangeClient tokenExchangeClient,
                           final Clock clock) {
    log.info("CredentialManager({}, {})", credentialCipher, tokenExchangeClient);
    this.credentialDao = credentialDao;
    this.credentialCipher = credentialCipher;
    this.tokenExchangeClient = tokenExchangeClient;
    this.clock = clock;
  }

  /**
   * Encrypt and store tokens from a code exchange, replacing what was there.
   *
   * @param subjectId  the subject id
   * @param sourceType the source type
   * @param tokens     the tokens
   * @throws TokenExchangeException if the provider sent no refresh token and none is stored.
   */
  public void store(final String subjectId, final SourceType sourceType, final ProviderTokens tokens) {
    log.trace("store({}, {})", subjectId, sourceType);
    final String refreshTokenEnc;
    if (tokens.refreshToken().isPresent()) {
      refreshTokenEnc = credentialCipher.encrypt(tokens.refreshToken().get()).orElseThrow();
    } else {
      log.info("store({}, {}): no refresh token from provider, keeping the stored one", subjectId, sourceType);
      refreshTokenEnc = credentialDao.read(subjectId, sourceType.wireName())
          .map(StoredCredential::refreshTokenEnc)
          .orElseThrow(() -> new TokenExchangeException("No refresh token issued and none stored"));
    }
    credentialDao.upsert(ImmutableStoredCredential.builder()
        .subjectId(subjectId)
        .sourceType(sourceType.wireName())
        .accessTokenEnc(credentialCipher.encrypt(tokens.accessToken()).orElseThrow())
        .refreshTokenEnc(refreshTokenEnc)
        .scope(tokens.scope())
        .expiresAt(tokens.expiresAt())
        .updatedAt(clock.instant())
        .build());
  }

  /**
   * A usable access token, refreshed first when it is about to expire.
   *
   * @param subjectId  the subject id
   * @param sourceType the source type
   * @return the access token
   * @throws CredentialNotFoundException if nothing is stored.
   * @throws ReconnectRequiredException  if the provider revoked the grant; the row is gone afterwards.
   */
  public String accessToken(final String subjectId, final SourceType sourceType) {
    log.trace("accessToken({}, {})", subjectId, sourceType);
    final StoredCredential credential = credentialDao.read(subjectId, sourceType.wireName())
        .orElseThrow(() -> new CredentialNotFoundException("No credential for " + sourceType.wireName()));
    final String accessToken = credentialCipher.decrypt(credential.accessTokenEnc()).orElseThrow();
    final Instant now = clock.instant();
    if (Duration.between(now, credential.expiresAt()).compareTo(REFRESH_MARGIN) > 0) {
      return accessToken;
    }

    log.info("accessToken({}, {}): refreshing, expires {}", subjectId, sourceType, credential.expiresAt());
    final String refreshToken = credentialCipher.decrypt(credential.refreshTokenEnc()).orElseThrow();
    final ProviderTokens refreshed;
    try {
      refreshed = tokenExchangeClient.refresh(refreshToken);
    } catch (InvalidGrantException e) {
      log.warn("accessToken({}, {}): grant revoked, removing credential", subjectId, sourceType);
      credentialDao.delete(subjectId, sourceType.wireName());
      throw new ReconnectRequiredException(sourceType, e);
    }
    final Optional<String> rotated = refreshed.refreshToken();
    credentialDao.update(ImmutableStoredCredential.copyOf(credential)
        .withAccessTokenEnc(credentialCipher.encrypt(refreshed.accessToken()).orElseThrow())
        .withRefreshTokenEnc(rotated.isPresent()
            ? credentialCipher.encrypt(rotated.get()).orElseThrow()
            : credential.refreshTokenEnc())
        .withExpiresAt(refreshed.expiresAt())
        .withUpdatedAt(now));
    return refreshed.accessToken();
  }

  /**
   * Forget the credential.
   *
   * @param subjectId  the subject id
   * @param sourceType the source type
   * @return true if one was stored.
   */
  public boolean disconnect(final String subjectId, final SourceType sourceType) {
    log.trace("disconnect({}, {})", subjectId, sourceType);
    return credentialDao.delete(subjectId, sourceType.wireName());
  }

}
