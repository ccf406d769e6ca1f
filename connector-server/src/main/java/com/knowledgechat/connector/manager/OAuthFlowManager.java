package com.knowledgechat.connector.manager;

import com.knowledgechat.connector.client.TokenExchangeClient;
import com.knowledgechat.connector.exception.TokenExchangeException;
import com.knowledgechat.connector.model.ProviderTokens;
import com.knowledgechat.connector.model.ServerConfiguration;
import com.knowledgechat.perimeter.failure.Outcome;
import com.knowledgechat.perimeter.failure.PerimeterException;
import com.knowledgechat.perimeter.model.OAuthState;
import com.knowledgechat.perimeter.model.SourceType;
import com.knowledgechat.perimeter.state.StateTokenCodec;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the consent flow and decides where the browser goes next. Failures are logged here and reduced
 * to one generic reason for the frontend.
 */
@Singleton
public class OAuthFlowManager {

  /**
   * Reason sent to the frontend for every failure of the flow.
   */
  public static final String OAUTH_FAILED = "oauth_failed";
  /**
   * Reason sent to the frontend for an unknown integration.
   */
  public static final String INVALID_SOURCE_TYPE = "invalid_source_type";

  private static final Logger log = LoggerFactory.getLogger(OAuthFlowManager.class);

  private final ServerConfiguration configuration;
  private final StateTokenCodec stateTokenCodec;
  private final TokenExchangeClient tokenExchangeClient;
  private final CredentialManager credentialManager;

  /**
   * Instantiates a new OAuth flow manager.
   *
   * @param configuration       the configuration
   * @param stateTokenCodec     the state token codec
   * @param tokenExchangeClient the token exchange client
   * @param credentialManager   the credential manager
   */
  @Inject
  public OAuthFlowManager(final ServerConfiguration configuration,
                          final StateTokenCodec stateTokenCodec,
                          final TokenExchangeClient tokenExchangeClient,
                          final CredentialManager credentialManager) {
    log.info("OAuthFlowManager({}, {}, {})", stateTokenCodec, tokenExchangeClient, credentialManager);
    this.configuration = configuration;
    this.stateTokenCodec = stateTokenCodec;
    this.tokenExchangeClient = tokenExchangeClient;
    this.credentialManager = credentialManager;
  }

  /**
   * Where to send a user who asked to connect an integration.
   *
   * @param subjectId  the authenticated user, may be null.
   * @param sourceType the requested integration wire name, may be null.
   * @return the consent page, or the frontend with an error.
   */
  public URI initiate(final String subjectId, final String sourceType) {
    log.trace("initiate({}, {})", subjectId, sourceType);
    if (subjectId == null || subjectId.isBlank()) {
      log.warn("initiate(): no authenticated user");
      return frontend("error", OAUTH_FAILED);
    }
    final Optional<SourceType> type = sourceType == null || sourceType.isEmpty()
        ? Optional.of(SourceType.DEFAULT)
        : SourceType.fromWireName(sourceType);
    if (type.isEmpty()) {
      return frontend("error", INVALID_SOURCE_TYPE);
    }
    try {
      return tokenExchangeClient.authorizationUrl(stateTokenCodec.generate(subjectId, type.get()));
    } catch (PerimeterException e) {
      log.error("initiate({}): unable to mint state: {}", subjectId, e.kind());
      return frontend("error", OAUTH_FAILED);
    }
  }

  /**
   * Where to send the browser after the provider's callback. On success the tokens are stored.
   *
   * @param code             authorization code.
   * @param state            state token.
   * @param error            provider error.
   * @param errorDescription provider error description.
   * @return the frontend, with the connected integration or the generic error.
   */
  public URI complete(final String code,
                      final String state,
                      final String error,
                      final String errorDescription) {
    log.trace("complete()");
    if (error != null && !error.isEmpty()) {
      log.info("complete(): provider returned {}: {}", error, errorDescription);
      return frontend("error", OAUTH_FAILED);
    }
    if (code == null || code.isEmpty()) {
      log.info("complete(): no authorization code");
      return frontend("error", OAUTH_FAILED);
    }
    final Outcome<OAuthState> validated = stateTokenCodec.validate(state);
    if (!validated.isSuccess()) {
      return frontend("error", OAUTH_FAILED);
    }
    final OAuthState oauthState = validated.value();
    try {
      final ProviderTokens tokens = tokenExchangeClient.exchangeCode(code);
      credentialManager.store(oauthState.subjectId(), oauthState.sourceType(), tokens);
    } catch (TokenExchangeException e) {
      log.error("complete({}): token exchange failed: {}", oauthState.subjectId(), e.getMessage());
      return frontend("error", OAUTH_FAILED);
    } catch (PerimeterException e) {
      log.error("complete({}): unable to protect tokens: {}", oauthState.subjectId(), e.kind());
      return frontend("error", OAUTH_FAILED);
    } catch (JdbiException e) {
      log.error("complete({}): unable to store credential", oauthState.subjectId(), e);
      return frontend("error", OAUTH_FAILED);
    }
    log.info("complete({}): connected {}", oauthState.subjectId(), oauthState.sourceType());
    return frontend("connected", oauthState.sourceType().wireName());
  }

  private URI frontend(final String parameter, final String value) {
    return URI.create(configuration.sourcesUrl() + "?" + parameter + "="
        + URLEncoder.encode(value, StandardCharsets.UTF_8));
  }

}
