package com.knowledgechat.connector.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgechat.connector.exception.InvalidGrantException;
import com.knowledgechat.connector.exception.TokenExchangeException;
import com.knowledgechat.connector.model.ImmutableProviderTokens;
import com.knowledgechat.connector.model.ProviderTokens;
import com.knowledgechat.connector.model.ServerConfiguration;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Google's OAuth 2.0 endpoints over {@link HttpClient}. Nothing is retried.
 */
@Singleton
public class GoogleTokenClient implements TokenExchangeClient {

  /**
   * Consent page.
   */
  public static final String AUTHORIZATION_ENDPOINT = "https://accounts.google.com/o/oauth2/v2/auth";
  /**
   * Token endpoint.
   */
  public static final String TOKEN_ENDPOINT = "https://oauth2.googleapis.com/token";
  /**
   * Read-only mail and files, plus who the user is.
   */
  public static final List<String> SCOPES = List.of(
      "https://www.googleapis.com/auth/gmail.readonly",
      "https://www.googleapis.com/auth/drive.readonly",
      "https://www.googleapis.com/auth/userinfo.profile",
      "https://www.googleapis.com/auth/userinfo.email");
  /**
   * Lifetime assumed when the provider leaves out expires_in.
   */
  public static final Duration DEFAULT_LIFETIME = Duration.ofHours(1);

  private static final Logger log = LoggerFactory.getLogger(GoogleTokenClient.class);
  private static final String INVALID_GRANT = "invalid_grant";
  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  private final ServerConfiguration configuration;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Instantiates a new Google token client.
   *
   * @param configuration the configuration
   * @param httpClient    the http client
   * @param objectMapper  the object mapper
   * @param clock         the clock
   */
  @Inject
  public GoogleTokenClient(final ServerConfiguration configuration,
                           final HttpClient httpClient,
                           final ObjectMapper objectMapper,
                           final Clock clock) {
    log.info("GoogleTokenClient({})", configuration.redirectUri());
    this.configuration = configuration;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public URI authorizationUrl(final String state) {
    log.trace("authorizationUrl()");
    final Map<String, String> params = new LinkedHashMap<>();
    params.put("client_id", configuration.googleClientId());
    params.put("redirect_uri", configuration.redirectUri());
    params.put("response_type", "code");
    params.put("scope", String.join(" ", SCOPES));
    params.put("access_type", "offline");
    params.put("prompt", "consent");
    params.put("state", state);
    return URI.create(AUTHORIZATION_ENDPOINT + "?" + formEncode(params));
  }

  @Override
  public ProviderTokens exchangeCode(final String code) {
    log.trace("exchangeCode()");
    final Map<String, String> form = new LinkedHashMap<>();
    form.put("code", code);
    form.put("client_id", configuration.googleClientId());
    form.put("client_secret", configuration.googleClientSecret());
    form.put("redirect_uri", configuration.redirectUri());
    form.put("grant_type", "authorization_code");
    return post(form);
  }

  @Override
  public ProviderTokens refresh(final String refreshToken) {
    log.trace("refresh()");
    final Map<String, String> form = new LinkedHashMap<>();
    form.put("refresh_token", refreshToken);
    form.put("client_id", configuration.googleClientId());
    form.put("client_secret", configuration.googleClientSecret());
    form.put("grant_type", "refresh_token");
    return post(form);
  }

  private ProviderTokens post(final Map<String, String> form) {
    final HttpRequest request = HttpRequest.newBuilder(URI.create(TOKEN_ENDPOINT))
        .timeout(TIMEOUT)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
        .build();
    final HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TokenExchangeException("Token endpoint unreachable", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TokenExchangeException("Interrupted calling the token endpoint", e);
    }
    final TokenResponse body = parse(response.body());
    if (response.statusCode() / 100 != 2 || body.error() != null) {
      log.warn("Token endpoint refused: {} {}", response.statusCode(), body.error());
      if (INVALID_GRANT.equals(body.error())) {
        throw new InvalidGrantException("Grant is no longer valid: " + body.errorDescription());
      }
      throw new TokenExchangeException("Token endpoint returned " + response.statusCode() + ": " + body.error());
    }
    if (body.accessToken() == null || body.accessToken().isEmpty()) {
      throw new TokenExchangeException("Token endpoint returned no access token");
    }
    final Duration lifetime = body.expiresIn() == null ? DEFAULT_LIFETIME : Duration.ofSeconds(body.expiresIn());
    final ImmutableProviderTokens.Builder builder = ImmutableProviderTokens.builder()
        .accessToken(body.accessToken())
        .expiresAt(clock.instant().plus(lifetime))
        .scope(body.scope() == null || body.scope().isBlank() ? String.join(" ", SCOPES) : body.scope());
    if (body.refreshToken() != null && !body.refreshToken().isEmpty()) {
      builder.refreshToken(body.refreshToken());
    }
    return builder.build();
  }

  private TokenResponse parse(final String body) {
    try {
      final TokenResponse parsed = objectMapper.readValue(body, TokenResponse.class);
      if (parsed == null) {
        throw new TokenExchangeException("Empty token endpoint response");
      }
      return parsed;
    } catch (JsonProcessingException e) {
      throw new TokenExchangeException("Unreadable token endpoint response", e);
    }
  }

  private static String formEncode(final Map<String, String> params) {
    return params.entrySet().stream()
        .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8) + "="
            + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }

  /**
   * Body of the token endpoint's answer, success or error.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenResponse(@JsonProperty("access_token") String accessToken,
                       @JsonProperty("refresh_token") String refreshToken,
                       @JsonProperty("expires_in") Long expiresIn,
                       @JsonProperty("scope") String scope,
                       @JsonProperty("error") String error,
                       @JsonProperty("error_description") String errorDescription) {
  }

}
