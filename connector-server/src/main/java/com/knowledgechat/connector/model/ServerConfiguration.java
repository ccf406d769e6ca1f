package com.knowledgechat.connector.model;

import com.knowledgechat.dbu.model.Database;
import com.knowledgechat.dbu.model.ImmutableDatabase;
import com.knowledgechat.perimeter.config.ConfigPolicies;
import com.knowledgechat.perimeter.model.PerimeterSecrets;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Everything the connector needs from the environment, read once after the environment passed
 * validation. Nothing else in the service reads environment variables.
 */
@Value.Immutable
public interface ServerConfiguration {

  /**
   * Callback path on the backend, registered with the provider.
   */
  String CALLBACK_PATH = "/auth/google/callback";

  /**
   * Build from the resolved values of a valid config report.
   *
   * @param resolved the resolved environment, defaults applied.
   * @return the server configuration
   */
  static ServerConfiguration from(final Map<String, String> resolved) {
    return ImmutableServerConfiguration.builder()
        .appEnvironment(resolved.get(ConfigPolicies.APP_ENV))
        .frontendUrl(resolved.get(ConfigPolicies.FRONTEND_URL))
        .backendUrl(resolved.get(ConfigPolicies.BACKEND_URL))
        .googleClientId(resolved.get(ConfigPolicies.GOOGLE_CLIENT_ID))
        .googleClientSecret(resolved.get(ConfigPolicies.GOOGLE_CLIENT_SECRET))
        .database(database(resolved))
        .perimeterSecrets(PerimeterSecrets.fromEnvironment(resolved))
        .build();
  }

  private static Database database(final Map<String, String> resolved) {
    final ImmutableDatabase.Builder builder = ImmutableDatabase.builder()
        .url(resolved.get(ConfigPolicies.DATABASE_URL))
        .username(resolved.get(ConfigPolicies.DATABASE_USERNAME));
    Optional.ofNullable(resolved.get(ConfigPolicies.DATABASE_PASSWORD)).ifPresent(builder::password);
    return builder.build();
  }

  /**
   * App environment.
   *
   * @return the string
   */
  String appEnvironment();

  /**
   * Frontend url, the target of every redirect back to the user.
   *
   * @return the string
   */
  String frontendUrl();

  /**
   * Backend url.
   *
   * @return the string
   */
  String backendUrl();

  /**
   * Google client id.
   *
   * @return the string
   */
  String googleClientId();

  /**
   * Google client secret.
   *
   * @return the string
   */
  @Value.Redacted
  String googleClientSecret();

  /**
   * Database.
   *
   * @return the database
   */
  Database database();

  /**
   * Perimeter secrets.
   *
   * @return the perimeter secrets
   */
  PerimeterSecrets perimeterSecrets();

  /**
   * Production.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean production() {
    return "production".equals(appEnvironment());
  }

  /**
   * Redirect uri given to the provider.
   *
   * @return the string
   */
  @Value.Derived
  default String redirectUri() {
    return trimSlash(backendUrl()) + CALLBACK_PATH;
  }

  /**
   * Where the frontend lists sources; redirects append their query to this.
   *
   * @return the string
   */
  @Value.Derived
  default String sourcesUrl() {
    return trimSlash(frontendUrl()) + "/sources";
  }

  private static String trimSlash(final String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

}
