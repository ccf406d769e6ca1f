package com.knowledgechat.perimeter.config;

import com.knowledgechat.perimeter.model.PerimeterSecrets;
import java.util.regex.Pattern;

/**
 * The policy the connector service boots with.
 */
public final class ConfigPolicies {

  /**
   * Database url variable.
   */
  public static final String DATABASE_URL = "DATABASE_URL";
  /**
   * Database username variable.
   */
  public static final String DATABASE_USERNAME = "DATABASE_USERNAME";
  /**
   * Database password variable.
   */
  public static final String DATABASE_PASSWORD = "DATABASE_PASSWORD";
  /**
   * Port variable.
   */
  public static final String PORT = "PORT";
  /**
   * Deployment environment variable.
   */
  public static final String APP_ENV = "APP_ENV";
  /**
   * Frontend url variable.
   */
  public static final String FRONTEND_URL = "FRONTEND_URL";
  /**
   * Backend url variable.
   */
  public static final String BACKEND_URL = "BACKEND_URL";
  /**
   * Google client id variable.
   */
  public static final String GOOGLE_CLIENT_ID = "GOOGLE_CLIENT_ID";
  /**
   * Google client secret variable.
   */
  public static final String GOOGLE_CLIENT_SECRET = "GOOGLE_CLIENT_SECRET";

  private static final Pattern HTTP_URL = Pattern.compile("^https?://.+");

  private ConfigPolicies() {
  }

  /**
   * Standard policy.
   *
   * @return the config policy
   */
  public static ConfigPolicy standard() {
    return ImmutableConfigPolicy.builder()
        .addRules(ImmutableVariableRule.builder()
            .name(PerimeterSecrets.SIGNING_SECRET_VARIABLE)
            .description("State token signing secret (must be strong random string)")
            .required(true)
            .minLength(32)
            .sensitive(true)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(PerimeterSecrets.ENCRYPTION_SECRET_VARIABLE)
            .description("Encryption key for stored OAuth tokens (must be strong random string)")
            .required(true)
            .minLength(32)
            .sensitive(true)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(DATABASE_URL)
            .description("JDBC url of the credential store")
            .required(true)
            .pattern(Pattern.compile("^jdbc:(postgresql|hsqldb):.+"))
            .sensitive(true)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(DATABASE_USERNAME)
            .description("Credential store username")
            .defaultValue("SA")
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(DATABASE_PASSWORD)
            .description("Credential store password")
            .sensitive(true)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(PORT)
            .description("Server port number")
            .defaultValue("3001")
            .pattern(Pattern.compile("^\\d+$"))
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(APP_ENV)
            .description("Deployment environment")
            .defaultValue("development")
            .addAllowedValues("development", "production", "test")
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(FRONTEND_URL)
            .description("Frontend application URL")
            .required(true)
            .pattern(HTTP_URL)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(BACKEND_URL)
            .description("Backend API URL")
            .required(true)
            .pattern(HTTP_URL)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(GOOGLE_CLIENT_ID)
            .description("Google OAuth client ID")
            .required(true)
            .minLength(20)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name(GOOGLE_CLIENT_SECRET)
            .description("Google OAuth client secret")
            .required(true)
            .minLength(20)
            .sensitive(true)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name("EMAIL_USER")
            .description("Email service username")
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name("EMAIL_PASSWORD")
            .description("Email service password")
            .sensitive(true)
            .build())
        .addRules(ImmutableVariableRule.builder()
            .name("HUGGINGFACE_API_KEY")
            .description("Hugging Face API key (optional, for higher rate limits)")
            .sensitive(true)
            .build())
        .addProductionUrlVariables(FRONTEND_URL, BACKEND_URL)
        .addDevelopmentHosts("localhost", "127.0.0.1")
        .build();
  }
}
