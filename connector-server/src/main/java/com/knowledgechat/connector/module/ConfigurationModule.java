package com.knowledgechat.connector.module;

import com.knowledgechat.connector.model.ServerConfiguration;
import com.knowledgechat.dbu.model.Database;
import com.knowledgechat.perimeter.model.PerimeterSecrets;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * Carries the validated configuration into the graph.
 */
@Module
public class ConfigurationModule {

  private final ServerConfiguration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final ServerConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Server configuration.
   *
   * @return the server configuration
   */
  @Provides
  @Singleton
  public ServerConfiguration serverConfiguration() {
    return configuration;
  }

  /**
   * Perimeter secrets.
   *
   * @return the perimeter secrets
   */
  @Provides
  @Singleton
  public PerimeterSecrets perimeterSecrets() {
    return configuration.perimeterSecrets();
  }

  /**
   * Database.
   *
   * @return the database
   */
  @Provides
  @Singleton
  public Database database() {
    return configuration.database();
  }
}
