package com.knowledgechat.perimeter.dagger;

import com.knowledgechat.perimeter.model.PerimeterSecrets;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * Carries the secrets into a standalone {@link PerimeterComponent}.
 */
@Module
public class SecretsModule {

  private final PerimeterSecrets secrets;

  /**
   * Instantiates a new Secrets module.
   *
   * @param secrets the secrets
   */
  public SecretsModule(final PerimeterSecrets secrets) {
    this.secrets = secrets;
  }

  /**
   * Perimeter secrets.
   *
   * @return the perimeter secrets
   */
  @Provides
  @Singleton
  public PerimeterSecrets perimeterSecrets() {
    return secrets;
  }
}
