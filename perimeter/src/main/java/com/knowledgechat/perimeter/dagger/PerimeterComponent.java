package com.knowledgechat.perimeter.dagger;

import com.knowledgechat.perimeter.cipher.CredentialCipher;
import com.knowledgechat.perimeter.config.WeakValueDetector;
import com.knowledgechat.perimeter.model.PerimeterSecrets;
import com.knowledgechat.perimeter.state.StateTokenCodec;
import dagger.Component;
import javax.inject.Singleton;

/**
 * The perimeter on its own, for callers that are not the connector server.
 */
@Singleton
@Component(modules = {PerimeterModule.class, SecretsModule.class, CommonModule.class})
public interface PerimeterComponent {

  /**
   * Instance perimeter component.
   *
   * @param secrets the secrets
   * @return the perimeter component
   */
  static PerimeterComponent instance(final PerimeterSecrets secrets) {
    return DaggerPerimeterComponent.builder().secretsModule(new SecretsModule(secrets)).build();
  }

  /**
   * State token codec.
   *
   * @return the state token codec
   */
  StateTokenCodec stateTokenCodec();

  /**
   * Credential cipher.
   *
   * @return the credential cipher
   */
  CredentialCipher credentialCipher();

  /**
   * Weak value detector.
   *
   * @return the weak value detector
   */
  WeakValueDetector weakValueDetector();
}
