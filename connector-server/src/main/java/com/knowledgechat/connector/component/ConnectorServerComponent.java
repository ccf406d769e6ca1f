package com.knowledgechat.connector.component;

import com.knowledgechat.connector.manager.CredentialManager;
import com.knowledgechat.connector.model.ServerConfiguration;
import com.knowledgechat.connector.module.ConfigurationModule;
import com.knowledgechat.connector.module.ConnectorServerModule;
import com.knowledgechat.connector.resource.JerseyResource;
import com.knowledgechat.perimeter.dagger.CommonModule;
import com.knowledgechat.perimeter.dagger.PerimeterModule;
import dagger.Component;
import java.util.Set;
import javax.inject.Singleton;

/**
 * Creates the pieces needed for the connector server to run.
 */
@Component(modules = {
    ConfigurationModule.class,
    ConnectorServerModule.class,
    PerimeterModule.class,
    CommonModule.class
})
@Singleton
public interface ConnectorServerComponent {

  /**
   * Instance connector server component.
   *
   * @param configuration the configuration
   * @return the connector server component
   */
  static ConnectorServerComponent instance(final ServerConfiguration configuration) {
    return DaggerConnectorServerComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * Resources to register with Jersey.
   *
   * @return the set
   */
  Set<JerseyResource> resources();

  /**
   * Credential manager, for the ingestion side.
   *
   * @return the credential manager
   */
  CredentialManager credentialManager();
}
