package com.knowledgechat.connector;

import com.knowledgechat.connector.component.ConnectorServerComponent;
import com.knowledgechat.connector.model.ServerConfiguration;
import com.knowledgechat.perimeter.config.ConfigGuard;
import com.knowledgechat.perimeter.config.ConfigPolicies;
import com.knowledgechat.perimeter.config.ConfigReport;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The type Connector server.
 */
public class ConnectorServer extends Application<ConnectorServerConfiguration> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectorServer.class);

  private final ServerConfiguration serverConfiguration;

  /**
   * Instantiates a new Connector server.
   *
   * @param serverConfiguration the validated configuration
   */
  public ConnectorServer(final ServerConfiguration serverConfiguration) {
    LOGGER.info("ConnectorServer({})", serverConfiguration);
    this.serverConfiguration = serverConfiguration;
  }

  /**
   * Run the world. The environment is checked before anything else starts.
   *
   * @param args from the command line.
   * @throws Exception if we could not start the server.
   */
  public static void main(String[] args) throws Exception {
    LOGGER.info("main({})", (Object) args);
    final ConfigReport report = new ConfigGuard(ConfigPolicies.standard(), System.getenv()).validateOrExit();
    final ConnectorServer server = new ConnectorServer(ServerConfiguration.from(report.resolved()));
    server.run(args);
  }

  @Override
  public String getName() {
    return "connector-server";
  }

  @Override
  public void initialize(final Bootstrap<ConnectorServerConfiguration> bootstrap) {
    bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
        bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
  }

  @Override
  public void run(final ConnectorServerConfiguration configuration,
                  final Environment environment) {
    LOGGER.info("run({})", configuration);
    final ConnectorServerComponent component = ConnectorServerComponent.instance(serverConfiguration);
    component.resources().forEach(resource -> {
      LOGGER.info("Registering resource: {}", resource.getClass().getSimpleName());
      environment.jersey().register(resource);
    });
  }

}
