package com.knowledgechat.connector;

import io.dropwizard.core.Configuration;

/**
 * Dropwizard's own settings: the listener and logging. Service settings come from the environment.
 */
public class ConnectorServerConfiguration extends Configuration {
}
