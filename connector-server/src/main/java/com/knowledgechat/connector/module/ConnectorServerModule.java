package com.knowledgechat.connector.module;

import com.knowledgechat.connector.client.GoogleTokenClient;
import com.knowledgechat.connector.client.TokenExchangeClient;
import com.knowledgechat.connector.dao.CredentialDao;
import com.knowledgechat.connector.model.StoredCredential;
import com.knowledgechat.connector.resource.JerseyResource;
import com.knowledgechat.connector.resource.OAuthConnectionsResource;
import com.knowledgechat.dbu.factory.JdbiFactory;
import com.knowledgechat.dbu.liquibase.LiquibaseHelper;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import dagger.multibindings.IntoSet;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Set;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The type Connector server module.
 */
@Module(includes = ConnectorServerModule.Binder.class)
public class ConnectorServerModule {

  /**
   * The constant LIQUIBASE_SETUP_XML.
   */
  public static final String LIQUIBASE_SETUP_XML = "liquibase/connector-setup.xml";

  /**
   * Jdbi, with the schema brought up to date.
   *
   * @param factory         the factory
   * @param liquibaseHelper the liquibase helper
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory,
                   final LiquibaseHelper liquibaseHelper) {
    final Jdbi jdbi = factory.createJdbi();
    liquibaseHelper.runLiquibase(jdbi, LIQUIBASE_SETUP_XML);
    return jdbi;
  }

  /**
   * Immutable classes set.
   *
   * @return the set
   */
  @Provides
  @Singleton
  @Named(JdbiFactory.IMMUTABLES)
  public Set<Class<?>> immutableClasses() {
    return Set.of(StoredCredential.class);
  }

  /**
   * Credential dao.
   *
   * @param jdbi the jdbi
   * @return the credential dao
   */
  @Provides
  @Singleton
  public CredentialDao credentialDao(final Jdbi jdbi) {
    return jdbi.onDemand(CredentialDao.class);
  }

  /**
   * Http client for the provider's endpoints.
   *
   * @return the http client
   */
  @Provides
  @Singleton
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  /**
   * The interface Binder.
   */
  @Module
  interface Binder {

    /**
     * Token exchange client.
     *
     * @param client the google client
     * @return the token exchange client
     */
    @Binds
    TokenExchangeClient tokenExchangeClient(GoogleTokenClient client);

    /**
     * OAuth connections resource.
     *
     * @param resource the resource
     * @return the jersey resource
     */
    @Binds
    @IntoSet
    JerseyResource oauthConnectionsResource(OAuthConnectionsResource resource);

  }

}
