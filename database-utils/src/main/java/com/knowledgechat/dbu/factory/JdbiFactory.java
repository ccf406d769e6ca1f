package com.knowledgechat.dbu.factory;

import static org.slf4j.LoggerFactory.getLogger;

import com.knowledgechat.dbu.model.Database;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.immutables.JdbiImmutables;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;

/**
 * Builds the Jdbi instance for the credential store. Row types listed under {@link #IMMUTABLES} are mapped
 * by their snake_case columns, so {@code ACCESS_TOKEN_ENC} lands in {@code accessTokenEnc()}.
 */
@Singleton
public class JdbiFactory {

  /**
   * Name of the set of immutable row classes to register.
   */
  public static final String IMMUTABLES = "JdbiImmutableClasses";
  private static final Logger log = getLogger(JdbiFactory.class);

  private final Database database;
  private final Set<Class<?>> rowTypes;

  /**
   * Instantiates a new Jdbi factory.
   *
   * @param database the database settings
   * @param rowTypes the immutable row classes
   */
  @Inject
  public JdbiFactory(final Database database,
                     @Named(IMMUTABLES) final Set<Class<?>> rowTypes) {
    this.database = database;
    this.rowTypes = rowTypes;
    log.info("JdbiFactory({}, {} row types)", database, rowTypes.size());
  }

  /**
   * Create jdbi.
   *
   * @return the jdbi
   */
  public Jdbi createJdbi() {
    log.trace("createJdbi()");
    final Jdbi jdbi = Jdbi.create(database.url(), database.username(), database.password())
        .installPlugin(new SqlObjectPlugin());
    final JdbiImmutables immutables = jdbi.getConfig(JdbiImmutables.class);
    rowTypes.forEach(immutables::registerImmutable);
    if (database.usePostgresql()) {
      jdbi.installPlugin(new PostgresPlugin());
    }
    jdbi.setSqlLogger(new Slf4JSqlLogger());
    log.info("createJdbi(): {} store", database.usePostgresql() ? "postgresql" : "hsqldb");
    return jdbi;
  }
}
