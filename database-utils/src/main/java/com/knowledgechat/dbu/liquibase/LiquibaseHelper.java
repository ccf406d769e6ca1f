package com.knowledgechat.dbu.liquibase;

import static org.slf4j.LoggerFactory.getLogger;

import java.sql.Connection;
import java.util.HashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import liquibase.Scope;
import liquibase.changelog.ChangeLogParameters;
import liquibase.command.CommandScope;
import liquibase.command.core.UpdateCommandStep;
import liquibase.command.core.helpers.DatabaseChangelogCommandStep;
import liquibase.command.core.helpers.DbUrlConnectionCommandStep;
import liquibase.database.Database;
import liquibase.database.DatabaseFactory;
import liquibase.database.jvm.JdbcConnection;
import liquibase.resource.ClassLoaderResourceAccessor;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;

/**
 * Applies a classpath changelog to the database behind a Jdbi instance.
 */
@Singleton
public class LiquibaseHelper {

  private static final Logger log = getLogger(LiquibaseHelper.class);

  /**
   * Instantiates a new Liquibase helper.
   */
  @Inject
  public LiquibaseHelper() {
    log.info("LiquibaseHelper()");
  }

  /**
   * Run the changelog against the jdbi's database.
   *
   * @param jdbi          the jdbi
   * @param changeLogFile the classpath location of the changelog
   */
  public void runLiquibase(final Jdbi jdbi, final String changeLogFile) {
    log.trace("runLiquibase({})", changeLogFile);
    jdbi.useHandle(handle -> {
      try {
        update(handle.getConnection(), changeLogFile);
        // liquibase turns auto-commit off and leaves the handle inside a transaction.
        if (handle.isInTransaction()) {
          handle.commit();
        }
        log.info("runLiquibase({}): complete", changeLogFile);
      } catch (RuntimeException e) {
        if (handle.isInTransaction()) {
          handle.rollback();
        }
        throw new IllegalStateException("Database update failure: " + changeLogFile, e);
      }
    });
  }

  private void update(final Connection connection, final String changeLogFile) {
    try {
      final Database database = DatabaseFactory.getInstance()
          .findCorrectDatabaseImplementation(new JdbcConnection(connection));
      final Map<String, Object> scopeObjects = new HashMap<>();
      scopeObjects.put(Scope.Attr.database.name(), database);
      scopeObjects.put(Scope.Attr.resourceAccessor.name(), new ClassLoaderResourceAccessor());

      Scope.child(scopeObjects, () -> {
        final CommandScope commandScope = new CommandScope(UpdateCommandStep.COMMAND_NAME);
        commandScope.addArgumentValue(DbUrlConnectionCommandStep.DATABASE_ARG, database);
        commandScope.addArgumentValue(UpdateCommandStep.CHANGELOG_FILE_ARG, changeLogFile);
        commandScope.addArgumentValue(DatabaseChangelogCommandStep.CHANGELOG_PARAMETERS, new ChangeLogParameters(database));
        commandScope.execute();
        return null;
      });
    } catch (Exception e) {
      throw new IllegalStateException("Liquibase update failed", e);
    }
  }
}
