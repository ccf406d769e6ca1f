package com.knowledgechat.connector.dao;

import com.knowledgechat.connector.model.StoredCredential;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.Optional;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * The interface Credential dao.
 */
public interface CredentialDao {

  /**
   * SQLSTATE of a unique constraint violation.
   */
  String UNIQUE_VIOLATION = "23505";

  /**
   * Read the credential of one integration.
   *
   * @param subjectId  the subject id
   * @param sourceType the source type
   * @return the credential
   */
  @SqlQuery("select * from OAUTH_CREDENTIAL where SUBJECT_ID = :subjectId and SOURCE_TYPE = :sourceType")
  Optional<StoredCredential> read(@Bind("subjectId") String subjectId,
                                  @Bind("sourceType") String sourceType);

  /**
   * Insert boolean.
   *
   * @param credential the credential
   * @return the boolean
   */
  @SqlUpdate("insert into OAUTH_CREDENTIAL (SUBJECT_ID, SOURCE_TYPE, ACCESS_TOKEN_ENC, REFRESH_TOKEN_ENC, SCOPE, "
      + "EXPIRES_AT, UPDATED_AT) values (:subjectId, :sourceType, :accessTokenEnc, :refreshTokenEnc, :scope, "
      + ":expiresAt, :updatedAt)")
  boolean insert(@BindPojo StoredCredential credential);

  /**
   * Update boolean.
   *
   * @param credential the credential
   * @return true if a row was replaced.
   */
  @SqlUpdate("update OAUTH_CREDENTIAL set ACCESS_TOKEN_ENC = :accessTokenEnc, REFRESH_TOKEN_ENC = :refreshTokenEnc, "
      + "SCOPE = :scope, EXPIRES_AT = :expiresAt, UPDATED_AT = :updatedAt "
      + "where SUBJECT_ID = :subjectId and SOURCE_TYPE = :sourceType")
  boolean update(@BindPojo StoredCredential credential);

  /**
   * Insert or replace the row for the credential's subject and source type. Each statement commits on its
   * own; when a concurrent callback inserts the row first, the unique key rejects our insert and the
   * update is applied instead.
   *
   * @param credential the credential
   */
  default void upsert(final StoredCredential credential) {
    if (update(credential)) {
      return;
    }
    try {
      insert(credential);
    } catch (UnableToExecuteStatementException e) {
      if (!isUniqueViolation(e) || !update(credential)) {
        throw e;
      }
    }
  }

  /**
   * True when the statement failed on a unique or primary key constraint (SQLSTATE 23505, or the HSQLDB
   * and JDBC integrity constraint type).
   *
   * @param e the failure
   * @return the boolean
   */
  private static boolean isUniqueViolation(final UnableToExecuteStatementException e) {
    if (e.getCause() instanceof SQLIntegrityConstraintViolationException) {
      return true;
    }
    return e.getCause() instanceof SQLException sqlException
        && UNIQUE_VIOLATION.equals(sqlException.getSQLState());
  }

  /**
   * Delete boolean.
   *
   * @param subjectId  the subject id
   * @param sourceType the source type
   * @return the boolean
   */
  @SqlUpdate("delete from OAUTH_CREDENTIAL where SUBJECT_ID = :subjectId and SOURCE_TYPE = :sourceType")
  boolean delete(@Bind("subjectId") String subjectId,
                 @Bind("sourceType") String sourceType);

}
