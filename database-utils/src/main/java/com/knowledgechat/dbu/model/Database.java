package com.knowledgechat.dbu.model;

import org.immutables.value.Value;

/**
 * Connection settings for the relational store holding encrypted credentials. Built from the validated
 * environment, never read from a file.
 */
@Value.Immutable
public interface Database {

  /**
   * JDBC url, {@code jdbc:hsqldb:} or {@code jdbc:postgresql:}.
   *
   * @return the string
   */
  String url();

  /**
   * Database username.
   *
   * @return the string
   */
  String username();

  /**
   * Database password, empty when the store needs none. Never rendered by toString().
   *
   * @return the string
   */
  @Value.Redacted
  @Value.Default
  default String password() {
    return "";
  }

  /**
   * True when the url points at PostgreSQL.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean usePostgresql() {
    return url().startsWith("jdbc:postgresql:");
  }

  @Value.Check
  default void check() {
    if (!url().startsWith("jdbc:")) {
      throw new IllegalArgumentException("Database url must be a jdbc url");
    }
  }

}
