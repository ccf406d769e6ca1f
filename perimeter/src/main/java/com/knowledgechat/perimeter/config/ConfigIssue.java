package com.knowledgechat.perimeter.config;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * An error or warning about one variable.
 */
@Value.Immutable
public interface ConfigIssue {

  /**
   * Of config issue.
   *
   * @param variable the variable
   * @param message  the message
   * @return the config issue
   */
  static ConfigIssue of(final String variable, final String message) {
    return ImmutableConfigIssue.builder().variable(variable).message(message).build();
  }

  /**
   * Variable.
   *
   * @return the string
   */
  String variable();

  /**
   * Message. Never contains the value.
   *
   * @return the string
   */
  String message();

  /**
   * A generated replacement for a weak secret.
   *
   * @return the optional
   */
  @Value.Redacted
  Optional<String> suggestion();
}
