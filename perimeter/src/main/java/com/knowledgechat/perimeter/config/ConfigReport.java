package com.knowledgechat.perimeter.config;

import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Result of validating the environment.
 */
@Value.Immutable
public interface ConfigReport {

  /**
   * Errors; any error stops the boot.
   *
   * @return the list
   */
  List<ConfigIssue> errors();

  /**
   * Warnings.
   *
   * @return the list
   */
  List<ConfigIssue> warnings();

  /**
   * The environment with defaults applied, restricted to the variables in the policy.
   *
   * @return the map
   */
  @Value.Redacted
  Map<String, String> resolved();

  /**
   * Valid.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean valid() {
    return errors().isEmpty();
  }
}
