package com.knowledgechat.perimeter.config;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.immutables.value.Value;

/**
 * The ordered rules checked by {@link ConfigGuard}, plus the production-only url checks.
 */
@Value.Immutable
public interface ConfigPolicy {

  /**
   * Rules, evaluated in this order.
   *
   * @return the list
   */
  List<VariableRule> rules();

  /**
   * Variable naming the deployment environment.
   *
   * @return the string
   */
  @Value.Default
  default String environmentVariable() {
    return "APP_ENV";
  }

  /**
   * Value of {@link #environmentVariable()} that enables production checks.
   *
   * @return the string
   */
  @Value.Default
  default String productionValue() {
    return "production";
  }

  /**
   * Url variables that must not point at a development host in production.
   *
   * @return the list
   */
  List<String> productionUrlVariables();

  /**
   * Host fragments that mark a development url.
   *
   * @return the list
   */
  List<String> developmentHosts();

  /**
   * Rule for a variable.
   *
   * @param name the name
   * @return the optional
   */
  default Optional<VariableRule> rule(final String name) {
    return rules().stream().filter(rule -> rule.name().equals(name)).findFirst();
  }

  /**
   * Names must be unique.
   */
  @Value.Check
  default void check() {
    final Set<String> names = rules().stream().map(VariableRule::name).collect(Collectors.toSet());
    if (names.size() != rules().size()) {
      throw new IllegalStateException("Duplicate variable in policy");
    }
  }
}
