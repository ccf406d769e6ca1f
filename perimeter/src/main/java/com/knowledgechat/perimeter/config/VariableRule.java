package com.knowledgechat.perimeter.config;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.immutables.value.Value;

/**
 * How one environment variable is checked at boot.
 */
@Value.Immutable
public interface VariableRule {

  /**
   * Variable name.
   *
   * @return the string
   */
  String name();

  /**
   * What the variable is for, quoted in errors.
   *
   * @return the string
   */
  String description();

  /**
   * Required.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean required() {
    return false;
  }

  /**
   * Minimum length.
   *
   * @return the optional
   */
  Optional<Integer> minLength();

  /**
   * Pattern the whole value has to match.
   *
   * @return the optional
   */
  Optional<Pattern> pattern();

  /**
   * Allowed values; empty means anything.
   *
   * @return the list
   */
  List<String> allowedValues();

  /**
   * Value applied when an optional variable is absent.
   *
   * @return the optional
   */
  Optional<String> defaultValue();

  /**
   * Sensitive values are masked in logs and run through the weak value check.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean sensitive() {
    return false;
  }

  /**
   * A required variable with a default would never be reported missing.
   */
  @Value.Check
  default void check() {
    if (required() && defaultValue().isPresent()) {
      throw new IllegalStateException("Required variable cannot declare a default: " + name());
    }
  }
}
