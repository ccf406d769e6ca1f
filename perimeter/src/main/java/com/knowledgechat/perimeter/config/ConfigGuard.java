package com.knowledgechat.perimeter.config;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the process environment against a {@link ConfigPolicy} once, before the service binds a port.
 * A failed check ends the process; there is no degraded mode.
 */
public class ConfigGuard {

  /**
   * Shown for variables with no value.
   */
  public static final String NOT_SET = "[not set]";

  private static final Logger log = LoggerFactory.getLogger(ConfigGuard.class);
  private static final int MASK_VISIBLE = 4;
  private static final int MASK_MIN_LENGTH = 12;

  private final ConfigPolicy policy;
  private final Map<String, String> environment;
  private final WeakValueDetector weakValueDetector;
  private final SecretGenerator secretGenerator;
  private final ExitHandler exitHandler;

  private ConfigReport report;

  /**
   * Guard with the standard weak value check, suggestion generator and {@link System#exit(int)}.
   *
   * @param policy      the policy
   * @param environment the process environment
   */
  public ConfigGuard(final ConfigPolicy policy, final Map<String, String> environment) {
    this(policy, environment, new PatternWeakValueDetector(), new SecretGenerator(new SecureRandom()),
        ExitHandler.SYSTEM);
  }

  /**
   * Instantiates a new Config guard.
   *
   * @param policy            the policy
   * @param environment       the process environment
   * @param weakValueDetector the weak value detector
   * @param secretGenerator   the secret generator
   * @param exitHandler       the exit handler
   */
  public ConfigGuard(final ConfigPolicy policy,
                     final Map<String, String> environment,
                     final WeakValueDetector weakValueDetector,
                     final SecretGenerator secretGenerator,
                     final ExitHandler exitHandler) {
    log.info("ConfigGuard({} rules, {} variables in environment)", policy.rules().size(), environment.size());
    this.policy = policy;
    this.environment = Map.copyOf(environment);
    this.weakValueDetector = weakValueDetector;
    this.secretGenerator = secretGenerator;
    this.exitHandler = exitHandler;
  }

  /**
   * Validate the environment. Evaluated on the first call only; later calls return the same report.
   *
   * @return the config report
   */
  public synchronized ConfigReport validate() {
    if (report == null) {
      report = evaluate();
    }
    return report;
  }

  /**
   * Validate, log a redacted report and exit with status 1 on any error.
   *
   * @return the report, only when it is valid (unless the exit handler returns).
   */
  public ConfigReport validateOrExit() {
    final ConfigReport result = validate();
    logReport(result);
    if (!result.valid()) {
      log.error("Fix the environment variables listed above before starting the service");
      exitHandler.exit(1);
    }
    return result;
  }

  /**
   * Display form of a variable for logs. Never use it for a security decision.
   *
   * @param name the variable
   * @return {@value #NOT_SET}, the value, or a masked value for sensitive variables
   */
  public String maskForDisplay(final String name) {
    final Optional<VariableRule> rule = policy.rule(name);
    final Optional<String> value = value(name).or(() -> rule.flatMap(VariableRule::defaultValue));
    if (value.isEmpty()) {
      return NOT_SET;
    }
    if (rule.map(VariableRule::sensitive).orElse(false)) {
      return mask(value.get());
    }
    return value.get();
  }

  /**
   * Every policy variable in policy order, sensitive ones masked.
   *
   * @return the map
   */
  public Map<String, String> safeEnvironmentInfo() {
    final Map<String, String> info = new LinkedHashMap<>();
    policy.rules().forEach(rule -> info.put(rule.name(), maskForDisplay(rule.name())));
    return info;
  }

  private ConfigReport evaluate() {
    log.trace("evaluate()");
    final ImmutableConfigReport.Builder builder = ImmutableConfigReport.builder();
    final Map<String, String> resolved = new LinkedHashMap<>();
    for (VariableRule rule : policy.rules()) {
      final Optional<String> value = value(rule.name());
      if (value.isEmpty()) {
        if (rule.required()) {
          builder.addErrors(ConfigIssue.of(rule.name(), rule.name() + " is required. " + rule.description()));
        } else {
          rule.defaultValue().ifPresent(defaultValue -> resolved.put(rule.name(), defaultValue));
        }
        continue;
      }
      resolved.put(rule.name(), value.get());
      check(rule, value.get()).ifPresent(builder::addErrors);
    }
    builder.addAllWarnings(productionWarnings(resolved));
    return builder.resolved(resolved).build();
  }

  private Optional<ConfigIssue> check(final VariableRule rule, final String value) {
    final String name = rule.name();
    if (rule.minLength().isPresent() && value.length() < rule.minLength().get()) {
      return Optional.of(ConfigIssue.of(name, name + " must be at least " + rule.minLength().get() + " characters long"));
    }
    if (rule.pattern().isPresent() && !rule.pattern().get().matcher(value).find()) {
      return Optional.of(ConfigIssue.of(name, name + " has invalid format. " + rule.description()));
    }
    if (!rule.allowedValues().isEmpty() && !rule.allowedValues().contains(value)) {
      return Optional.of(ConfigIssue.of(name, name + " must be one of: " + String.join(", ", rule.allowedValues())));
    }
    if (rule.sensitive() && weakValueDetector.isWeak(value)) {
      return Optional.of(ImmutableConfigIssue.builder()
          .variable(name)
          .message(name + " appears to be a weak/default value. Please use a strong random string.")
          .suggestion(secretGenerator.generate())
          .build());
    }
    return Optional.empty();
  }

  private List<ConfigIssue> productionWarnings(final Map<String, String> resolved) {
    final List<ConfigIssue> warnings = new ArrayList<>();
    if (!policy.productionValue().equals(resolved.get(policy.environmentVariable()))) {
      return warnings;
    }
    for (String name : policy.productionUrlVariables()) {
      final String value = resolved.get(name);
      if (value != null && policy.developmentHosts().stream().anyMatch(value::contains)) {
        warnings.add(ConfigIssue.of(name, name + " contains development URL in production environment"));
      }
    }
    return warnings;
  }

  private void logReport(final ConfigReport result) {
    if (result.valid()) {
      log.info("Environment variables validated successfully");
    } else {
      log.error("Environment validation failed:");
      for (ConfigIssue error : result.errors()) {
        log.error("  - {}: {}", error.variable(), error.message());
        error.suggestion().ifPresent(suggestion ->
            log.error("    Suggestion: generate a secure value, for example {}", suggestion));
      }
    }
    for (ConfigIssue warning : result.warnings()) {
      log.warn("  - {}: {}", warning.variable(), warning.message());
    }
    safeEnvironmentInfo().forEach((name, display) -> log.info("  {}={}", name, display));
  }

  private Optional<String> value(final String name) {
    return Optional.ofNullable(environment.get(name)).filter(value -> !value.isEmpty());
  }

  private static String mask(final String value) {
    if (value.length() > MASK_MIN_LENGTH) {
      return value.substring(0, MASK_VISIBLE) + "..." + value.substring(value.length() - MASK_VISIBLE);
    }
    return "***";
  }
}
