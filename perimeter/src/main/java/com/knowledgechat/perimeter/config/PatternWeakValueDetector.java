package com.knowledgechat.perimeter.config;

import java.util.List;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Flags placeholders ("your-key-here"), bare words ("secret") and short all-letter values.
 *
 * <p>This over-flags some real secrets that happen to start with a flagged prefix and misses weak values
 * that dodge the patterns. Tightening it needs a policy decision, not a code change.</p>
 */
@Singleton
public class PatternWeakValueDetector implements WeakValueDetector {

  private static final List<Pattern> WEAK_PATTERNS = List.of(
      Pattern.compile("^(your|my|test|demo|example|change|replace|update|set|add)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^(secret|password|key|token)$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^(123|abc|qwerty|admin|root)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^[a-z]{1,10}$", Pattern.CASE_INSENSITIVE)
  );

  /**
   * Instantiates a new Pattern weak value detector.
   */
  @Inject
  public PatternWeakValueDetector() {
  }

  @Override
  public boolean isWeak(final String value) {
    return WEAK_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(value).find());
  }
}
