package com.knowledgechat.perimeter.config;

/**
 * Decides whether a sensitive value looks like a placeholder or is too easy to guess. Best effort only.
 */
@FunctionalInterface
public interface WeakValueDetector {

  /**
   * Is weak.
   *
   * @param value the value, never null
   * @return true if the value should be replaced
   */
  boolean isWeak(String value);
}
