package com.knowledgechat.perimeter.config;

/**
 * Ends the process. Replaced in tests.
 */
@FunctionalInterface
public interface ExitHandler {

  /**
   * Terminates the JVM with the status.
   */
  ExitHandler SYSTEM = System::exit;

  /**
   * Exit.
   *
   * @param status the status
   */
  void exit(int status);
}
