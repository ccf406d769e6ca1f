package com.knowledgechat.connector.exception;

import com.knowledgechat.perimeter.model.SourceType;

/**
 * The stored credential no longer works and has been removed. The user has to go through consent again.
 */
public class ReconnectRequiredException extends RuntimeException {

  private final SourceType sourceType;

  /**
   * Instantiates a new Reconnect required exception.
   *
   * @param sourceType the source type
   * @param cause      the cause
   */
  public ReconnectRequiredException(final SourceType sourceType, final Throwable cause) {
    super("Reconnect required for " + sourceType.wireName(), cause);
    this.sourceType = sourceType;
  }

  /**
   * Source type.
   *
   * @return the source type
   */
  public SourceType sourceType() {
    return sourceType;
  }
}
