package com.knowledgechat.connector.exception;

/**
 * The provider answered invalid_grant: the refresh token was revoked or has expired.
 */
public class InvalidGrantException extends TokenExchangeException {

  /**
   * Instantiates a new Invalid grant exception.
   *
   * @param message the message
   */
  public InvalidGrantException(final String message) {
    super(message);
  }
}
