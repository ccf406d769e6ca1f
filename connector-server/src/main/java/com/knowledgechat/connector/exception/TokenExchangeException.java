package com.knowledgechat.connector.exception;

/**
 * The provider's token endpoint could not be reached or refused the request.
 */
public class TokenExchangeException extends RuntimeException {

  /**
   * Instantiates a new Token exchange exception.
   *
   * @param message the message
   */
  public TokenExchangeException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Token exchange exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TokenExchangeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
