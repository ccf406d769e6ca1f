package com.knowledgechat.connector.exception;

/**
 * Nothing stored for the subject and source type.
 */
public class CredentialNotFoundException extends RuntimeException {

  /**
   * Instantiates a new Credential not found exception.
   *
   * @param message the message
   */
  public CredentialNotFoundException(final String message) {
    super(message);
  }
}
