package com.knowledgechat.perimeter.failure;

/**
 * Thrown when a perimeter failure is propagated instead of handled.
 */
public class PerimeterException extends RuntimeException {

  private final FailureKind kind;

  /**
   * Instantiates a new Perimeter exception.
   *
   * @param failure the failure
   */
  public PerimeterException(final PerimeterFailure failure) {
    super(failure.kind() + ": " + failure.detail());
    this.kind = failure.kind();
  }

  /**
   * Instantiates a new Perimeter exception.
   *
   * @param kind    the kind
   * @param message the message
   */
  public PerimeterException(final FailureKind kind, final String message) {
    super(kind + ": " + message);
    this.kind = kind;
  }

  /**
   * Kind.
   *
   * @return the failure kind
   */
  public FailureKind kind() {
    return kind;
  }
}
