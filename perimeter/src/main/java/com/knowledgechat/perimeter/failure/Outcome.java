package com.knowledgechat.perimeter.failure;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a {@link PerimeterFailure}. Perimeter operations return this so callers have to deal
 * with every failure kind instead of relying on an exception escaping.
 *
 * @param <T> the value type
 */
public final class Outcome<T> {

  private final T value;
  private final PerimeterFailure failure;

  private Outcome(final T value, final PerimeterFailure failure) {
    this.value = value;
    this.failure = failure;
  }

  /**
   * Success outcome.
   *
   * @param value the value
   * @param <T>   the type
   * @return the outcome
   */
  public static <T> Outcome<T> success(final T value) {
    return new Outcome<>(Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Failure outcome.
   *
   * @param failure the failure
   * @param <T>     the type
   * @return the outcome
   */
  public static <T> Outcome<T> failure(final PerimeterFailure failure) {
    return new Outcome<>(null, Objects.requireNonNull(failure, "failure"));
  }

  /**
   * Failure outcome.
   *
   * @param kind   the kind
   * @param detail the detail
   * @param <T>    the type
   * @return the outcome
   */
  public static <T> Outcome<T> failure(final FailureKind kind, final String detail) {
    return failure(PerimeterFailure.of(kind, detail));
  }

  /**
   * Is success.
   *
   * @return the boolean
   */
  public boolean isSuccess() {
    return failure == null;
  }

  /**
   * The value.
   *
   * @return the value
   * @throws IllegalStateException if this is a failure.
   */
  public T value() {
    if (failure != null) {
      throw new IllegalStateException("No value on a failed outcome: " + failure.kind());
    }
    return value;
  }

  /**
   * The failure.
   *
   * @return the failure
   * @throws IllegalStateException if this is a success.
   */
  public PerimeterFailure failure() {
    if (failure == null) {
      throw new IllegalStateException("No failure on a successful outcome");
    }
    return failure;
  }

  /**
   * The failure kind, empty on success.
   *
   * @return the optional
   */
  public Optional<FailureKind> failureKind() {
    return Optional.ofNullable(failure).map(PerimeterFailure::kind);
  }

  /**
   * Map the value, passing failures through.
   *
   * @param mapper the mapper
   * @param <R>    the result type
   * @return the outcome
   */
  public <R> Outcome<R> map(final Function<? super T, ? extends R> mapper) {
    if (failure != null) {
      return failure(failure);
    }
    return success(mapper.apply(value));
  }

  /**
   * Chain another perimeter operation, passing failures through.
   *
   * @param mapper the mapper
   * @param <R>    the result type
   * @return the outcome
   */
  public <R> Outcome<R> flatMap(final Function<? super T, Outcome<R>> mapper) {
    if (failure != null) {
      return failure(failure);
    }
    return mapper.apply(value);
  }

  /**
   * Collapse into a single result.
   *
   * @param onSuccess applied to the value
   * @param onFailure applied to the failure
   * @param <R>       the result type
   * @return the result
   */
  public <R> R fold(final Function<? super T, ? extends R> onSuccess,
                    final Function<PerimeterFailure, ? extends R> onFailure) {
    return failure == null ? onSuccess.apply(value) : onFailure.apply(failure);
  }

  /**
   * The value, or a {@link PerimeterException} carrying the failure kind.
   *
   * @return the value
   */
  public T orElseThrow() {
    if (failure != null) {
      throw new PerimeterException(failure);
    }
    return value;
  }

  @Override
  public String toString() {
    return failure == null ? "Outcome{success}" : "Outcome{" + failure.kind() + "}";
  }
}
