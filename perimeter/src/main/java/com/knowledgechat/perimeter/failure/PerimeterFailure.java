package com.knowledgechat.perimeter.failure;

import org.immutables.value.Value;

/**
 * A failure kind plus server-side detail. The detail is for logs only.
 */
@Value.Immutable
public interface PerimeterFailure {

  /**
   * Of perimeter failure.
   *
   * @param kind   the kind
   * @param detail the detail
   * @return the perimeter failure
   */
  static PerimeterFailure of(final FailureKind kind, final String detail) {
    return ImmutablePerimeterFailure.builder().kind(kind).detail(detail).build();
  }

  /**
   * Kind.
   *
   * @return the failure kind
   */
  FailureKind kind();

  /**
   * Detail.
   *
   * @return the string
   */
  String detail();
}
