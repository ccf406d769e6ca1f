package com.knowledgechat.perimeter.failure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import org.junit.jupiter.api.Test;

class OutcomeTest {

  @Test
  void success() {
    final Outcome<String> outcome = Outcome.success("value");
    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.value()).isEqualTo("value");
    assertThat(outcome.failureKind()).isEmpty();
    assertThat(outcome.orElseThrow()).isEqualTo("value");
    assertThatExceptionOfType(IllegalStateException.class).isThrownBy(outcome::failure);
  }

  @Test
  void failure() {
    final Outcome<String> outcome = Outcome.failure(FailureKind.EXPIRED, "too old");
    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.failure().detail()).isEqualTo("too old");
    assertThat(outcome.failureKind()).contains(FailureKind.EXPIRED);
    assertThatExceptionOfType(IllegalStateException.class).isThrownBy(outcome::value);
    assertThatExceptionOfType(PerimeterException.class)
        .isThrownBy(outcome::orElseThrow)
        .satisfies(e -> assertThat(e.kind()).isEqualTo(FailureKind.EXPIRED));
  }

  @Test
  void mapAndFlatMap() {
    assertThat(Outcome.success("abc").map(String::length).value()).isEqualTo(3);
    assertThat(Outcome.success("abc")
        .flatMap(v -> Outcome.<Integer>failure(FailureKind.FORMAT, "nope"))
        .failureKind()).contains(FailureKind.FORMAT);
    final Outcome<String> failed = Outcome.failure(FailureKind.AUTHENTICATION, "bad tag");
    assertThat(failed.map(String::length).failureKind()).contains(FailureKind.AUTHENTICATION);
    assertThat(failed.flatMap(v -> Outcome.success(1)).failureKind()).contains(FailureKind.AUTHENTICATION);
  }

  @Test
  void fold() {
    assertThat(Outcome.success("a").<String>fold(v -> "ok " + v, f -> "no")).isEqualTo("ok a");
    assertThat(Outcome.<String>failure(FailureKind.VALIDATION, "x").<String>fold(v -> "ok", f -> f.kind().name()))
        .isEqualTo("VALIDATION");
  }

  @Test
  void toString_hidesValue() {
    assertThat(Outcome.success("ya29.secret").toString()).doesNotContain("ya29");
  }

  @Test
  void integrityFailures() {
    assertThat(FailureKind.SIGNATURE_MISMATCH.isIntegrityFailure()).isTrue();
    assertThat(FailureKind.AUTHENTICATION.isIntegrityFailure()).isTrue();
    assertThat(FailureKind.EXPIRED.isIntegrityFailure()).isFalse();
    assertThat(FailureKind.INVALID_STATE.isIntegrityFailure()).isFalse();
  }
}
