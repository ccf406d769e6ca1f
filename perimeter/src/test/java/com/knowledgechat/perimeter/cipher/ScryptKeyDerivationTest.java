package com.knowledgechat.perimeter.cipher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import org.junit.jupiter.api.Test;

class ScryptKeyDerivationTest {

  private final ScryptKeyDerivation derivation = new ScryptKeyDerivation();

  @Test
  void deriveKey_isStable() {
    final byte[] first = derivation.deriveKey("a-long-enough-deployment-secret-0001");
    final byte[] second = derivation.deriveKey("a-long-enough-deployment-secret-0001");
    assertThat(first).hasSize(derivation.keyLength()).isEqualTo(second);
  }

  @Test
  void deriveKey_differsPerSecret() {
    assertThat(derivation.deriveKey("a-long-enough-deployment-secret-0001"))
        .isNotEqualTo(derivation.deriveKey("a-long-enough-deployment-secret-0002"));
  }

  @Test
  void deriveKey_empty() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> derivation.deriveKey(""));
  }
}
