package com.knowledgechat.perimeter.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SourceTypeTest {

  @Test
  void fromWireName() {
    assertThat(SourceType.fromWireName("gmail")).contains(SourceType.GMAIL);
    assertThat(SourceType.fromWireName("drive")).contains(SourceType.DRIVE);
    assertThat(SourceType.fromWireName("GMAIL")).isEmpty();
    assertThat(SourceType.fromWireName("dropbox")).isEmpty();
    assertThat(SourceType.fromWireName(null)).isEmpty();
  }

  @Test
  void defaultIsGmail() {
    assertThat(SourceType.DEFAULT).isEqualTo(SourceType.GMAIL);
  }

  @Test
  void secretsFromEnvironment() {
    final PerimeterSecrets secrets = PerimeterSecrets.fromEnvironment(Map.of("JWT_SECRET", "signing-secret-value"));
    assertThat(secrets.hasSigningSecret()).isTrue();
    assertThat(secrets.hasEncryptionSecret()).isFalse();
    assertThat(secrets.toString()).doesNotContain("signing-secret-value");
  }
}
