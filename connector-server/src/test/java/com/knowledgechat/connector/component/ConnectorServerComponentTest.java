package com.knowledgechat.connector.component;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.knowledgechat.connector.ConnectorFixtures;
import com.knowledgechat.connector.exception.CredentialNotFoundException;
import com.knowledgechat.connector.manager.CredentialManager;
import com.knowledgechat.connector.model.ImmutableProviderTokens;
import com.knowledgechat.connector.resource.OAuthConnectionsResource;
import com.knowledgechat.perimeter.model.SourceType;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ConnectorServerComponentTest {

  @Test
  void assemble() {
    final ConnectorServerComponent component = ConnectorServerComponent.instance(
        ConnectorFixtures.configuration(getClass().getSimpleName()));

    assertThat(component.resources())
        .singleElement()
        .isInstanceOf(OAuthConnectionsResource.class);

    final CredentialManager credentialManager = component.credentialManager();
    assertThat(credentialManager).isSameAs(component.credentialManager());

    credentialManager.store("user-1", SourceType.GMAIL, ImmutableProviderTokens.builder()
        .accessToken("ya29.access")
        .refreshToken("1//refresh")
        .expiresAt(Instant.now().plusSeconds(3600))
        .scope("https://www.googleapis.com/auth/gmail.readonly")
        .build());
    assertThat(credentialManager.accessToken("user-1", SourceType.GMAIL)).isEqualTo("ya29.access");
    assertThatExceptionOfType(CredentialNotFoundException.class)
        .isThrownBy(() -> credentialManager.accessToken("user-1", SourceType.DRIVE));

    assertThat(credentialManager.disconnect("user-1", SourceType.GMAIL)).isTrue();
    assertThat(credentialManager.disconnect("user-1", SourceType.GMAIL)).isFalse();
  }
}
