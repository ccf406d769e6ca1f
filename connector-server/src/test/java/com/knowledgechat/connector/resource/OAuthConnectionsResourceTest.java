package com.knowledgechat.connector.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.knowledgechat.api.connections.v1.OAuthConnections;
import com.knowledgechat.connector.manager.CredentialManager;
import com.knowledgechat.connector.manager.OAuthFlowManager;
import com.knowledgechat.perimeter.model.SourceType;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import org.glassfish.jersey.client.ClientProperties;
import org.glassfish.jersey.test.grizzly.GrizzlyWebTestContainerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(DropwizardExtensionsSupport.class)
class OAuthConnectionsResourceTest {

  private static final OAuthFlowManager OAUTH_FLOW_MANAGER = mock(OAuthFlowManager.class);
  private static final CredentialManager CREDENTIAL_MANAGER = mock(CredentialManager.class);
  private static final ResourceExtension EXT = ResourceExtension.builder()
      .setTestContainerFactory(new GrizzlyWebTestContainerFactory())
      .addResource(new OAuthConnectionsResource(OAUTH_FLOW_MANAGER, CREDENTIAL_MANAGER))
      .build();

  private static final URI CONSENT = URI.create("https://accounts.google.com/o/oauth2/v2/auth?state=abc");
  private static final URI CONNECTED = URI.create("https://chat.example.com/sources?connected=gmail");

  @AfterEach
  void tearDown() {
    reset(OAUTH_FLOW_MANAGER, CREDENTIAL_MANAGER);
  }

  private static Invocation.Builder request(final WebTarget target) {
    return target.request().property(ClientProperties.FOLLOW_REDIRECTS, false);
  }

  @Test
  void initiate() {
    when(OAUTH_FLOW_MANAGER.initiate("user-1", "drive")).thenReturn(CONSENT);

    final Response response = request(EXT.target("/auth/google").queryParam("sourceType", "drive"))
        .header(OAuthConnections.USER_HEADER, "user-1")
        .get();

    assertThat(response.getStatus()).isEqualTo(302);
    assertThat(response.getLocation()).isEqualTo(CONSENT);
  }

  @Test
  void initiate_withoutUser() {
    final URI failed = URI.create("https://chat.example.com/sources?error=oauth_failed");
    when(OAUTH_FLOW_MANAGER.initiate(null, null)).thenReturn(failed);

    final Response response = request(EXT.target("/auth/google")).get();

    assertThat(response.getStatus()).isEqualTo(302);
    assertThat(response.getLocation()).isEqualTo(failed);
  }

  @Test
  void callback() {
    when(OAUTH_FLOW_MANAGER.complete("4/0AbCd", "state", null, null)).thenReturn(CONNECTED);

    final Response response = request(EXT.target("/auth/google/callback")
        .queryParam("code", "4/0AbCd")
        .queryParam("state", "state"))
        .get();

    assertThat(response.getStatus()).isEqualTo(302);
    assertThat(response.getLocation()).isEqualTo(CONNECTED);
  }

  @Test
  void callback_providerError() {
    final URI failed = URI.create("https://chat.example.com/sources?error=oauth_failed");
    when(OAUTH_FLOW_MANAGER.complete(null, "state", "access_denied", "denied")).thenReturn(failed);

    final Response response = request(EXT.target("/auth/google/callback")
        .queryParam("state", "state")
        .queryParam("error", "access_denied")
        .queryParam("error_description", "denied"))
        .get();

    assertThat(response.getStatus()).isEqualTo(302);
    assertThat(response.getLocation()).isEqualTo(failed);
  }

  @Test
  void disconnect() {
    when(CREDENTIAL_MANAGER.disconnect("user-1", SourceType.DRIVE)).thenReturn(true);

    final Response response = request(EXT.target("/v1/connections/drive"))
        .header(OAuthConnections.USER_HEADER, "user-1")
        .delete();

    assertThat(response.getStatus()).isEqualTo(204);
    verify(CREDENTIAL_MANAGER).disconnect("user-1", SourceType.DRIVE);
  }

  @Test
  void disconnect_nothingStored() {
    final Response response = request(EXT.target("/v1/connections/gmail"))
        .header(OAuthConnections.USER_HEADER, "user-1")
        .delete();

    assertThat(response.getStatus()).isEqualTo(404);
  }

  @Test
  void disconnect_unknownSourceType() {
    final Response response = request(EXT.target("/v1/connections/dropbox"))
        .header(OAuthConnections.USER_HEADER, "user-1")
        .delete();

    assertThat(response.getStatus()).isEqualTo(404);
    verifyNoInteractions(CREDENTIAL_MANAGER);
  }

  @Test
  void disconnect_withoutUser() {
    final Response response = request(EXT.target("/v1/connections/gmail")).delete();

    assertThat(response.getStatus()).isEqualTo(401);
    verifyNoInteractions(CREDENTIAL_MANAGER);
  }

  @Test
  void unknownPath() {
    assertThat(request(EXT.target("/v1/keys")).get().getStatus()).isEqualTo(404);
  }
}
