package com.knowledgechat.connector.resource;

import com.knowledgechat.api.connections.v1.OAuthConnections;
import com.knowledgechat.connector.manager.CredentialManager;
import com.knowledgechat.connector.manager.OAuthFlowManager;
import com.knowledgechat.perimeter.model.SourceType;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The type OAuth connections resource.
 */
@Singleton
public class OAuthConnectionsResource implements OAuthConnections, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(OAuthConnectionsResource.class);

  private final OAuthFlowManager oauthFlowManager;
  private final CredentialManager credentialManager;

  /**
   * Instantiates a new OAuth connections resource.
   *
   * @param oauthFlowManager  the oauth flow manager
   * @param credentialManager the credential manager
   */
  @Inject
  public OAuthConnectionsResource(final OAuthFlowManager oauthFlowManager,
                                  final CredentialManager credentialManager) {
    LOGGER.info("OAuthConnectionsResource({},{})", oauthFlowManager, credentialManager);
    this.oauthFlowManager = oauthFlowManager;
    this.credentialManager = credentialManager;
  }

  @Override
  public Response initiate(final String userId, final String sourceType) {
    LOGGER.trace("initiate({}, {})", userId, sourceType);
    return found(oauthFlowManager.initiate(userId, sourceType));
  }

  @Override
  public Response callback(final String code,
                           final String state,
                           final String error,
                           final String errorDescription) {
    LOGGER.trace("callback()");
    return found(oauthFlowManager.complete(code, state, error, errorDescription));
  }

  @Override
  public Response disconnect(final String userId, final String sourceType) {
    LOGGER.trace("disconnect({}, {})", userId, sourceType);
    if (userId == null || userId.isBlank()) {
      return Response.status(Response.Status.UNAUTHORIZED).build();
    }
    final Optional<SourceType> type = SourceType.fromWireName(sourceType);
    if (type.isEmpty() || !credentialManager.disconnect(userId, type.get())) {
      return Response.status(Response.Status.NOT_FOUND).build();
    }
    return Response.noContent().build();
  }

  private Response found(final URI location) {
    return Response.status(Response.Status.FOUND).location(location).build();
  }
}
