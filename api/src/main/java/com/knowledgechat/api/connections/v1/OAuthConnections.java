package com.knowledgechat.api.connections.v1;

import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Response;

/**
 * Connecting and disconnecting a user's Google integrations. The user is identified by the
 * {@value #USER_HEADER} header, set by the session layer in front of this service.
 */
@Path("/")
public interface OAuthConnections {

  /**
   * Header carrying the authenticated user id.
   */
  String USER_HEADER = "X-User-Id";

  /**
   * Start the consent flow. Always answers with a redirect: to the provider's consent page, or back to
   * the frontend with an error reason.
   *
   * @param userId     the user, from the session layer.
   * @param sourceType gmail or drive; absent means gmail.
   * @return the redirect.
   */
  @GET
  @Path("/auth/google")
  Response initiate(@HeaderParam(USER_HEADER) final String userId,
                    @QueryParam("sourceType") final String sourceType);

  /**
   * Provider redirect target. Every failure ends in the same generic redirect.
   *
   * @param code             authorization code.
   * @param state            the state token minted by {@link #initiate(String, String)}.
   * @param error            provider error, if the user declined.
   * @param errorDescription provider error description.
   * @return the redirect to the frontend.
   */
  @GET
  @Path("/auth/google/callback")
  Response callback(@QueryParam("code") final String code,
                    @QueryParam("state") final String state,
                    @QueryParam("error") final String error,
                    @QueryParam("error_description") final String errorDescription);

  /**
   * Remove the stored credential for an integration.
   *
   * @param userId     the user, from the session layer.
   * @param sourceType gmail or drive.
   * @return 204, or 404 when nothing was stored.
   */
  @DELETE
  @Path("/v1/connections/{sourceType}")
  Response disconnect(@HeaderParam(USER_HEADER) final String userId,
                      @PathParam("sourceType") final String sourceType);

}
