package com.knowledgechat.connector.client;

import com.knowledgechat.connector.model.ProviderTokens;
import java.net.URI;

/**
 * The OAuth provider's side of the flow.
 */
public interface TokenExchangeClient {

  /**
   * Consent page url carrying the state token.
   *
   * @param state the state token
   * @return the uri
   */
  URI authorizationUrl(String state);

  /**
   * Exchange an authorization code.
   *
   * @param code the code from the callback
   * @return the tokens
   * @throws com.knowledgechat.connector.exception.TokenExchangeException if the provider refused.
   */
  ProviderTokens exchangeCode(String code);

  /**
   * Get a new access token.
   *
   * @param refreshToken the decrypted refresh token
   * @return the tokens, usually without a refresh token
   * @throws com.knowledgechat.connector.exception.InvalidGrantException if the refresh token is dead.
   */
  ProviderTokens refresh(String refreshToken);

}
