package com.example.endpoints.adapter.oauth;

import com.example.endpoints.exception.OAuthBackendException;

/**
 * Authorization backend that resolves an opaque access token for one scope.
 */
public interface OAuthUserBackend {

  /**
   * Looks up the client and user an access token was issued to, for the given scope.
   *
   * @throws OAuthBackendException if the token is not valid for the scope or the backend fails
   */
  OAuthUserInfo fetchOAuthUser(String token, String scope);

  /**
   * Backend answer for one scope. A client ID the backend did not report is empty.
   */
  record OAuthUserInfo(
      String clientId,
      String email,
      String userId,
      String authDomain,
      boolean admin
  ) {

    public OAuthUserInfo {
      clientId = clientId == null ? "" : clientId;
    }
  }
}
