package com.example.endpoints.service;

import com.example.endpoints.adapter.oauth.OAuthUserBackend;
import com.example.endpoints.adapter.oauth.OAuthUserBackend.OAuthUserInfo;
import com.example.endpoints.domain.entity.AuthenticatedIdentity;
import com.example.endpoints.exception.AuthError;
import com.example.endpoints.exception.AuthenticationFailedException;
import com.example.endpoints.exception.OAuthBackendException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Resolves an opaque access token to the scope it is valid for and the user it was issued to.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessTokenResolver {

  private final OAuthUserBackend backend;

  /**
   * Finds the first of {@code scopes} the token is valid for.
   *
   * @throws AuthenticationFailedException {@link AuthError#MISMATCHED_CLIENT_ID} if that scope was
   * granted to a client outside {@code clientIds}, {@link AuthError#NO_VALID_SCOPE} if no scope
   * resolves
   */
  public ScopeMatch resolveScope(OAuthRequestContext context, List<String> scopes, Set<String> clientIds) {
    for (String scope : scopes) {
      String clientId;
      try {
        clientId = context.oauthUserInfo(scope, backend).clientId();
      } catch (OAuthBackendException e) {
        log.debug("Token not valid for scope {}: {}", scope, e.getMessage());
        continue;
      }

      if (clientId.isEmpty() || !clientIds.contains(clientId)) {
        log.warn("Client ID {} not in allowed client IDs for scope {}", clientId, scope);
        throw new AuthenticationFailedException(
            AuthError.MISMATCHED_CLIENT_ID, "Mismatched client ID: " + clientId);
      }
      return new ScopeMatch(scope, clientId);
    }
    throw new AuthenticationFailedException(AuthError.NO_VALID_SCOPE, "No valid scope");
  }

  public AuthenticatedIdentity resolveUser(OAuthRequestContext context, String scope) {
    OAuthUserInfo user;
    try {
      user = context.oauthUserInfo(scope, backend);
    } catch (OAuthBackendException e) {
      throw new AuthenticationFailedException(
          AuthError.NO_VALID_SCOPE, "Could not resolve user for scope " + scope, e);
    }
    return new AuthenticatedIdentity(
        user.email(), user.userId(), user.authDomain(), user.admin(), user.clientId());
  }

  public record ScopeMatch(String scope, String clientId) {}
}
