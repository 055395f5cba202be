package com.example.endpoints.service;

import com.example.endpoints.adapter.oauth.OAuthUserBackend;
import com.example.endpoints.adapter.oauth.OAuthUserBackend.OAuthUserInfo;
import com.example.endpoints.util.AuthorizationHeaderParser;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Authentication state of one in-flight request: its access token and the backend answer for
 * the most recently queried scope.
 * <p>
 * Holds at most one scope at a time. Querying a different scope drops the previous answer before
 * the backend is called, so a failed query leaves the context empty. Never shared across requests.
 */
public class OAuthRequestContext {

  private final String token;
  private final ReentrantLock lock = new ReentrantLock();

  private String cachedScope;
  private OAuthUserInfo cachedUser;

  public OAuthRequestContext(String token) {
    this.token = token == null ? "" : token;
  }

  public static OAuthRequestContext fromAuthorizationHeader(String authorizationHeader) {
    return new OAuthRequestContext(AuthorizationHeaderParser.extractToken(authorizationHeader));
  }

  public String token() {
    return token;
  }

  /**
   * Backend answer for {@code scope}, queried at most once while it stays the cached scope.
   */
  public OAuthUserInfo oauthUserInfo(String scope, OAuthUserBackend backend) {
    lock.lock();
    try {
      if (cachedUser != null && scope.equals(cachedScope)) {
        return cachedUser;
      }
      cachedScope = null;
      cachedUser = null;

      OAuthUserInfo user = backend.fetchOAuthUser(token, scope);
      cachedScope = scope;
      cachedUser = user;
      return user;
    } finally {
      lock.unlock();
    }
  }
}
