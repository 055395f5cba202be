package com.example.endpoints.adapter.oauth;

import com.example.endpoints.adapter.oauth.dto.TokeninfoResponse;
import com.example.endpoints.exception.OAuthBackendException;
import com.example.endpoints.exception.OAuthBackendUnavailableException;
import com.example.endpoints.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

import static com.example.endpoints.util.AuthorizationHeaderParser.maskToken;

/**
 * Resolves access tokens through the tokeninfo API.
 * Intended for local and dev deployments.
 */
@Slf4j
@RequiredArgsConstructor
public class TokeninfoOAuthBackend implements OAuthUserBackend {

  private final ApplicationProperties properties;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  @Override
  @CircuitBreaker(name = "tokeninfo", fallbackMethod = "fetchOAuthUserFallback")
  public OAuthUserInfo fetchOAuthUser(String token, String scope) {
    if (token == null || token.isEmpty()) {
      throw new OAuthBackendException("No token found");
    }

    TokeninfoResponse tokeninfo = fetchTokeninfo(token);

    if (!ScopeList.grants(tokeninfo.scope(), scope)) {
      throw new OAuthBackendException(
          "No scope matches: expected %s, got \"%s\"".formatted(scope, tokeninfo.scope()));
    }

    return new OAuthUserInfo(
        tokeninfo.issuedTo(),
        tokeninfo.email(),
        tokeninfo.userId(),
        properties.auth().backend().authDomain(),
        false
    );
  }

  public OAuthUserInfo fetchOAuthUserFallback(String token, String scope, Throwable ex) {
    if (ex instanceof OAuthBackendException backendException) {
      throw backendException;
    }
    log.error("Tokeninfo backend unavailable while resolving scope {}", scope, ex);
    throw new OAuthBackendUnavailableException("Tokeninfo backend is temporarily unavailable", ex);
  }

  private TokeninfoResponse fetchTokeninfo(String token) {
    HttpUrl url = HttpUrl.get(properties.auth().backend().tokeninfoUri())
        .newBuilder()
        .addQueryParameter("access_token", token)
        .build();
    log.debug("Fetching token info for token {}", maskToken(token));

    Request request = new Request.Builder().url(url).get().build();

    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String payload = body != null ? body.string() : "";

      if (response.code() >= 500) {
        throw new OAuthBackendUnavailableException(
            "Error fetching tokeninfo (status %d)".formatted(response.code()));
      }

      TokeninfoResponse tokeninfo = decode(payload);
      if (response.code() != 200) {
        String message = "Error fetching tokeninfo (status %d)".formatted(response.code());
        if (tokeninfo.errorDescription() != null && !tokeninfo.errorDescription().isEmpty()) {
          message += ": " + tokeninfo.errorDescription();
        }
        throw new OAuthBackendException(message);
      }

      if (tokeninfo.expiresIn() <= 0) {
        throw new OAuthBackendException("Token is expired");
      }
      if (!tokeninfo.verifiedEmail()) {
        throw new OAuthBackendException("Unverified email \"%s\"".formatted(tokeninfo.email()));
      }
      if (tokeninfo.email() == null || tokeninfo.email().isEmpty()) {
        throw new OAuthBackendException("Invalid email address");
      }
      return tokeninfo;

    } catch (IOException e) {
      throw new OAuthBackendUnavailableException("Tokeninfo request failed due to network error", e);
    }
  }

  private TokeninfoResponse decode(String payload) {
    try {
      TokeninfoResponse tokeninfo = objectMapper.readValue(payload, TokeninfoResponse.class);
      if (tokeninfo == null) {
        throw new OAuthBackendException("Empty tokeninfo response");
      }
      return tokeninfo;
    } catch (JsonProcessingException e) {
      throw new OAuthBackendException("Unreadable tokeninfo response", e);
    }
  }
}
