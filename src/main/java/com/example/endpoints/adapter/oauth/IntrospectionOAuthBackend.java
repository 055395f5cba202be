package com.example.endpoints.adapter.oauth;

import com.example.endpoints.adapter.oauth.dto.IntrospectionResponse;
import com.example.endpoints.exception.OAuthBackendException;
import com.example.endpoints.exception.OAuthBackendUnavailableException;
import com.example.endpoints.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

import static com.example.endpoints.util.AuthorizationHeaderParser.maskToken;

/**
 * Resolves access tokens through an RFC 7662 introspection endpoint, authenticating with the
 * configured client credentials. Used by hosted deployments.
 */
@Slf4j
@RequiredArgsConstructor
public class IntrospectionOAuthBackend implements OAuthUserBackend {

  private static final String TOKEN_TYPE_HINT = "access_token";

  private final ApplicationProperties properties;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  @Override
  @CircuitBreaker(name = "introspection", fallbackMethod = "fetchOAuthUserFallback")
  public OAuthUserInfo fetchOAuthUser(String token, String scope) {
    if (token == null || token.isEmpty()) {
      throw new OAuthBackendException("No token found");
    }
    ApplicationProperties.AuthProperties.BackendProperties backend = properties.auth().backend();
    log.debug("Introspecting token {} for scope {}", maskToken(token), scope);

    FormBody formBody = new FormBody.Builder()
        .add("token", token)
        .add("token_type_hint", TOKEN_TYPE_HINT)
        .build();

    Request request = new Request.Builder()
        .url(backend.introspectionUri())
        .header("Authorization", Credentials.basic(backend.clientId(), backend.clientSecret()))
        .header("Accept", "application/json")
        .post(formBody)
        .build();

    IntrospectionResponse introspection;
    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() >= 500) {
        throw new OAuthBackendUnavailableException(
            "Introspection failed, status: " + response.code());
      }
      if (!response.isSuccessful() || response.body() == null) {
        throw new OAuthBackendException("Introspection rejected, status: " + response.code());
      }
      introspection = decode(response.body().string());
    } catch (IOException e) {
      throw new OAuthBackendUnavailableException("Introspection failed due to network error", e);
    }

    if (!introspection.active()) {
      throw new OAuthBackendException("Token is not active");
    }
    if (!ScopeList.grants(introspection.scope(), scope)) {
      throw new OAuthBackendException(
          "No scope matches: expected %s, got \"%s\"".formatted(scope, introspection.scope()));
    }
    String email = introspection.email() != null && !introspection.email().isEmpty()
        ? introspection.email()
        : introspection.username();
    if (email == null || email.isEmpty()) {
      throw new OAuthBackendException("Invalid email address");
    }

    return new OAuthUserInfo(
        introspection.clientId(),
        email,
        introspection.subject(),
        backend.authDomain(),
        introspection.admin()
    );
  }

  public OAuthUserInfo fetchOAuthUserFallback(String token, String scope, Throwable ex) {
    if (ex instanceof OAuthBackendException backendException) {
      throw backendException;
    }
    log.error("Introspection backend unavailable while resolving scope {}", scope, ex);
    throw new OAuthBackendUnavailableException("Introspection backend is temporarily unavailable", ex);
  }

  private IntrospectionResponse decode(String payload) {
    try {
      IntrospectionResponse introspection = objectMapper.readValue(payload, IntrospectionResponse.class);
      if (introspection == null) {
        throw new OAuthBackendException("Empty introspection response");
      }
      return introspection;
    } catch (JsonProcessingException e) {
      throw new OAuthBackendException("Unreadable introspection response", e);
    }
  }
}
