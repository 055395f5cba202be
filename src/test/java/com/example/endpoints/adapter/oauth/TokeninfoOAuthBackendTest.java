package com.example.endpoints.adapter.oauth;

import com.example.endpoints.TestProperties;
import com.example.endpoints.adapter.oauth.OAuthUserBackend.OAuthUserInfo;
import com.example.endpoints.exception.OAuthBackendException;
import com.example.endpoints.exception.OAuthBackendUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokeninfoOAuthBackendTest {

  private static final String SCOPE = "https://www.googleapis.com/auth/userinfo.email";
  private static final String VALID_TOKENINFO = """
      {
        "issued_to": "my-client-id",
        "audience": "my-client-id",
        "user_id": "1234567890",
        "scope": "openid https://www.googleapis.com/auth/userinfo.email",
        "expires_in": 3599,
        "email": "dude@gmail.com",
        "verified_email": true,
        "access_type": "online"
      }
      """;

  private MockWebServer server;
  private TokeninfoOAuthBackend backend;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    backend = new TokeninfoOAuthBackend(
        TestProperties.builder().tokeninfo(server.url("/oauth2/v2/tokeninfo").toString()).build(),
        new OkHttpClient(),
        new ObjectMapper());
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void shouldResolveUserForGrantedScope() throws InterruptedException {
    server.enqueue(new MockResponse().setBody(VALID_TOKENINFO));

    OAuthUserInfo user = backend.fetchOAuthUser("ya29.token", SCOPE);

    assertThat(user).isEqualTo(new OAuthUserInfo("my-client-id", "dude@gmail.com", "1234567890", "gmail.com", false));
    RecordedRequest request = server.takeRequest();
    assertThat(request.getMethod()).isEqualTo("GET");
    assertThat(request.getRequestUrl().queryParameter("access_token")).isEqualTo("ya29.token");
  }

  @Test
  void shouldReportMissingIssuedToAsEmptyClientId() {
    server.enqueue(new MockResponse().setBody(
        VALID_TOKENINFO.replace("\"issued_to\": \"my-client-id\",", "")));

    assertThat(backend.fetchOAuthUser("ya29.token", SCOPE).clientId()).isEmpty();
  }

  @Test
  void shouldRejectScopeNotGranted() {
    server.enqueue(new MockResponse().setBody(VALID_TOKENINFO));

    assertThatThrownBy(() -> backend.fetchOAuthUser("ya29.token", "https://example.com/other"))
        .isInstanceOf(OAuthBackendException.class)
        .hasMessageContaining("No scope matches");
  }

  @Test
  void shouldRejectPartialScopeMatch() {
    server.enqueue(new MockResponse().setBody(VALID_TOKENINFO));

    assertThatThrownBy(() -> backend.fetchOAuthUser("ya29.token", "openid https"))
        .isInstanceOf(OAuthBackendException.class);
  }

  @Test
  void shouldIncludeErrorDescriptionOnFailure() {
    server.enqueue(new MockResponse().setResponseCode(400)
                       .setBody("{\"error_description\": \"Invalid Value\"}"));

    assertThatThrownBy(() -> backend.fetchOAuthUser("bad", SCOPE))
        .isInstanceOf(OAuthBackendException.class)
        .isNotInstanceOf(OAuthBackendUnavailableException.class)
        .hasMessage("Error fetching tokeninfo (status 400): Invalid Value");
  }

  @Test
  void shouldRejectExpiredToken() {
    server.enqueue(new MockResponse().setBody(VALID_TOKENINFO.replace("3599", "0")));

    assertThatThrownBy(() -> backend.fetchOAuthUser("ya29.token", SCOPE))
        .isInstanceOf(OAuthBackendException.class)
        .hasMessage("Token is expired");
  }

  @Test
  void shouldRejectUnverifiedEmail() {
    server.enqueue(new MockResponse().setBody(
        VALID_TOKENINFO.replace("\"verified_email\": true", "\"verified_email\": false")));

    assertThatThrownBy(() -> backend.fetchOAuthUser("ya29.token", SCOPE))
        .isInstanceOf(OAuthBackendException.class)
        .hasMessageContaining("Unverified email");
  }

  @Test
  void shouldRejectMissingEmail() {
    server.enqueue(new MockResponse().setBody(
        VALID_TOKENINFO.replace("\"email\": \"dude@gmail.com\"", "\"email\": \"\"")));

    assertThatThrownBy(() -> backend.fetchOAuthUser("ya29.token", SCOPE))
        .isInstanceOf(OAuthBackendException.class)
        .hasMessage("Invalid email address");
  }

  @Test
  void shouldRejectNullResponseBody() {
    server.enqueue(new MockResponse().setBody("null"));

    assertThatThrownBy(() -> backend.fetchOAuthUser("ya29.token", SCOPE))
        .isInstanceOf(OAuthBackendException.class)
        .isNotInstanceOf(OAuthBackendUnavailableException.class)
        .hasMessage("Empty tokeninfo response");
  }

  @Test
  void shouldRejectEmptyTokenWithoutCallingBackend() {
    assertThatThrownBy(() -> backend.fetchOAuthUser("", SCOPE))
        .isInstanceOf(OAuthBackendException.class)
        .hasMessage("No token found");
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void shouldReportServerErrorsAsUnavailable() {
    server.enqueue(new MockResponse().setResponseCode(502));

    assertThatThrownBy(() -> backend.fetchOAuthUser("ya29.token", SCOPE))
        .isInstanceOf(OAuthBackendUnavailableException.class);
  }

  @Test
  void shouldRethrowRejectionsFromFallback() {
    OAuthBackendException rejection = new OAuthBackendException("Token is expired");

    assertThatThrownBy(() -> backend.fetchOAuthUserFallback("tok", SCOPE, rejection)).isSameAs(rejection);
  }

  @Test
  void shouldReportOpenCircuitAsUnavailable() {
    CallNotPermittedException open =
        CallNotPermittedException.createCallNotPermittedException(CircuitBreaker.ofDefaults("tokeninfo"));

    assertThatThrownBy(() -> backend.fetchOAuthUserFallback("tok", SCOPE, open))
        .isInstanceOf(OAuthBackendUnavailableException.class)
        .hasCause(open);
  }
}
