package com.example.endpoints.service;

import com.example.endpoints.SignedTokens;
import com.example.endpoints.TestProperties;
import com.example.endpoints.domain.entity.Certificate;
import com.example.endpoints.domain.entity.CertificateSet;
import com.example.endpoints.domain.entity.TokenClaims;
import com.example.endpoints.exception.AuthError;
import com.example.endpoints.exception.AuthenticationFailedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.security.KeyPair;
import java.security.interfaces.RSAPublicKey;
import java.util.List;

import static com.example.endpoints.SignedTokens.RECORDED_EXPIRES_AT;
import static com.example.endpoints.SignedTokens.RECORDED_ISSUED_AT;
import static com.example.endpoints.SignedTokens.RECORDED_VALID_AT;
import static com.example.endpoints.SignedTokens.RS256_HEADER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SignedTokenVerifierTest {

  private static final long DAY = 86400;

  @Mock
  private CertificateCacheService certificateCache;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private SignedTokenVerifier verifier;

  @BeforeEach
  void setUp() {
    verifier = new SignedTokenVerifier(certificateCache, objectMapper, TestProperties.defaults());
  }

  private void publish(String certificatesJson) throws Exception {
    when(certificateCache.getCertificates(TestProperties.CERT_URI))
        .thenReturn(objectMapper.readValue(certificatesJson, CertificateSet.class));
  }

  @Test
  void shouldVerifyRecordedToken() throws Exception {
    publish(SignedTokens.RECORDED_CERTIFICATES);

    TokenClaims claims = verifier.verify(SignedTokens.RECORDED_TOKEN, RECORDED_VALID_AT);

    assertThat(claims).isEqualTo(new TokenClaims(
        "my-client-id", "hello-android", "dude@gmail.com", "accounts.google.com",
        RECORDED_ISSUED_AT, RECORDED_EXPIRES_AT));
  }

  @Test
  void shouldRejectRecordedTokenADayLate() throws Exception {
    publish(SignedTokens.RECORDED_CERTIFICATES);

    assertFailure(SignedTokens.RECORDED_TOKEN, RECORDED_VALID_AT + DAY, AuthError.USED_TOO_LATE);
  }

  @Test
  void shouldRejectRecordedTokenADayEarly() throws Exception {
    publish(SignedTokens.RECORDED_CERTIFICATES);

    assertFailure(SignedTokens.RECORDED_TOKEN, RECORDED_VALID_AT - DAY, AuthError.USED_TOO_EARLY);
  }

  @Test
  void shouldRejectTokenSignedWithAnotherKey() throws Exception {
    publish(SignedTokens.RECORDED_CERTIFICATES);

    assertFailure(SignedTokens.RECORDED_TOKEN_WRONG_KEY, RECORDED_VALID_AT, AuthError.INVALID_SIGNATURE);
  }

  @Test
  void shouldRejectUnsupportedAlgorithmBeforeFetchingCertificates() {
    assertFailure(SignedTokens.RECORDED_TOKEN_HS256, RECORDED_VALID_AT, AuthError.UNSUPPORTED_ALGORITHM);
    verifyNoInteractions(certificateCache);
  }

  @Test
  void shouldRejectMalformedTokens() {
    assertFailure("invalid.token", RECORDED_VALID_AT, AuthError.MALFORMED_TOKEN);
    assertFailure("another.invalid.token", RECORDED_VALID_AT, AuthError.MALFORMED_TOKEN);
    assertFailure("a.b.c.d", RECORDED_VALID_AT, AuthError.MALFORMED_TOKEN);
    assertFailure("", RECORDED_VALID_AT, AuthError.MALFORMED_TOKEN);
    verifyNoInteractions(certificateCache);
  }

  @Test
  void shouldAcceptTokenWithinClockSkewWindow() throws Exception {
    KeyPair keys = SignedTokens.generateKeyPair();
    publish(SignedTokens.certificatesJson((RSAPublicKey) keys.getPublic()));
    long issuedAt = 1_700_000_000L;
    long expiresAt = issuedAt + 3600;
    String token = SignedTokens.sign(
        RS256_HEADER, SignedTokens.claimsJson("aud", "azp", "user@example.com", issuedAt, expiresAt),
        keys.getPrivate());

    assertThat(verifier.verify(token, issuedAt - 300).email()).isEqualTo("user@example.com");
    assertThat(verifier.verify(token, expiresAt + 300).email()).isEqualTo("user@example.com");
    assertFailure(token, issuedAt - 301, AuthError.USED_TOO_EARLY);
    assertFailure(token, expiresAt + 301, AuthError.USED_TOO_LATE);
  }

  @Test
  void shouldMatchAnyPublishedCertificate() throws Exception {
    KeyPair other = SignedTokens.generateKeyPair();
    KeyPair signer = SignedTokens.generateKeyPair();
    publish(SignedTokens.certificatesJson(
        (RSAPublicKey) other.getPublic(), (RSAPublicKey) signer.getPublic()));
    String token = SignedTokens.sign(
        RS256_HEADER, SignedTokens.claimsJson("aud", "azp", "user@example.com", 1000, 2000),
        signer.getPrivate());

    assertThat(verifier.verify(token, 1500).authorizedParty()).isEqualTo("azp");
  }

  @Test
  void shouldRejectTokenFromUnpublishedKey() throws Exception {
    KeyPair published = SignedTokens.generateKeyPair();
    KeyPair signer = SignedTokens.generateKeyPair();
    publish(SignedTokens.certificatesJson((RSAPublicKey) published.getPublic()));
    String token = SignedTokens.sign(
        RS256_HEADER, SignedTokens.claimsJson("aud", "azp", "user@example.com", 1000, 2000),
        signer.getPrivate());

    assertFailure(token, 1500, AuthError.INVALID_SIGNATURE);
  }

  @Test
  void shouldRejectExpiryTooFarFromIssue() throws Exception {
    KeyPair keys = SignedTokens.generateKeyPair();
    publish(SignedTokens.certificatesJson((RSAPublicKey) keys.getPublic()));
    String token = SignedTokens.sign(
        RS256_HEADER, SignedTokens.claimsJson("aud", "azp", "user@example.com", 1000, 1000 + DAY),
        keys.getPrivate());

    assertFailure(token, 1500, AuthError.EXPIRY_TOO_FAR);
  }

  @Test
  void shouldRejectMissingTimestamps() throws Exception {
    KeyPair keys = SignedTokens.generateKeyPair();
    publish(SignedTokens.certificatesJson((RSAPublicKey) keys.getPublic()));
    String noIssuedAt = SignedTokens.sign(
        RS256_HEADER, "{\"iss\":\"accounts.google.com\",\"exp\":2000}", keys.getPrivate());
    String noExpiry = SignedTokens.sign(
        RS256_HEADER, "{\"iss\":\"accounts.google.com\",\"iat\":1000}", keys.getPrivate());

    assertFailure(noIssuedAt, 1500, AuthError.MALFORMED_TOKEN);
    assertFailure(noExpiry, 1500, AuthError.MALFORMED_TOKEN);
  }

  @Test
  void shouldRejectWhenNoCertificatesArePublished() {
    when(certificateCache.getCertificates(anyString())).thenReturn(new CertificateSet(List.of()));

    assertFailure(SignedTokens.RECORDED_TOKEN, RECORDED_VALID_AT, AuthError.INVALID_SIGNATURE);
  }

  @Test
  void shouldSkipCertificatesWithoutModulus() {
    when(certificateCache.getCertificates(anyString())).thenReturn(new CertificateSet(List.of(
        new Certificate("RSA", "AQAB", "", "empty"))));

    assertFailure(SignedTokens.RECORDED_TOKEN, RECORDED_VALID_AT, AuthError.INVALID_SIGNATURE);
  }

  @Test
  void shouldFailOnUndecodableCertificate() {
    when(certificateCache.getCertificates(anyString())).thenReturn(new CertificateSet(List.of(
        new Certificate("RSA", "AQAB", "not base64!", "broken"))));

    assertFailure(SignedTokens.RECORDED_TOKEN, RECORDED_VALID_AT, AuthError.CERTIFICATE_FETCH_FAILED);
  }

  @Test
  void shouldPropagateCertificateFetchFailure() {
    when(certificateCache.getCertificates(anyString()))
        .thenThrow(new AuthenticationFailedException(AuthError.CERTIFICATE_FETCH_FAILED));

    assertFailure(SignedTokens.RECORDED_TOKEN, RECORDED_VALID_AT, AuthError.CERTIFICATE_FETCH_FAILED);
  }

  private void assertFailure(String token, long now, AuthError expected) {
    assertThatThrownBy(() -> verifier.verify(token, now))
        .isInstanceOf(AuthenticationFailedException.class)
        .extracting("error").isEqualTo(expected);
  }
}
