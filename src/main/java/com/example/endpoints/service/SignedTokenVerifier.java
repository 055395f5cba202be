package com.example.endpoints.service;

import com.example.endpoints.domain.entity.Certificate;
import com.example.endpoints.domain.entity.CertificateSet;
import com.example.endpoints.domain.entity.TokenClaims;
import com.example.endpoints.domain.entity.TokenHeader;
import com.example.endpoints.exception.AuthError;
import com.example.endpoints.exception.AuthenticationFailedException;
import com.example.endpoints.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static com.example.endpoints.util.TokenEncodingUtils.base64ToBigInteger;
import static com.example.endpoints.util.TokenEncodingUtils.decodeUrlSegment;
import static com.example.endpoints.util.TokenEncodingUtils.fitToLength;

/**
 * Verifies RS256 signed identity tokens against the identity provider's published certificates
 * and checks their issue and expiry times.
 * <p>
 * Stateless apart from the certificate fetch; safe to call from concurrent requests.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignedTokenVerifier {

  private static final String SUPPORTED_ALGORITHM = "RS256";
  private static final int DIGEST_LENGTH = 32;

  private final CertificateCacheService certificateCache;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;

  /**
   * Verifies {@code token} as of {@code now} (unix seconds) and returns its claims.
   *
   * @throws AuthenticationFailedException describing the first check that failed
   */
  public TokenClaims verify(String token, long now) {
    String[] parts = token.split("\\.", -1);
    if (parts.length != 3) {
      throw new AuthenticationFailedException(
          AuthError.MALFORMED_TOKEN, "Wrong number of segments: " + parts.length);
    }

    TokenHeader header = decodeSegment(parts[0], TokenHeader.class);
    if (!SUPPORTED_ALGORITHM.equals(header.algorithm())) {
      throw new AuthenticationFailedException(
          AuthError.UNSUPPORTED_ALGORITHM, "Unsupported algorithm: " + header.algorithm());
    }
    TokenClaims claims = decodeSegment(parts[1], TokenClaims.class);

    CertificateSet certificates =
        certificateCache.getCertificates(properties.auth().certificates().uri());

    BigInteger signature = new BigInteger(1, decodeBytes(parts[2]));
    byte[] digest = sha256(parts[0] + "." + parts[1]);

    if (!matchesAny(certificates, signature, digest)) {
      throw new AuthenticationFailedException(
          AuthError.INVALID_SIGNATURE, "Invalid token signature");
    }

    checkTimestamps(claims, now);
    return claims;
  }

  private boolean matchesAny(CertificateSet certificates, BigInteger signature, byte[] digest) {
    for (Certificate certificate : certificates.keyValues()) {
      BigInteger exponent;
      BigInteger modulus;
      try {
        exponent = base64ToBigInteger(certificate.exponent());
        modulus = base64ToBigInteger(certificate.modulus());
      } catch (IllegalArgumentException e) {
        throw new AuthenticationFailedException(
            AuthError.CERTIFICATE_FETCH_FAILED,
            "Certificate " + certificate.keyId() + " has an undecodable key", e);
      }
      if (modulus.signum() <= 0) {
        continue;
      }

      byte[] recovered = fitToLength(signature.modPow(exponent, modulus).toByteArray(), DIGEST_LENGTH);
      if (MessageDigest.isEqual(recovered, digest)) {
        log.debug("Token signature verified with key {}", certificate.keyId());
        return true;
      }
    }
    return false;
  }

  private void checkTimestamps(TokenClaims claims, long now) {
    long clockSkew = properties.auth().token().clockSkew().toSeconds();
    long maxLifetime = properties.auth().token().maxLifetime().toSeconds();

    if (claims.issuedAt() == 0) {
      throw new AuthenticationFailedException(AuthError.MALFORMED_TOKEN, "Missing iat");
    }
    if (now < claims.issuedAt() - clockSkew) {
      throw new AuthenticationFailedException(
          AuthError.USED_TOO_EARLY, "Token used too early, %d < %d".formatted(now, claims.issuedAt()));
    }
    if (claims.expiresAt() == 0) {
      throw new AuthenticationFailedException(AuthError.MALFORMED_TOKEN, "Missing exp");
    }
    if (claims.expiresAt() >= claims.issuedAt() + maxLifetime) {
      throw new AuthenticationFailedException(
          AuthError.EXPIRY_TOO_FAR, "exp too far in future: " + claims.expiresAt());
    }
    if (now > claims.expiresAt() + clockSkew) {
      throw new AuthenticationFailedException(
          AuthError.USED_TOO_LATE, "Token used too late, %d > %d".formatted(now, claims.expiresAt()));
    }
  }

  private <T> T decodeSegment(String segment, Class<T> type) {
    byte[] json = decodeBytes(segment);
    try {
      T value = objectMapper.readValue(json, type);
      if (value == null) {
        throw new AuthenticationFailedException(AuthError.MALFORMED_TOKEN, "Empty token segment");
      }
      return value;
    } catch (IOException e) {
      throw new AuthenticationFailedException(
          AuthError.MALFORMED_TOKEN, "Undecodable token segment", e);
    }
  }

  private static byte[] decodeBytes(String segment) {
    try {
      return decodeUrlSegment(segment);
    } catch (IllegalArgumentException e) {
      throw new AuthenticationFailedException(AuthError.MALFORMED_TOKEN, "Invalid base64url segment", e);
    }
  }

  private static byte[] sha256(String signingInput) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(signingInput.getBytes(StandardCharsets.US_ASCII));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
