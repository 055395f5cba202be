package com.example.endpoints.service;

import com.example.endpoints.domain.entity.CertificateSet;
import com.example.endpoints.exception.AuthError;
import com.example.endpoints.exception.AuthenticationFailedException;
import com.example.endpoints.properties.ApplicationProperties;
import com.example.endpoints.util.CacheControlUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;

/**
 * Fetches the identity provider's signing certificates and shares them across instances through
 * Redis. Entries live as long as the certificate response's freshness headers allow.
 * <p>
 * Concurrent misses may fetch in parallel; entries are replaced wholesale so the last writer wins.
 */
@Slf4j
@Service
public class CertificateCacheService {

  private final StringRedisTemplate redisTemplate;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  public CertificateCacheService(
      StringRedisTemplate redisTemplate,
      @Qualifier("defaultOkHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      ApplicationProperties properties) {
    this.redisTemplate = redisTemplate;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.keyPrefix = properties.auth().certificates().namespace() + ":";
  }

  /**
   * Returns the certificates published at {@code sourceUri}, from cache when fresh.
   *
   * @throws AuthenticationFailedException with {@link AuthError#CERTIFICATE_FETCH_FAILED} if they
   * cannot be fetched or decoded
   */
  public CertificateSet getCertificates(String sourceUri) {
    String key = keyPrefix + sourceUri;

    String cached;
    try {
      cached = redisTemplate.opsForValue().get(key);
    } catch (DataAccessException e) {
      log.error("Certificate cache read failed for {}, fetching without caching", sourceUri, e);
      return decode(fetch(sourceUri).body(), sourceUri);
    }

    if (cached != null) {
      try {
        log.debug("Certificate cache hit for {}", sourceUri);
        return objectMapper.readValue(cached, CertificateSet.class);
      } catch (JsonProcessingException e) {
        log.error("Cached certificates for {} are unreadable, fetching without caching", sourceUri, e);
        return decode(fetch(sourceUri).body(), sourceUri);
      }
    }

    log.debug("Certificate cache miss for {}", sourceUri);
    FetchedCertificates fetched = fetch(sourceUri);
    CertificateSet certificates = decode(fetched.body(), sourceUri);

    if (!fetched.ttl().isZero()) {
      store(key, fetched.body(), fetched.ttl());
    }
    log.info("Refreshed {} signing certificate(s) from {} (ttl={}s)",
             certificates.keyValues().size(), sourceUri, fetched.ttl().toSeconds());
    return certificates;
  }

  private FetchedCertificates fetch(String sourceUri) {
    Request request = new Request.Builder().url(sourceUri).get().build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() != 200) {
        throw new AuthenticationFailedException(
            AuthError.CERTIFICATE_FETCH_FAILED,
            "Could not reach Cert URI or bad response, status: " + response.code());
      }
      ResponseBody body = response.body();
      String payload = body != null ? body.string() : "";
      Duration ttl = CacheControlUtils.remainingFreshness(
          response.header("Cache-Control"), response.header("Age"));
      return new FetchedCertificates(payload, ttl);

    } catch (IOException e) {
      throw new AuthenticationFailedException(
          AuthError.CERTIFICATE_FETCH_FAILED, "Certificate fetch failed due to network error", e);
    }
  }

  private CertificateSet decode(String body, String sourceUri) {
    try {
      CertificateSet certificates = objectMapper.readValue(body, CertificateSet.class);
      if (certificates == null) {
        throw new AuthenticationFailedException(
            AuthError.CERTIFICATE_FETCH_FAILED, "Empty certificate response from " + sourceUri);
      }
      return certificates;
    } catch (JsonProcessingException e) {
      throw new AuthenticationFailedException(
          AuthError.CERTIFICATE_FETCH_FAILED, "Unreadable certificate response from " + sourceUri, e);
    }
  }

  private void store(String key, String body, Duration ttl) {
    try {
      redisTemplate.opsForValue().set(key, body, ttl);
    } catch (DataAccessException e) {
      log.warn("Could not cache certificates under {}: {}", key, e.getMessage());
    }
  }

  private record FetchedCertificates(String body, Duration ttl) {}
}
