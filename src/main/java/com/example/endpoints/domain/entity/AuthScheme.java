package com.example.endpoints.domain.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * Authorization header schemes that carry an opaque access token.
 * Both are accepted as synonyms.
 */
public enum AuthScheme {
  BEARER,
  OAUTH;

  /**
   * Case-insensitive lookup of a header scheme name.
   */
  public static Optional<AuthScheme> fromHeaderValue(String scheme) {
    if (scheme == null) {
      return Optional.empty();
    }
    return switch (scheme.toLowerCase(Locale.ROOT)) {
      case "bearer" -> Optional.of(BEARER);
      case "oauth" -> Optional.of(OAUTH);
      default -> Optional.empty();
    };
  }
}
