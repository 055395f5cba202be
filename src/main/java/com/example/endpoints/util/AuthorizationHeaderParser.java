package com.example.endpoints.util;

import com.example.endpoints.domain.entity.AuthScheme;
import lombok.experimental.UtilityClass;

/**
 * Extracts the raw token from an Authorization header value.
 */
@UtilityClass
public class AuthorizationHeaderParser {

  /**
   * Returns the token of a {@code "<Bearer|OAuth> <token>"} header, or an empty string when the
   * header is absent, uses another scheme, or does not have exactly two fields.
   */
  public static String extractToken(String authorizationHeader) {
    if (authorizationHeader == null) {
      return "";
    }
    String[] fields = authorizationHeader.trim().split("\\s+");
    if (fields.length != 2) {
      return "";
    }
    return AuthScheme.fromHeaderValue(fields[0]).isPresent() ? fields[1] : "";
  }

  /**
   * Short, log-safe prefix of a token.
   */
  public static String maskToken(String token) {
    if (token == null || token.length() < 8) {
      return "***";
    }
    return token.substring(0, 6) + "...";
  }
}
