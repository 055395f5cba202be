package com.example.endpoints.exception;

/**
 * Reasons an inbound request could not be authenticated.
 * The code is the stable value reported to API clients.
 */
public enum AuthError {
  NO_POLICY_PROVIDED("no_policy_provided", "No scopes, audiences or client IDs to authenticate against"),
  NO_TOKEN("no_token", "No Bearer or OAuth token found in the Authorization header"),
  MALFORMED_TOKEN("malformed_token", "Token could not be decoded"),
  UNSUPPORTED_ALGORITHM("unsupported_algorithm", "Token is not signed with RS256"),
  CERTIFICATE_FETCH_FAILED("certificate_fetch_failed", "Signing certificates are unavailable"),
  INVALID_SIGNATURE("invalid_signature", "Token signature does not match any signing certificate"),
  USED_TOO_EARLY("used_too_early", "Token used before its issue time"),
  USED_TOO_LATE("used_too_late", "Token has expired"),
  EXPIRY_TOO_FAR("expiry_too_far", "Token expiry is too far in the future"),
  CLAIMS_REJECTED("claims_rejected", "Token claims do not satisfy the policy"),
  NO_VALID_SCOPE("no_valid_scope", "Access token is not valid for any allowed scope"),
  MISMATCHED_CLIENT_ID("mismatched_client_id", "Access token was issued to a client that is not allowed");

  private final String code;
  private final String description;

  AuthError(String code, String description) {
    this.code = code;
    this.description = description;
  }

  public String getCode() {
    return code;
  }

  public String getDescription() {
    return description;
  }
}
