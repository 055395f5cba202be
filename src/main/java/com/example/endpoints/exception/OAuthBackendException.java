package com.example.endpoints.exception;

/**
 * The authorization backend did not accept the access token for the requested scope.
 */
public class OAuthBackendException extends RuntimeException {
  public OAuthBackendException(String message) {
    super(message);
  }

  public OAuthBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
