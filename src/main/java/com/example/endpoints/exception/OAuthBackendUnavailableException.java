package com.example.endpoints.exception;

/**
 * The authorization backend could not be reached or answered with a server error.
 * Counted by the backend circuit breakers; plain token rejections are not.
 */
public class OAuthBackendUnavailableException extends OAuthBackendException {
  public OAuthBackendUnavailableException(String message) {
    super(message);
  }

  public OAuthBackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
