package com.example.endpoints.exception;

/**
 * Terminal authentication failure. The message is safe to return to callers and never
 * contains the token itself.
 */
public class AuthenticationFailedException extends RuntimeException {

  private final AuthError error;

  public AuthenticationFailedException(AuthError error) {
    super(error.getDescription());
    this.error = error;
  }

  public AuthenticationFailedException(AuthError error, String message) {
    super(message);
    this.error = error;
  }

  public AuthenticationFailedException(AuthError error, String message, Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  public AuthError getError() {
    return error;
  }
}
