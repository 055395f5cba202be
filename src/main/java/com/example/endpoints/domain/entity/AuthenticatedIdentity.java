package com.example.endpoints.domain.entity;

/**
 * Authenticated Identity - the resolved caller of a single request
 */
public record AuthenticatedIdentity(
    String email,
    String userId,
    String authDomain,
    boolean admin,
    String clientId
) {

  /**
   * Identity tokens only vouch for the email address.
   */
  public static AuthenticatedIdentity emailOnly(String email) {
    return new AuthenticatedIdentity(email, null, null, false, null);
  }
}
