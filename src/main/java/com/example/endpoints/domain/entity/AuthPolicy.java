package com.example.endpoints.domain.entity;

import java.util.List;
import java.util.Set;

/**
 * What a service method accepts: scopes in preference order, plus the audiences and client IDs
 * an identity token may be issued for.
 */
public record AuthPolicy(
    List<String> scopes,
    Set<String> audiences,
    Set<String> clientIds
) {

  public AuthPolicy {
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
    audiences = audiences == null ? Set.of() : Set.copyOf(audiences);
    clientIds = clientIds == null ? Set.of() : Set.copyOf(clientIds);
  }

  public static AuthPolicy of(List<String> scopes, List<String> audiences, List<String> clientIds) {
    return new AuthPolicy(
        scopes,
        audiences == null ? null : Set.copyOf(audiences),
        clientIds == null ? null : Set.copyOf(clientIds)
    );
  }

  /**
   * A policy with nothing to authenticate against.
   */
  public boolean isEmpty() {
    return scopes.isEmpty() && audiences.isEmpty() && clientIds.isEmpty();
  }
}
