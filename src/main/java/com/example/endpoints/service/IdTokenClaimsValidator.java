package com.example.endpoints.service;

import com.example.endpoints.domain.entity.TokenClaims;
import com.example.endpoints.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Checks the claims of an already verified identity token against the caller's policy.
 * Rejections are logged rather than thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdTokenClaimsValidator {

  private final ApplicationProperties properties;

  public boolean accept(TokenClaims claims, Set<String> audiences, Set<String> clientIds) {
    String issuer = properties.auth().token().issuer();
    if (!issuer.equals(claims.issuer())) {
      log.warn("Issuer {} is not {}", claims.issuer(), issuer);
      return false;
    }
    if (isEmpty(claims.audience())) {
      log.warn("Invalid aud value in token");
      return false;
    }
    if (isEmpty(claims.authorizedParty())) {
      log.warn("Invalid azp value in token");
      return false;
    }
    // aud and azp differ for some client platforms
    if (!claims.authorizedParty().equals(claims.audience()) && !audiences.contains(claims.audience())) {
      log.warn("Audience {} not in allowed audiences", claims.audience());
      return false;
    }
    if (clientIds.isEmpty()) {
      log.warn("No allowed client IDs configured");
      return false;
    }
    if (!clientIds.contains(claims.authorizedParty())) {
      log.warn("Client ID {} not in allowed client IDs", claims.authorizedParty());
      return false;
    }
    if (isEmpty(claims.email())) {
      log.warn("Invalid email value in token");
      return false;
    }
    return true;
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
