package com.example.endpoints.service;

import com.example.endpoints.domain.entity.AuthPolicy;
import com.example.endpoints.domain.entity.AuthenticatedIdentity;
import com.example.endpoints.domain.entity.TokenClaims;
import com.example.endpoints.exception.AuthError;
import com.example.endpoints.exception.AuthenticationFailedException;
import com.example.endpoints.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

import static com.example.endpoints.util.AuthorizationHeaderParser.maskToken;

/**
 * Decides who the caller of a request is.
 * <p>
 * A policy asking only for the email scope with allowed client IDs first tries the token as a
 * signed identity token. Any failure there falls back to resolving it as an access token, since
 * clients send both token shapes under the same scheme.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationService {

  private final SignedTokenVerifier tokenVerifier;
  private final IdTokenClaimsValidator claimsValidator;
  private final AccessTokenResolver accessTokenResolver;
  private final ApplicationProperties properties;
  private final Clock clock;

  public AuthenticatedIdentity authenticate(String authorizationHeader, AuthPolicy policy) {
    return authenticate(OAuthRequestContext.fromAuthorizationHeader(authorizationHeader), policy);
  }

  /**
   * @throws AuthenticationFailedException if the request cannot be authenticated under
   * {@code policy}
   */
  public AuthenticatedIdentity authenticate(OAuthRequestContext context, AuthPolicy policy) {
    if (policy.isEmpty()) {
      throw new AuthenticationFailedException(AuthError.NO_POLICY_PROVIDED);
    }
    String token = context.token();
    if (token.isEmpty()) {
      throw new AuthenticationFailedException(AuthError.NO_TOKEN);
    }

    if (isIdTokenPolicy(policy)) {
      try {
        AuthenticatedIdentity identity = authenticateIdToken(token, policy);
        log.info("Authenticated {} with identity token", identity.email());
        return identity;
      } catch (AuthenticationFailedException e) {
        log.debug("Identity token check failed for {} ({}), trying access token",
                  maskToken(token), e.getError().getCode());
      }
    }

    AccessTokenResolver.ScopeMatch match =
        accessTokenResolver.resolveScope(context, policy.scopes(), policy.clientIds());
    AuthenticatedIdentity identity = accessTokenResolver.resolveUser(context, match.scope());
    log.info("Authenticated {} with access token for scope {}", identity.email(), match.scope());
    return identity;
  }

  private boolean isIdTokenPolicy(AuthPolicy policy) {
    return policy.scopes().equals(List.of(properties.auth().token().emailScope()))
        && !policy.clientIds().isEmpty();
  }

  private AuthenticatedIdentity authenticateIdToken(String token, AuthPolicy policy) {
    TokenClaims claims = tokenVerifier.verify(token, clock.instant().getEpochSecond());
    if (!claimsValidator.accept(claims, policy.audiences(), policy.clientIds())) {
      throw new AuthenticationFailedException(AuthError.CLAIMS_REJECTED);
    }
    return AuthenticatedIdentity.emailOnly(claims.email());
  }
}
