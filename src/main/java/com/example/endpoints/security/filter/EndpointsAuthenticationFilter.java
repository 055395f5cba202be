package com.example.endpoints.security.filter;

import com.example.endpoints.domain.entity.AuthPolicy;
import com.example.endpoints.domain.entity.AuthenticatedIdentity;
import com.example.endpoints.exception.AuthenticationFailedException;
import com.example.endpoints.properties.ApplicationProperties;
import com.example.endpoints.service.AuthenticationService;
import com.example.endpoints.service.OAuthRequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Authenticates API requests from their Authorization header against the configured policy.
 * A fresh {@link OAuthRequestContext} is created for every request and dropped when it ends.
 * Failed requests continue unauthenticated; the entry point reports the recorded error.
 */
@Slf4j
@Component
public class EndpointsAuthenticationFilter extends OncePerRequestFilter {

  public static final String AUTH_ERROR_ATTRIBUTE = EndpointsAuthenticationFilter.class.getName() + ".AUTH_ERROR";

  private static final String ROLE_USER = "ROLE_USER";
  private static final String ROLE_ADMIN = "ROLE_ADMIN";

  private final AuthenticationService authenticationService;
  private final AuthPolicy policy;

  public EndpointsAuthenticationFilter(AuthenticationService authenticationService,
                                       ApplicationProperties properties) {
    this.authenticationService = authenticationService;
    ApplicationProperties.AuthProperties.PolicyProperties policyProps = properties.auth().policy();
    this.policy = AuthPolicy.of(policyProps.scopes(), policyProps.audiences(), policyProps.clientIds());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
  ) throws ServletException, IOException {

    OAuthRequestContext context =
        OAuthRequestContext.fromAuthorizationHeader(request.getHeader(HttpHeaders.AUTHORIZATION));

    try {
      AuthenticatedIdentity identity = authenticationService.authenticate(context, policy);
      SecurityContextHolder.getContext().setAuthentication(
          new UsernamePasswordAuthenticationToken(identity, null, authoritiesOf(identity)));
      log.trace("Authenticated request {} as {}", request.getRequestURI(), identity.email());
    } catch (AuthenticationFailedException e) {
      log.debug("Authentication failed for {}: {}", request.getRequestURI(), e.getError().getCode());
      request.setAttribute(AUTH_ERROR_ATTRIBUTE, e.getError());
    }

    filterChain.doFilter(request, response);
  }

  private static List<GrantedAuthority> authoritiesOf(AuthenticatedIdentity identity) {
    List<GrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(ROLE_USER));
    if (identity.admin()) {
      authorities.add(new SimpleGrantedAuthority(ROLE_ADMIN));
    }
    return authorities;
  }
}
