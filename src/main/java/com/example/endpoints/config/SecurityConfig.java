package com.example.endpoints.config;

import com.example.endpoints.security.filter.EndpointsAuthenticationFilter;
import com.example.endpoints.web.rest.errors.DelegatedAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

import java.time.Duration;

/**
 * Stateless security configuration with three filter chains.
 * <p>
 * PUBLIC (@Order(1)): actuator and health endpoints. PROTECTED (@Order(2)): /api/**, authenticated
 * by {@link EndpointsAuthenticationFilter}. DEFAULT (@Order(3)): deny everything else.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final EndpointsAuthenticationFilter endpointsAuthenticationFilter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;

  /**
   * The filter only runs inside the protected chain, not as a plain servlet filter.
   */
  @Bean
  public FilterRegistrationBean<EndpointsAuthenticationFilter> endpointsAuthenticationFilterRegistration() {
    FilterRegistrationBean<EndpointsAuthenticationFilter> registration =
        new FilterRegistrationBean<>(endpointsAuthenticationFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/actuator/**",
                         "/health/**")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/**")
        .addFilterBefore(endpointsAuthenticationFilter,
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated())
        // JSON 401 instead of a login redirect
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Bearer tokens only, no cookies
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.NO_REFERRER))
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true))
                     .contentSecurityPolicy(csp -> csp
                                                .policyDirectives("default-src 'none'; frame-ancestors 'none'"))
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma", "no-cache");
                     }));
  }
}
