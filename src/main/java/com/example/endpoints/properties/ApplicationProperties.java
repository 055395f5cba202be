package com.example.endpoints.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the Endpoints Auth service.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid AuthProperties auth,
    @NotNull @Valid OkHttpProperties http,
    @NotNull @Valid RedisProperties redis
) {

  /**
   * Token verification and authorization configuration
   */
  public record AuthProperties(
      @NotNull @Valid CertificateProperties certificates,
      @NotNull @Valid TokenProperties token,
      @NotNull @Valid BackendProperties backend,
      @NotNull @Valid PolicyProperties policy
  ) {

    /**
     * Where the identity provider publishes its signing certificates, and the cache
     * namespace they are stored under.
     */
    public record CertificateProperties(
        @DefaultValue("https://www.googleapis.com/service_accounts/v1/metadata/raw/"
                          + "federated-signon@system.gserviceaccount.com") @NotBlank String uri,
        @DefaultValue("certs") @NotBlank String namespace
    ) {}

    public record TokenProperties(
        @DefaultValue("300s") @DurationUnit(ChronoUnit.SECONDS) Duration clockSkew,
        @DefaultValue("86400s") @DurationUnit(ChronoUnit.SECONDS) Duration maxLifetime,
        @DefaultValue("accounts.google.com") @NotBlank String issuer,
        @DefaultValue("https://www.googleapis.com/auth/userinfo.email") @NotBlank String emailScope
    ) {}

    /**
     * Access token backend. "tokeninfo" for local/dev deployments, "introspection" for hosted ones.
     */
    public record BackendProperties(
        @DefaultValue("tokeninfo") @Pattern(regexp = "tokeninfo|introspection") String type,
        @DefaultValue("https://www.googleapis.com/oauth2/v2/tokeninfo") String tokeninfoUri,
        String introspectionUri,
        String clientId,
        String clientSecret,
        @DefaultValue("gmail.com") String authDomain
    ) {}

    /**
     * Default policy applied to protected routes
     */
    public record PolicyProperties(
        @DefaultValue List<String> scopes,
        @DefaultValue List<String> audiences,
        @DefaultValue List<String> clientIds
    ) {}
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout
    ) {}
  }

  /**
   * Redis configuration for the shared certificate cache
   */
  public record RedisProperties(
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6380") @Min(1) @Max(65535) int port,
      String password,
      @NotNull @Valid SslProperties ssl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("true") boolean enabled
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @Positive int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }
}
