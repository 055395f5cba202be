package com.example.endpoints.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Claims carried by a signed identity token. Timestamps are unix seconds, 0 when absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenClaims(
    @JsonProperty("aud") String audience,
    @JsonProperty("azp") String authorizedParty,
    @JsonProperty("email") String email,
    @JsonProperty("iss") String issuer,
    @JsonProperty("iat") long issuedAt,
    @JsonProperty("exp") long expiresAt
) {}
