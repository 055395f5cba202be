package com.example.endpoints.adapter.oauth.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 7662 token introspection response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionResponse(
    @JsonProperty("active") boolean active,
    @JsonProperty("scope") String scope,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("username") String username,
    @JsonProperty("sub") String subject,
    @JsonProperty("email") String email,
    @JsonProperty("admin") boolean admin
) {}
