package com.example.endpoints.adapter.oauth.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TokeninfoResponse(
    @JsonProperty("issued_to") String issuedTo,
    @JsonProperty("audience") String audience,
    @JsonProperty("user_id") String userId,
    @JsonProperty("scope") String scope,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("email") String email,
    @JsonProperty("verified_email") boolean verifiedEmail,
    @JsonProperty("access_type") String accessType,
    @JsonProperty("error_description") String errorDescription
) {}
