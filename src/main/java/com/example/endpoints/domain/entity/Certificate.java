package com.example.endpoints.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One RSA signing key. Exponent and modulus are standard base64, big-endian.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Certificate(
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("exponent") String exponent,
    @JsonProperty("modulus") String modulus,
    @JsonProperty("keyid") String keyId
) {}
