package com.example.endpoints.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Signing certificates published by the identity provider. A token verifies if any member
 * verifies it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CertificateSet(@JsonProperty("keyvalues") List<Certificate> keyValues) {

  public CertificateSet {
    keyValues = keyValues == null ? List.of() : List.copyOf(keyValues);
  }
}
