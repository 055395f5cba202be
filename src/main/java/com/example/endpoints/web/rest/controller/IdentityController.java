package com.example.endpoints.web.rest.controller;

import com.example.endpoints.domain.entity.AuthenticatedIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Slf4j
public class IdentityController implements IdentityAPI {

  @Override
  public ResponseEntity<AuthenticatedIdentity> getCurrentIdentity(AuthenticatedIdentity identity) {
    log.debug("Identity lookup for {}", identity.email());
    return ResponseEntity.ok(identity);
  }
}
