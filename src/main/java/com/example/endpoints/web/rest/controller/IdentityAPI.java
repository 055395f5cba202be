package com.example.endpoints.web.rest.controller;

import static com.example.endpoints.web.rest.ApiConstants.ApiPath.*;

import com.example.endpoints.domain.entity.AuthenticatedIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Caller identity API.
 */
@Tag(
    name = "Identity",
    description = "Resolved identity of the authenticated caller"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface IdentityAPI {

  @Operation(
      summary = "Get current caller",
      description = "Returns the identity resolved from the request's Bearer or OAuth token",
      security = @SecurityRequirement(name = "bearerAuth")
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Caller identity returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = ME)
  ResponseEntity<AuthenticatedIdentity> getCurrentIdentity(
      @Parameter(hidden = true) @AuthenticationPrincipal AuthenticatedIdentity identity);
}
