package com.example.endpoints.web.rest.errors;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.context.request.ServletWebRequest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalErrorHandlerTest {

  private final GlobalErrorHandler handler = new GlobalErrorHandler();
  private final ServletWebRequest request =
      new ServletWebRequest(new MockHttpServletRequest("GET", "/api/me"));

  @Test
  void shouldMapUnsupportedMethodToMethodNotAllowed() {
    ResponseEntity<Map<String, Object>> response = handler.handleMethodNotSupported(
        new HttpRequestMethodNotSupportedException("DELETE", List.of("GET")), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
    assertThat(response.getBody())
        .containsEntry("status", 405)
        .containsEntry("error", "method_not_allowed")
        .containsEntry("message", "Method DELETE not supported")
        .containsEntry("path", "/api/me");
  }

  @Test
  void shouldHideUnexpectedErrors() {
    ResponseEntity<Map<String, Object>> response =
        handler.handleGenericException(new IllegalStateException("secret detail"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody()).containsEntry("error", "internal_error");
    assertThat(response.getBody().get("message")).isNotEqualTo("secret detail");
  }
}
