package com.example.endpoints.web.rest.errors;

import com.example.endpoints.exception.AuthError;
import com.example.endpoints.security.filter.EndpointsAuthenticationFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers unauthenticated access to protected endpoints with a JSON 401 carrying the reason the
 * authentication filter recorded, instead of Spring Security's default login redirect.
 */
@Component
@RequiredArgsConstructor
public class DelegatedAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ObjectMapper objectMapper;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    Object recorded = request.getAttribute(EndpointsAuthenticationFilter.AUTH_ERROR_ATTRIBUTE);
    String error = recorded instanceof AuthError authError ? authError.getCode() : "not_authenticated";
    String message = recorded instanceof AuthError authError
        ? authError.getDescription()
        : "Authentication required";

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now().toString());
    body.put("status", HttpServletResponse.SC_UNAUTHORIZED);
    body.put("error", error);
    body.put("message", message);
    body.put("path", request.getRequestURI());

    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setHeader("WWW-Authenticate", "Bearer");
    objectMapper.writeValue(response.getWriter(), body);
  }
}
