package com.example.endpoints.config;

import com.example.endpoints.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces cross-field rules beyond basic JSR-303 validation.
 * Fails fast at startup with every violation listed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URI = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_REQUIRED = "%s is required when app.auth.backend.type is '%s'.";
  private static final String PROTOCOL_HTTP = "http://";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String BACKEND_TOKENINFO = "tokeninfo";
  private static final String BACKEND_INTROSPECTION = "introspection";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateCertificateConfig(errors);
    validateTokenConfig(errors);
    validateBackendConfig(errors);
    validateHttpConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateCertificateConfig(List<String> errors) {
    String uri = properties.auth().certificates().uri();
    validateUri(uri, "Certificate URI", errors);
    validateHttpsRequired(uri, "Certificate URI", errors);
  }

  private void validateTokenConfig(List<String> errors) {
    ApplicationProperties.AuthProperties.TokenProperties token = properties.auth().token();
    if (token.clockSkew().isNegative()) {
      errors.add("Clock skew cannot be negative.");
    }
    if (token.clockSkew().compareTo(token.maxLifetime()) >= 0) {
      errors.add("Clock skew (%ds) must be less than max token lifetime (%ds)"
                     .formatted(token.clockSkew().toSeconds(), token.maxLifetime().toSeconds()));
    }
  }

  private void validateBackendConfig(List<String> errors) {
    ApplicationProperties.AuthProperties.BackendProperties backend = properties.auth().backend();
    switch (backend.type()) {
      case BACKEND_TOKENINFO -> {
        validateUri(backend.tokeninfoUri(), "Tokeninfo URI", errors);
        validateHttpsRequired(backend.tokeninfoUri(), "Tokeninfo URI", errors);
      }
      case BACKEND_INTROSPECTION -> {
        if (isBlank(backend.introspectionUri())) {
          errors.add(ERROR_REQUIRED.formatted("Introspection URI", BACKEND_INTROSPECTION));
        } else {
          validateUri(backend.introspectionUri(), "Introspection URI", errors);
          validateHttpsRequired(backend.introspectionUri(), "Introspection URI", errors);
        }
        if (isBlank(backend.clientId())) {
          errors.add(ERROR_REQUIRED.formatted("Backend client ID", BACKEND_INTROSPECTION));
        }
        if (isBlank(backend.clientSecret())) {
          errors.add(ERROR_REQUIRED.formatted("Backend client secret", BACKEND_INTROSPECTION));
        }
      }
      default -> errors.add("Unknown backend type: " + backend.type());
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void validateUri(String uri, String fieldName, List<String> errors) {
    try {
      URI parsed = new URI(uri);
      if (parsed.getScheme() == null || parsed.getHost() == null) {
        errors.add(ERROR_INVALID_URI.formatted(fieldName, uri));
      }
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URI.formatted(fieldName, uri));
    }
  }

  private void validateHttpsRequired(String uri, String fieldName, List<String> errors) {
    if (uri != null && uri.startsWith(PROTOCOL_HTTP) && !uri.contains(HOST_LOCALHOST)) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, uri));
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
