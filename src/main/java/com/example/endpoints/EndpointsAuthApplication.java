package com.example.endpoints;

import com.example.endpoints.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Endpoints Auth Application
 *
 * Authenticates inbound API requests behind the API front door:
 * - RS256 identity tokens verified against the provider's cached signing certificates
 * - Opaque Bearer/OAuth access tokens resolved through the authorization backend
 * - Redis as the shared certificate cache
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class EndpointsAuthApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(EndpointsAuthApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
