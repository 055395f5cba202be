package com.example.endpoints.config;

import com.example.endpoints.adapter.oauth.IntrospectionOAuthBackend;
import com.example.endpoints.adapter.oauth.OAuthUserBackend;
import com.example.endpoints.adapter.oauth.TokeninfoOAuthBackend;
import com.example.endpoints.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Selects the access token backend from {@code app.auth.backend.type} and exposes the clock
 * used for token time checks.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class AuthBackendConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(prefix = "app.auth.backend", name = "type", havingValue = "tokeninfo",
                         matchIfMissing = true)
  public OAuthUserBackend tokeninfoOAuthBackend(
      ApplicationProperties properties,
      @Qualifier("defaultOkHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper) {
    log.info("Access tokens resolved through tokeninfo at {}",
             properties.auth().backend().tokeninfoUri());
    return new TokeninfoOAuthBackend(properties, httpClient, objectMapper);
  }

  @Bean
  @ConditionalOnProperty(prefix = "app.auth.backend", name = "type", havingValue = "introspection")
  public OAuthUserBackend introspectionOAuthBackend(
      ApplicationProperties properties,
      @Qualifier("defaultOkHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper) {
    log.info("Access tokens resolved through introspection at {}",
             properties.auth().backend().introspectionUri());
    return new IntrospectionOAuthBackend(properties, httpClient, objectMapper);
  }
}
