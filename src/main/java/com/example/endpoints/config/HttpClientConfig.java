package com.example.endpoints.config;

import com.example.endpoints.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp Client Configuration
 *
 * One shared connection pool and dispatcher for the certificate fetch and the
 * access token backend calls. Request timeouts are the only deadline the pipeline has.
 */
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class HttpClientConfig {

  private final ApplicationProperties properties;

  @Bean
  public ConnectionPool sharedConnectionPool() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(), TimeUnit.MINUTES);
  }

  @Bean
  public Dispatcher sharedDispatcher() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(client.maxRequests());
    dispatcher.setMaxRequestsPerHost(client.maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Default HTTP client for certificate and token backend calls
   */
  @Bean
  public OkHttpClient defaultOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(client.connectTimeout())
        .readTimeout(client.readTimeout())
        .writeTimeout(client.readTimeout())
        .retryOnConnectionFailure(true)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
