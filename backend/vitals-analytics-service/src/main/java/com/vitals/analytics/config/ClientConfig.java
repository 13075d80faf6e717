package com.vitals.analytics.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound HTTP clients, one per collaborator, each with its own timeout.
 */
@Configuration
public class ClientConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RestTemplate alertsRestTemplate(RestTemplateBuilder builder,
                                         @Value("${vitals.alerts.base-url:http://alerts-service:8000}") String baseUrl,
                                         @Value("${vitals.alerts.timeout-ms:2000}") long timeoutMs) {
    return build(builder, baseUrl, timeoutMs);
  }

  @Bean
  public RestTemplate patientsRestTemplate(RestTemplateBuilder builder,
                                           @Value("${vitals.patients.base-url:http://user-service:8000}") String baseUrl,
                                           @Value("${vitals.patients.timeout-ms:2000}") long timeoutMs) {
    return build(builder, baseUrl, timeoutMs);
  }

  @Bean
  public RestTemplate telemetryRestTemplate(RestTemplateBuilder builder,
                                            @Value("${vitals.telemetry.base-url:http://patient-data-service:8000}") String baseUrl,
                                            @Value("${vitals.telemetry.timeout-ms:3000}") long timeoutMs) {
    return build(builder, baseUrl, timeoutMs);
  }

  private static RestTemplate build(RestTemplateBuilder builder, String baseUrl, long timeoutMs) {
    Duration timeout = Duration.ofMillis(timeoutMs);
    return builder
        .rootUri(baseUrl)
        .setConnectTimeout(timeout)
        .setReadTimeout(timeout)
        .build();
  }
}
