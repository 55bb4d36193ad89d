package com.replyrelay.orchestrator.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

  @Bean
  public RestClient bridgeRestClient(RestClient.Builder builder, BridgeProperties properties) {
    Duration read = max(properties.sendTimeout(), properties.downloadTimeout());
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.sendTimeout(), read))
        .build();
  }

  /** No read timeout here: the draft call is bounded by {@code relay.draft.timeout} instead. */
  @Bean
  public RestClient openAiRestClient(RestClient.Builder builder, OpenAiProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .defaultHeader("Authorization", "Bearer " + properties.apiKey())
        .requestFactory(requestFactory(Duration.ofSeconds(10), Duration.ofMinutes(2)))
        .build();
  }

  @Bean
  public RestClient auditRestClient(RestClient.Builder builder, AuditProperties properties) {
    return builder
        .clone()
        .requestFactory(requestFactory(properties.timeout(), properties.timeout()))
        .build();
  }

  private static SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connect);
    factory.setReadTimeout(read);
    return factory;
  }

  private static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
