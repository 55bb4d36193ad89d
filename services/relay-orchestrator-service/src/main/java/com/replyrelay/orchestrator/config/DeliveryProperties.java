package com.replyrelay.orchestrator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay.delivery")
public record DeliveryProperties(
    int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

  public DeliveryProperties {
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    initialBackoff = initialBackoff == null ? Duration.ofSeconds(1) : initialBackoff;
    multiplier = multiplier < 1.0 ? 2.0 : multiplier;
    maxBackoff = maxBackoff == null ? Duration.ofSeconds(30) : maxBackoff;
  }
}
