package com.replyrelay.orchestrator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay.audit")
public record AuditProperties(String mode, String webhookUrl, Duration timeout) {

  public AuditProperties {
    mode = mode == null || mode.isBlank() ? "table" : mode;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
  }
}
