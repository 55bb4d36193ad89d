package com.replyrelay.orchestrator.config;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WhatsApp bridge: the REST side for send/download and the SQLite message store it writes.
 *
 * <p>{@code zone} is the zone the bridge writes offset-less timestamps in.
 */
@ConfigurationProperties(prefix = "relay.bridge")
public record BridgeProperties(
    String baseUrl,
    String databasePath,
    ZoneId zone,
    Duration sendTimeout,
    Duration downloadTimeout) {

  public BridgeProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:8080/api" : baseUrl;
    zone = zone == null ? ZoneId.of("UTC") : zone;
    sendTimeout = sendTimeout == null ? Duration.ofSeconds(10) : sendTimeout;
    downloadTimeout = downloadTimeout == null ? Duration.ofSeconds(20) : downloadTimeout;
  }
}
