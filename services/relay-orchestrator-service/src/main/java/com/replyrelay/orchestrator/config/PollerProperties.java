package com.replyrelay.orchestrator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param batchWindow a conversation's fragments are drafted together once it has been quiet for
 *     this long; zero drafts whatever one tick read
 */
@ConfigurationProperties(prefix = "relay.poller")
public record PollerProperties(
    boolean enabled,
    Duration interval,
    int batchLimit,
    Duration tickTimeout,
    Duration batchWindow) {

  public PollerProperties {
    interval = interval == null ? Duration.ofSeconds(2) : interval;
    batchLimit = batchLimit <= 0 ? 500 : batchLimit;
    tickTimeout = tickTimeout == null ? Duration.ofMinutes(2) : tickTimeout;
    batchWindow = batchWindow == null || batchWindow.isNegative() ? Duration.ZERO : batchWindow;
  }
}
