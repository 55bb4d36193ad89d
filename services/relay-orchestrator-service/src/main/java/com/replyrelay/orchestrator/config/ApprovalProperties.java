package com.replyrelay.orchestrator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param replyLaterDelay how long a card put off with "Reply later" waits before it is shown
 *     again
 */
@ConfigurationProperties(prefix = "relay.approval")
public record ApprovalProperties(Duration ttl, Duration sweepInterval, Duration replyLaterDelay) {

  public ApprovalProperties {
    ttl = ttl == null ? Duration.ofHours(24) : ttl;
    sweepInterval = sweepInterval == null ? Duration.ofMinutes(1) : sweepInterval;
    replyLaterDelay = replyLaterDelay == null ? Duration.ofHours(1) : replyLaterDelay;
  }
}
