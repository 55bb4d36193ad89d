package com.replyrelay.orchestrator.polling;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "relay.poller.enabled", havingValue = "true", matchIfMissing = true)
public class IngestionScheduler {

  private final IngestionPoller poller;

  public IngestionScheduler(IngestionPoller poller) {
    this.poller = poller;
  }

  @Scheduled(fixedDelayString = "${relay.poller.interval:PT2S}")
  public void poll() {
    poller.tick();
  }
}
