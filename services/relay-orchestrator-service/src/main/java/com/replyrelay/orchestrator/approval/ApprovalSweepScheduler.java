package com.replyrelay.orchestrator.approval;

import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Expires overdue Pending records, shows cards whose "Reply later" reminder is due and re-presents
 * cards that never reached the operator.
 */
@Component
@Slf4j
@ConditionalOnProperty(
    name = "relay.approval.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ApprovalSweepScheduler {

  private final ApprovalCoordinator coordinator;

  public ApprovalSweepScheduler(ApprovalCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @Scheduled(fixedDelayString = "${relay.approval.sweep-interval:PT1M}")
  public void sweep() {
    try {
      Instant now = Instant.now();
      int expired = coordinator.expireOverdue(now);
      int reminded = coordinator.remindDue(now);
      int presented = coordinator.presentMissingCards();
      if (expired > 0 || reminded > 0 || presented > 0) {
        log.info(
            "Approval sweep: {} expired, {} reminder(s), {} card(s) re-presented",
            expired,
            reminded,
            presented);
      }
    } catch (RuntimeException e) {
      log.warn("Approval sweep failed: {}", e.getMessage());
    }
  }
}
