package com.replyrelay.orchestrator.delivery;

import com.replyrelay.orchestrator.domain.ApprovalState;

/** What one delivery run did; {@code finalState} is null when the run was abandoned or skipped. */
public record DeliveryReport(
    Long approvalId, int attempts, ApprovalState finalState, String error) {

  static DeliveryReport skipped(Long approvalId) {
    return new DeliveryReport(approvalId, 0, null, null);
  }
}
