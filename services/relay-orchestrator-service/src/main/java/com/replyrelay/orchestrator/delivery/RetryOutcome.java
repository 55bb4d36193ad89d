package com.replyrelay.orchestrator.delivery;

public enum RetryOutcome {
  SUBMITTED,
  NOT_FOUND,
  /** Only records in DeliveryFailed can be retried. */
  NOT_FAILED,
  ALREADY_RUNNING
}
