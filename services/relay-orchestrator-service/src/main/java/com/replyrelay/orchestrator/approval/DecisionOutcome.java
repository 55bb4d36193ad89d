package com.replyrelay.orchestrator.approval;

import com.replyrelay.orchestrator.domain.ApprovalState;

public record DecisionOutcome(Status status, Long recordId, ApprovalState state, String detail) {

  public enum Status {
    APPLIED,
    /** The record was already resolved; the decision is acknowledged and ignored. */
    DUPLICATE,
    NOT_FOUND,
    /** Well formed but not allowed, e.g. approving an empty draft. */
    REFUSED,
    MALFORMED,
    FAILED
  }

  static DecisionOutcome of(Status status, Long recordId, ApprovalState state, String detail) {
    return new DecisionOutcome(status, recordId, state, detail);
  }

  public boolean applied() {
    return status == Status.APPLIED;
  }
}
