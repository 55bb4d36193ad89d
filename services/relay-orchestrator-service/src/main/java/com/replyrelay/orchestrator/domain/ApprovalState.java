package com.replyrelay.orchestrator.domain;

/**
 * Lifecycle of an approval record.
 *
 * <p>{@code PENDING}, {@code APPROVED} and {@code EDITED} are open: the record still owns the
 * conversation's single approval slot. Everything else is terminal.
 */
public enum ApprovalState {
  PENDING,
  APPROVED,
  EDITED,
  BLOCKED,
  EXPIRED,
  REJECTED,
  SENT,
  DELIVERY_FAILED;

  public boolean isTerminal() {
    return this != PENDING && this != APPROVED && this != EDITED;
  }

  public boolean awaitsDelivery() {
    return this == APPROVED || this == EDITED;
  }
}
