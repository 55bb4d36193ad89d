package com.replyrelay.orchestrator.audit;

public enum AuditStatus {
  PENDING("Pending"),
  SENT("Sent"),
  DELIVERY_FAILED("DeliveryFailed"),
  BLOCKED("Blocked"),
  EXPIRED("Expired"),
  REJECTED("Rejected");

  private final String label;

  AuditStatus(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
