package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "delivery_attempts")
public class DeliveryAttemptEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "approval_id", nullable = false)
  private Long approvalId;

  @Column(name = "attempt_number", nullable = false)
  private int attemptNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "outcome", nullable = false, length = 16)
  private AttemptOutcome outcome;

  @Column(name = "error_detail", length = 1024)
  private String errorDetail;

  @Column(name = "attempted_at", nullable = false)
  private Instant attemptedAt;

  protected DeliveryAttemptEntity() {}

  public DeliveryAttemptEntity(
      Long approvalId,
      int attemptNumber,
      AttemptOutcome outcome,
      String errorDetail,
      Instant attemptedAt) {
    this.approvalId = approvalId;
    this.attemptNumber = attemptNumber;
    this.outcome = outcome;
    this.errorDetail = truncate(errorDetail);
    this.attemptedAt = attemptedAt;
  }

  public Long getId() {
    return id;
  }

  public Long getApprovalId() {
    return approvalId;
  }

  public int getAttemptNumber() {
    return attemptNumber;
  }

  public AttemptOutcome getOutcome() {
    return outcome;
  }

  public String getErrorDetail() {
    return errorDetail;
  }

  public Instant getAttemptedAt() {
    return attemptedAt;
  }

  private static String truncate(String s) {
    if (s == null) return null;
    return s.length() <= 1024 ? s : s.substring(0, 1024);
  }
}
