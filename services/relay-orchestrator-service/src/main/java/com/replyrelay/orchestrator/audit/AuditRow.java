package com.replyrelay.orchestrator.audit;

import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import java.time.Instant;

public record AuditRow(
    Instant timestamp,
    String conversationId,
    String senderName,
    String incomingText,
    String draftText,
    AuditStatus status,
    String finalText) {

  public static AuditRow of(ApprovalRecordEntity record, AuditStatus status) {
    return new AuditRow(
        Instant.now(),
        record.getConversationId(),
        record.getSenderName(),
        record.getIncomingText(),
        record.getDraftText(),
        status,
        record.getFinalText());
  }
}
