package com.replyrelay.orchestrator.approval;

import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ApprovalState;
import com.replyrelay.orchestrator.domain.SubscriptionTag;
import java.time.Instant;

/** Snapshot of an approval record as the operator sees it. */
public record ApprovalCard(
    Long recordId,
    String conversationId,
    String senderName,
    String incomingText,
    String draftText,
    String draftFailure,
    SubscriptionTag tag,
    ApprovalState state,
    String finalText,
    Instant createdAt,
    Instant expiresAt,
    Instant remindAt) {

  public static ApprovalCard of(ApprovalRecordEntity record) {
    return new ApprovalCard(
        record.getId(),
        record.getConversationId(),
        record.getSenderName(),
        record.getIncomingText(),
        record.getDraftText(),
        record.getDraftFailure(),
        record.getSubscriptionTag(),
        record.getState(),
        record.getFinalText(),
        record.getCreatedAt(),
        record.getExpiresAt(),
        record.getRemindAt());
  }

  public boolean hasDraft() {
    return draftText != null && !draftText.isBlank();
  }
}
