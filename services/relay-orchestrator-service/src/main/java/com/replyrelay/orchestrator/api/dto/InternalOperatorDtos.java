package com.replyrelay.orchestrator.api.dto;

import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.BlacklistEntryEntity;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;

/** Internal operator API DTOs. */
public final class InternalOperatorDtos {
  private InternalOperatorDtos() {}

  public record SetTagRequest(@NotBlank String tag) {}

  public record SetTagResponse(String conversationId, String tag) {}

  public record BlockRequest(String reason) {}

  public record BlockResponse(String conversationId, boolean blacklisted, boolean changed) {}

  public record BlacklistEntryDto(String conversationId, Instant blockedAt, String reason) {
    public static BlacklistEntryDto of(BlacklistEntryEntity e) {
      return new BlacklistEntryDto(e.getConversationId(), e.getBlockedAt(), e.getReason());
    }
  }

  public record BlacklistResponse(List<BlacklistEntryDto> entries) {}

  public record ApprovalDto(
      Long id,
      String conversationId,
      String senderName,
      String state,
      String incomingText,
      String draftText,
      String finalText,
      Instant createdAt,
      Instant expiresAt) {
    public static ApprovalDto of(ApprovalRecordEntity r) {
      return new ApprovalDto(
          r.getId(),
          r.getConversationId(),
          r.getSenderName(),
          r.getState().name(),
          r.getIncomingText(),
          r.getDraftText(),
          r.getFinalText(),
          r.getCreatedAt(),
          r.getExpiresAt());
    }
  }

  public record OpenApprovalsResponse(List<ApprovalDto> approvals) {}

  public record RetryResponse(Long approvalId, boolean submitted) {}
}
