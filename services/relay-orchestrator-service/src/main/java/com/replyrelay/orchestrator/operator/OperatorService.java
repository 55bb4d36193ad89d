package com.replyrelay.orchestrator.operator;

import com.replyrelay.orchestrator.approval.ApprovalCoordinator;
import com.replyrelay.orchestrator.common.web.ConflictException;
import com.replyrelay.orchestrator.common.web.NotFoundException;
import com.replyrelay.orchestrator.delivery.DeliveryExecutor;
import com.replyrelay.orchestrator.delivery.RetryOutcome;
import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.BlacklistEntryEntity;
import com.replyrelay.orchestrator.domain.ConversationEntity;
import com.replyrelay.orchestrator.domain.SubscriptionTag;
import com.replyrelay.orchestrator.repository.ApprovalRecordRepository;
import com.replyrelay.orchestrator.store.ConversationLocks;
import com.replyrelay.orchestrator.store.ConversationStore;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/** Operator commands shared by the Telegram command surface and the internal REST API. */
@Service
@RequiredArgsConstructor
public class OperatorService {

  private final ConversationStore store;
  private final ConversationLocks locks;
  private final TransactionTemplate tx;
  private final ApprovalCoordinator coordinator;
  private final ApprovalRecordRepository records;
  private final DeliveryExecutor delivery;

  public ConversationSummary conversation(String conversationId) {
    ConversationEntity conversation =
        store
            .find(conversationId)
            .orElseThrow(() -> new NotFoundException("Unknown conversation " + conversationId));
    Optional<ApprovalRecordEntity> open = records.findOpen(conversationId);
    return new ConversationSummary(
        conversation.getConversationId(),
        conversation.getDisplayName(),
        conversation.getSubscriptionTag(),
        store.isBlacklisted(conversationId),
        conversation.getLastMessageId(),
        conversation.getLastMessageAt(),
        open.map(ApprovalRecordEntity::getId).orElse(null),
        open.map(ApprovalRecordEntity::getState).orElse(null));
  }

  public SubscriptionTag setTag(String conversationId, String rawTag) {
    SubscriptionTag tag = SubscriptionTag.parse(rawTag);
    locks.run(
        conversationId, () -> tx.executeWithoutResult(s -> store.setTag(conversationId, tag)));
    return tag;
  }

  /** @return false when the conversation was already blacklisted */
  public boolean block(String conversationId, String reason) {
    requireId(conversationId);
    return coordinator.blockConversation(conversationId, reason);
  }

  public boolean unblock(String conversationId) {
    requireId(conversationId);
    return locks.withLock(conversationId, () -> tx.execute(s -> store.unblock(conversationId)));
  }

  public List<BlacklistEntryEntity> blacklist() {
    return store.blacklist();
  }

  public List<ApprovalRecordEntity> openApprovals() {
    return coordinator.openRecords();
  }

  public void retry(Long approvalId) {
    RetryOutcome outcome = delivery.retry(approvalId);
    switch (outcome) {
      case NOT_FOUND -> throw new NotFoundException("Unknown approval " + approvalId);
      case NOT_FAILED -> throw new ConflictException(
          "Approval " + approvalId + " is not in DeliveryFailed");
      case ALREADY_RUNNING -> throw new ConflictException(
          "Delivery for approval " + approvalId + " is already running");
      case SUBMITTED -> {}
    }
  }

  private static void requireId(String conversationId) {
    if (conversationId == null || conversationId.isBlank()) {
      throw new IllegalArgumentException("conversation id is required");
    }
  }
}
