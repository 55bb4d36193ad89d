package com.replyrelay.orchestrator.approval;

import com.replyrelay.orchestrator.audit.AuditRow;
import com.replyrelay.orchestrator.audit.AuditStatus;
import com.replyrelay.orchestrator.audit.AuditTrail;
import com.replyrelay.orchestrator.config.ApprovalProperties;
import com.replyrelay.orchestrator.delivery.DeliveryExecutor;
import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ApprovalState;
import com.replyrelay.orchestrator.domain.MessageDirection;
import com.replyrelay.orchestrator.domain.ProcessingOutcome;
import com.replyrelay.orchestrator.draft.DraftResult;
import com.replyrelay.orchestrator.policy.PolicyFilter;
import com.replyrelay.orchestrator.repository.ApprovalRecordRepository;
import com.replyrelay.orchestrator.store.ConversationContext;
import com.replyrelay.orchestrator.store.ConversationLocks;
import com.replyrelay.orchestrator.store.ConversationStore;
import com.replyrelay.orchestrator.transport.InboundMessage;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the per-conversation approval slot.
 *
 * <p>Every read-modify-write of a conversation's records runs as one transaction inside that
 * conversation's lock, so an inbound message and an operator decision for the same conversation
 * never interleave. Channel, audit and delivery side effects run after the lock is released.
 *
 * <p>No public method throws: failures are logged and reported through the returned outcome.
 */
@Service
@Slf4j
public class ApprovalCoordinator {

  private static final EnumSet<ApprovalState> OPEN_STATES =
      EnumSet.of(ApprovalState.PENDING, ApprovalState.APPROVED, ApprovalState.EDITED);

  private final ApprovalRecordRepository records;
  private final ConversationStore store;
  private final PolicyFilter policy;
  private final ConversationLocks locks;
  private final TransactionTemplate tx;
  private final ApprovalChannel channel;
  private final DeliveryExecutor delivery;
  private final AuditTrail audit;
  private final ApprovalProperties properties;

  public ApprovalCoordinator(
      ApprovalRecordRepository records,
      ConversationStore store,
      PolicyFilter policy,
      ConversationLocks locks,
      TransactionTemplate tx,
      ApprovalChannel channel,
      DeliveryExecutor delivery,
      AuditTrail audit,
      ApprovalProperties properties) {
    this.records = records;
    this.store = store;
    this.policy = policy;
    this.locks = locks;
    this.tx = tx;
    this.channel = channel;
    this.delivery = delivery;
    this.audit = audit;
    this.properties = properties;
  }

  /**
   * First half of inbound processing. Drops duplicates and blacklisted senders, folds the message
   * into an open record when there is one, and otherwise appends it to the context window and
   * asks the caller for a draft.
   */
  public OfferOutcome admit(InboundMessage message) {
    String conversationId = message.conversationId();
    try {
      Step step =
          locks.withLock(
              conversationId,
              () ->
                  tx.execute(
                      status -> {
                        if (store.isProcessed(message.messageId())) {
                          return Step.of(OfferOutcome.of(OfferOutcome.Kind.DUPLICATE));
                        }
                        store.touch(conversationId, message.senderDisplayName());
                        if (!policy.isEligible(conversationId)) {
                          return Step.of(rejectByPolicy(message));
                        }
                        Optional<ApprovalRecordEntity> open = records.findOpen(conversationId);
                        if (open.isPresent()) {
                          return mergeOrDefer(open.get(), message);
                        }
                        // a held fragment read again is already in the window
                        ConversationContext context =
                            store.context(conversationId).before(message.receivedAt());
                        appendInbound(message);
                        return Step.of(OfferOutcome.needsDraft(context));
                      }));
      afterMerge(step);
      return step.outcome();
    } catch (RuntimeException e) {
      log.error("Failed to admit message {} in {}", message.messageId(), conversationId, e);
      return OfferOutcome.of(OfferOutcome.Kind.FAILED);
    }
  }

  public OfferOutcome offer(InboundMessage message, DraftResult draft) {
    return offer(List.of(message), draft);
  }

  /**
   * Second half of inbound processing: opens one Pending record for a burst of admitted messages
   * that were drafted together, or a manual-reply card when the draft failed. The blacklist and
   * the slot are checked again because the operator may have acted while the draft was being
   * generated.
   */
  public OfferOutcome offer(List<InboundMessage> burst, DraftResult draft) {
    if (burst.isEmpty()) {
      return OfferOutcome.of(OfferOutcome.Kind.DUPLICATE);
    }
    String conversationId = burst.get(0).conversationId();
    try {
      Step step =
          locks.withLock(
              conversationId,
              () ->
                  tx.execute(
                      status -> {
                        List<InboundMessage> fresh =
                            burst.stream().filter(m -> !store.isProcessed(m.messageId())).toList();
                        if (fresh.isEmpty()) {
                          return Step.of(OfferOutcome.of(OfferOutcome.Kind.DUPLICATE));
                        }
                        if (!policy.isEligible(conversationId)) {
                          fresh.forEach(this::rejectByPolicy);
                          return Step.of(OfferOutcome.of(OfferOutcome.Kind.POLICY_REJECTED));
                        }
                        Optional<ApprovalRecordEntity> open = records.findOpen(conversationId);
                        if (open.isPresent()) {
                          Step last = null;
                          for (InboundMessage m : fresh) {
                            last = mergeOrDefer(open.get(), m);
                            if (last.outcome().kind() == OfferOutcome.Kind.DEFERRED) {
                              break;
                            }
                          }
                          return last;
                        }
                        return openRecord(fresh, draft);
                      }));
      afterMerge(step);
      if (step.outcome().kind() == OfferOutcome.Kind.OPENED) {
        audit.record(step.auditRow());
        presentCard(step.outcome().recordId());
      }
      return step.outcome();
    } catch (RuntimeException e) {
      log.error(
          "Failed to open approval for {} message(s) in {}", burst.size(), conversationId, e);
      return OfferOutcome.of(OfferOutcome.Kind.FAILED);
    }
  }

  /**
   * Swaps in a draft that also covers text merged into a Pending record. Ignored once the
   * operator has decided, and when the new draft failed.
   */
  public boolean redraft(Long recordId, DraftResult draft) {
    if (recordId == null || draft == null || !draft.succeeded()) {
      return false;
    }
    Optional<ApprovalRecordEntity> found = records.findById(recordId);
    if (found.isEmpty()) {
      return false;
    }
    try {
      ApprovalRecordEntity updated =
          locks.withLock(
              found.get().getConversationId(),
              () ->
                  tx.execute(
                      status -> {
                        ApprovalRecordEntity record = records.findById(recordId).orElseThrow();
                        if (record.getState() != ApprovalState.PENDING) {
                          return null;
                        }
                        record.replaceDraft(draft.text());
                        return record;
                      }));
      if (updated == null) {
        log.debug("Redraft for approval {} dropped, already decided", recordId);
        return false;
      }
      log.info("Approval {} redrafted to cover newer messages", recordId);
      if (updated.getCardId() != null) {
        updateCard(updated.getCardId(), ApprovalCard.of(updated));
      }
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to redraft approval {}", recordId, e);
      return false;
    }
  }

  /** Settles a message without a card, e.g. when its audio could not be transcribed. */
  public OfferOutcome discard(InboundMessage message, ProcessingOutcome reason) {
    try {
      return locks.withLock(
          message.conversationId(),
          () ->
              tx.execute(
                  status -> {
                    if (store.isProcessed(message.messageId())) {
                      return OfferOutcome.of(OfferOutcome.Kind.DUPLICATE);
                    }
                    store.touch(message.conversationId(), message.senderDisplayName());
                    store.markProcessed(
                        message.conversationId(),
                        message.messageId(),
                        message.receivedAt(),
                        reason);
                    log.info(
                        "Message {} in {} discarded: {}",
                        message.messageId(),
                        message.conversationId(),
                        reason);
                    return OfferOutcome.of(OfferOutcome.Kind.DISCARDED);
                  }));
    } catch (RuntimeException e) {
      log.error("Failed to discard message {}", message.messageId(), e);
      return OfferOutcome.of(OfferOutcome.Kind.FAILED);
    }
  }

  public DecisionOutcome decide(Decision decision) {
    String problem = decision == null ? "no decision" : decision.problem();
    if (problem != null) {
      log.warn("Malformed decision dropped: {}", problem);
      return DecisionOutcome.of(DecisionOutcome.Status.MALFORMED, null, null, problem);
    }
    Optional<ApprovalRecordEntity> found;
    try {
      found =
          decision.recordId() != null
              ? records.findById(decision.recordId())
              : records.findByCardId(decision.cardId());
    } catch (RuntimeException e) {
      log.error("Failed to look up record for decision {}", decision, e);
      return DecisionOutcome.of(
          DecisionOutcome.Status.FAILED, decision.recordId(), null, e.getMessage());
    }
    if (found.isEmpty()) {
      log.warn("Decision {} references an unknown record", decision.kind());
      return DecisionOutcome.of(
          DecisionOutcome.Status.NOT_FOUND, decision.recordId(), null, "unknown approval");
    }
    Long recordId = found.get().getId();
    String conversationId = found.get().getConversationId();
    try {
      Resolution resolution =
          locks.withLock(conversationId, () -> tx.execute(status -> apply(recordId, decision)));
      if (resolution.outcome().applied()) {
        afterResolution(resolution.card());
      }
      return resolution.outcome();
    } catch (RuntimeException e) {
      log.error("Failed to apply {} to approval {}", decision.kind(), recordId, e);
      return DecisionOutcome.of(DecisionOutcome.Status.FAILED, recordId, null, e.getMessage());
    }
  }

  /**
   * Operator block by conversation id: blacklists it and resolves an open Pending card as Blocked.
   *
   * @return false when the conversation was already blacklisted
   */
  public boolean blockConversation(String conversationId, String reason) {
    Resolution resolution;
    try {
      resolution = blockUnderLock(conversationId, reason);
    } catch (RuntimeException e) {
      log.error("Failed to block conversation {}", conversationId, e);
      return false;
    }
    if (resolution.card() != null) {
      afterResolution(resolution.card());
    }
    return resolution.outcome().status() == DecisionOutcome.Status.APPLIED;
  }

  private Resolution blockUnderLock(String conversationId, String reason) {
    return locks.withLock(
        conversationId,
        () ->
            tx.execute(
                status -> {
                  store.touch(conversationId, null);
                  boolean created = store.block(conversationId, reason);
                  Optional<ApprovalRecordEntity> open =
                      records
                          .findOpen(conversationId)
                          .filter(r -> r.getState() == ApprovalState.PENDING);
                  if (open.isEmpty()) {
                    DecisionOutcome.Status result =
                        created ? DecisionOutcome.Status.APPLIED : DecisionOutcome.Status.DUPLICATE;
                    return new Resolution(DecisionOutcome.of(result, null, null, null), null);
                  }
                  ApprovalRecordEntity record = open.get();
                  record.block(Instant.now());
                  logTransition(record, ApprovalState.PENDING);
                  return new Resolution(
                      DecisionOutcome.of(
                          DecisionOutcome.Status.APPLIED, record.getId(), record.getState(), null),
                      ApprovalCard.of(record));
                }));
  }

  /** Closes every Pending record whose TTL has passed at {@code now}. */
  public int expireOverdue(Instant now) {
    int expired = 0;
    for (Long id : records.findExpiredPendingIds(now)) {
      Optional<ApprovalRecordEntity> candidate = records.findById(id);
      if (candidate.isEmpty()) {
        continue;
      }
      try {
        ApprovalCard card =
            locks.withLock(
                candidate.get().getConversationId(),
                () ->
                    tx.execute(
                        status -> {
                          ApprovalRecordEntity record = records.findById(id).orElseThrow();
                          if (!record.isExpired(now)) {
                            return null;
                          }
                          record.expire(now);
                          logTransition(record, ApprovalState.PENDING);
                          return ApprovalCard.of(record);
                        }));
        if (card != null) {
          expired++;
          afterResolution(card);
        }
      } catch (RuntimeException e) {
        log.error("Failed to expire approval {}", id, e);
      }
    }
    return expired;
  }

  /** Presents a fresh card for every record put off with "Reply later" whose time has come. */
  public int remindDue(Instant now) {
    int reminded = 0;
    for (Long id : records.findDueReminderIds(now)) {
      Optional<ApprovalRecordEntity> candidate = records.findById(id);
      if (candidate.isEmpty()) {
        continue;
      }
      try {
        Boolean due =
            locks.withLock(
                candidate.get().getConversationId(),
                () ->
                    tx.execute(
                        status -> {
                          ApprovalRecordEntity record = records.findById(id).orElseThrow();
                          if (record.getState() != ApprovalState.PENDING
                              || record.getRemindAt() == null
                              || record.getRemindAt().isAfter(now)) {
                            return false;
                          }
                          record.remindNow();
                          return true;
                        }));
        if (Boolean.TRUE.equals(due)) {
          log.info("Reminder due for approval {}", id);
          // a failed present is picked up by presentMissingCards
          if (presentCard(id)) {
            reminded++;
          }
        }
      } catch (RuntimeException e) {
        log.error("Failed to remind approval {}", id, e);
      }
    }
    return reminded;
  }

  /** Presents Pending records whose card never reached the operator. */
  public int presentMissingCards() {
    int presented = 0;
    for (Long id : records.findPendingWithoutCard()) {
      if (presentCard(id)) {
        presented++;
      }
    }
    return presented;
  }

  public List<ApprovalRecordEntity> openRecords() {
    return records.findByStateInOrderByCreatedAtAsc(OPEN_STATES);
  }

  public Optional<ApprovalRecordEntity> find(Long recordId) {
    return records.findById(recordId);
  }

  private OfferOutcome rejectByPolicy(InboundMessage message) {
    store.markProcessed(
        message.conversationId(),
        message.messageId(),
        message.receivedAt(),
        ProcessingOutcome.POLICY_REJECTED);
    log.info(
        "Message {} from blacklisted conversation {} dropped",
        message.messageId(),
        message.conversationId());
    return OfferOutcome.of(OfferOutcome.Kind.POLICY_REJECTED);
  }

  /**
   * A Pending record absorbs the message. A record that is already approved and awaiting delivery
   * cannot show it to the operator any more, so the message waits until delivery settles.
   */
  private Step mergeOrDefer(ApprovalRecordEntity open, InboundMessage message) {
    if (open.getState() != ApprovalState.PENDING) {
      log.debug(
          "Message {} deferred, approval {} for {} is {}",
          message.messageId(),
          open.getId(),
          message.conversationId(),
          open.getState());
      return Step.of(OfferOutcome.of(OfferOutcome.Kind.DEFERRED, open.getId()));
    }
    ConversationContext context = store.context(message.conversationId());
    appendInbound(message);
    open.appendIncoming(message.body());
    store.markProcessed(
        message.conversationId(),
        message.messageId(),
        message.receivedAt(),
        ProcessingOutcome.MERGED_INTO_PENDING);
    log.info(
        "Message {} merged into open approval {} for {}",
        message.messageId(),
        open.getId(),
        message.conversationId());
    OfferOutcome outcome = OfferOutcome.merged(open.getId(), context);
    return open.getCardId() != null
        ? new Step(outcome, ApprovalCard.of(open), open.getCardId(), null)
        : Step.of(outcome);
  }

  private Step openRecord(List<InboundMessage> burst, DraftResult draft) {
    Instant now = Instant.now();
    InboundMessage first = burst.get(0);
    InboundMessage combined = InboundMessage.combine(burst);
    ApprovalRecordEntity record =
        records.saveAndFlush(
            ApprovalRecordEntity.open(
                combined.conversationId(),
                first.messageId(),
                combined.senderOrConversation(),
                policy.tag(combined.conversationId()),
                combined.body(),
                draft.text(),
                draft.failureSummary(),
                now,
                now.plus(properties.ttl())));
    ProcessingOutcome outcome =
        draft.succeeded() ? ProcessingOutcome.QUEUED_FOR_APPROVAL : ProcessingOutcome.DRAFT_FAILED;
    for (InboundMessage m : burst) {
      store.markProcessed(m.conversationId(), m.messageId(), m.receivedAt(), outcome);
    }
    log.info(
        "Approval {} opened for {} ({} message(s) from {}, draft {})",
        record.getId(),
        combined.conversationId(),
        burst.size(),
        first.messageId(),
        draft.succeeded() ? "ready" : "failed");
    return new Step(
        OfferOutcome.of(OfferOutcome.Kind.OPENED, record.getId()),
        null,
        null,
        AuditRow.of(record, AuditStatus.PENDING));
  }

  private Resolution apply(Long recordId, Decision decision) {
    ApprovalRecordEntity record = records.findById(recordId).orElseThrow();
    ApprovalState before = record.getState();
    if (before != ApprovalState.PENDING) {
      log.info(
          "Duplicate {} for approval {} ignored, record is already {}",
          decision.kind(),
          recordId,
          before);
      return new Resolution(
          DecisionOutcome.of(DecisionOutcome.Status.DUPLICATE, recordId, before, null), null);
    }
    Instant now = Instant.now();
    switch (decision.kind()) {
      case APPROVE -> {
        if (!record.hasDraft()) {
          return new Resolution(
              DecisionOutcome.of(
                  DecisionOutcome.Status.REFUSED, recordId, before, "no draft to approve"),
              null);
        }
        record.approve(now);
      }
      case EDIT -> record.edit(decision.text().trim(), now);
      case RECORD_OWN -> record.recordOwn(decision.mediaRef(), now);
      case SEND_MEDIA -> record.replyWithMedia(decision.mediaRef(), mediaLabel(decision), now);
      case REPLY_LATER -> {
        Instant remindAt = now.plus(properties.replyLaterDelay());
        record.replyLater(remindAt, remindAt.plus(properties.ttl()));
        log.info("Approval {} put off until {}", recordId, remindAt);
      }
      case BLOCK -> {
        record.block(now);
        store.block(record.getConversationId(), "blocked from approval card");
      }
      case REJECT -> record.reject(now);
    }
    if (record.getState() != before) {
      logTransition(record, before);
    }
    return new Resolution(
        DecisionOutcome.of(DecisionOutcome.Status.APPLIED, recordId, record.getState(), null),
        ApprovalCard.of(record));
  }

  private static String mediaLabel(Decision decision) {
    return decision.text() == null || decision.text().isBlank() ? "[Media]" : decision.text();
  }

  private void appendInbound(InboundMessage message) {
    store.appendToWindow(
        message.conversationId(),
        message.messageId(),
        MessageDirection.INBOUND,
        message.body(),
        message.receivedAt());
  }

  private void afterMerge(Step step) {
    if (step.refreshCardId() != null) {
      updateCard(step.refreshCardId(), step.refreshCard());
    }
  }

  private void afterResolution(ApprovalCard card) {
    ApprovalState state = card.state();
    if (state.awaitsDelivery()) {
      delivery.submit(card.recordId());
    } else if (state == ApprovalState.BLOCKED) {
      audit.record(rowFor(card, AuditStatus.BLOCKED));
    } else if (state == ApprovalState.REJECTED) {
      audit.record(rowFor(card, AuditStatus.REJECTED));
    } else if (state == ApprovalState.EXPIRED) {
      audit.record(rowFor(card, AuditStatus.EXPIRED));
    }
    records
        .findById(card.recordId())
        .map(ApprovalRecordEntity::getCardId)
        .ifPresent(cardId -> updateCard(cardId, card));
  }

  private void updateCard(String cardId, ApprovalCard card) {
    try {
      channel.update(cardId, card);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to update card {} for approval {}: {}", cardId, card.recordId(), e.getMessage());
    }
  }

  private boolean presentCard(Long recordId) {
    Optional<ApprovalRecordEntity> record = records.findById(recordId);
    if (record.isEmpty() || record.get().getState() != ApprovalState.PENDING) {
      return false;
    }
    String cardId;
    try {
      cardId = channel.present(ApprovalCard.of(record.get()));
    } catch (RuntimeException e) {
      log.warn("Failed to present approval {}: {}", recordId, e.getMessage());
      return false;
    }
    if (cardId == null) {
      log.warn("Approval {} not presented; will retry on the next sweep", recordId);
      return false;
    }
    locks.run(
        record.get().getConversationId(),
        () ->
            tx.executeWithoutResult(
                status -> records.findById(recordId).ifPresent(r -> r.assignCard(cardId))));
    return true;
  }

  private static AuditRow rowFor(ApprovalCard card, AuditStatus status) {
    return new AuditRow(
        Instant.now(),
        card.conversationId(),
        card.senderName(),
        card.incomingText(),
        card.draftText(),
        status,
        card.finalText());
  }

  private static void logTransition(ApprovalRecordEntity record, ApprovalState before) {
    log.info(
        "Approval {} for {}: {} -> {}",
        record.getId(),
        record.getConversationId(),
        before,
        record.getState());
  }

  private record Step(
      OfferOutcome outcome, ApprovalCard refreshCard, String refreshCardId, AuditRow auditRow) {
    static Step of(OfferOutcome outcome) {
      return new Step(outcome, null, null, null);
    }
  }

  private record Resolution(DecisionOutcome outcome, ApprovalCard card) {}
}
