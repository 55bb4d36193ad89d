package com.replyrelay.orchestrator.delivery;

import com.replyrelay.orchestrator.approval.ApprovalCard;
import com.replyrelay.orchestrator.approval.ApprovalChannel;
import com.replyrelay.orchestrator.audit.AuditRow;
import com.replyrelay.orchestrator.audit.AuditStatus;
import com.replyrelay.orchestrator.audit.AuditTrail;
import com.replyrelay.orchestrator.config.DeliveryProperties;
import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ApprovalState;
import com.replyrelay.orchestrator.domain.AttemptOutcome;
import com.replyrelay.orchestrator.domain.DeliveryAttemptEntity;
import com.replyrelay.orchestrator.domain.MessageDirection;
import com.replyrelay.orchestrator.repository.ApprovalRecordRepository;
import com.replyrelay.orchestrator.repository.DeliveryAttemptRepository;
import com.replyrelay.orchestrator.store.ConversationLocks;
import com.replyrelay.orchestrator.store.ConversationStore;
import com.replyrelay.orchestrator.transport.SendResult;
import com.replyrelay.orchestrator.transport.TransportGateway;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Sends approved content through the transport with bounded exponential backoff.
 *
 * <p>Attempts for one record are strictly sequential and each one is stored as a delivery
 * attempt. Only one run per record is in flight at a time. The network calls happen outside the
 * conversation lock; the terminal state is written under it.
 */
@Service
@Slf4j
public class DeliveryExecutor {

  private final ApprovalRecordRepository records;
  private final DeliveryAttemptRepository attempts;
  private final ConversationStore store;
  private final ConversationLocks locks;
  private final TransactionTemplate tx;
  private final TransportGateway transport;
  private final ApprovalChannel channel;
  private final AuditTrail audit;
  private final ThreadPoolTaskExecutor executor;
  private final DeliveryProperties properties;
  private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

  public DeliveryExecutor(
      ApprovalRecordRepository records,
      DeliveryAttemptRepository attempts,
      ConversationStore store,
      ConversationLocks locks,
      TransactionTemplate tx,
      TransportGateway transport,
      ApprovalChannel channel,
      AuditTrail audit,
      @Qualifier("deliveryTaskExecutor") ThreadPoolTaskExecutor executor,
      DeliveryProperties properties) {
    this.records = records;
    this.attempts = attempts;
    this.store = store;
    this.locks = locks;
    this.tx = tx;
    this.transport = transport;
    this.channel = channel;
    this.audit = audit;
    this.executor = executor;
    this.properties = properties;
  }

  /** Queues a delivery run; false when one is already running for the record. */
  public boolean submit(Long approvalId) {
    if (!inFlight.add(approvalId)) {
      log.info("Delivery for approval {} already in flight", approvalId);
      return false;
    }
    try {
      executor.execute(
          () -> {
            try {
              deliver(approvalId);
            } catch (RuntimeException e) {
              log.error("Delivery run for approval {} failed unexpectedly", approvalId, e);
            } finally {
              inFlight.remove(approvalId);
            }
          });
      return true;
    } catch (TaskRejectedException e) {
      inFlight.remove(approvalId);
      log.warn("Delivery executor rejected approval {}: {}", approvalId, e.getMessage());
      return false;
    }
  }

  /** Re-runs delivery of a record that ended in DeliveryFailed; attempt numbers continue. */
  public RetryOutcome retry(Long approvalId) {
    Optional<ApprovalRecordEntity> record = records.findById(approvalId);
    if (record.isEmpty()) {
      return RetryOutcome.NOT_FOUND;
    }
    if (record.get().getState() != ApprovalState.DELIVERY_FAILED) {
      return RetryOutcome.NOT_FAILED;
    }
    log.info("Operator retry of delivery for approval {}", approvalId);
    return submit(approvalId) ? RetryOutcome.SUBMITTED : RetryOutcome.ALREADY_RUNNING;
  }

  public boolean isInFlight(Long approvalId) {
    return inFlight.contains(approvalId);
  }

  /** Runs delivery synchronously on the calling thread. */
  public DeliveryReport deliver(Long approvalId) {
    Optional<Job> loaded =
        tx.execute(
            status ->
                records
                    .findById(approvalId)
                    .filter(
                        r ->
                            r.getState().awaitsDelivery()
                                || r.getState() == ApprovalState.DELIVERY_FAILED)
                    .map(r -> new Job(r, attempts.lastAttemptNumber(approvalId) + 1)));
    if (loaded == null || loaded.isEmpty()) {
      log.info("Approval {} is not awaiting delivery, skipped", approvalId);
      return DeliveryReport.skipped(approvalId);
    }
    Job job = loaded.get();

    BackOffExecution backOff = backOff().start();
    SendResult last = null;
    int made = 0;
    for (int i = 0; i < properties.maxAttempts(); i++) {
      int attemptNumber = job.firstAttempt() + i;
      last = sendOnce(job);
      made++;
      attempts.save(
          new DeliveryAttemptEntity(
              approvalId,
              attemptNumber,
              last.success() ? AttemptOutcome.SUCCESS : AttemptOutcome.FAILURE,
              last.error(),
              Instant.now()));
      if (last.success()) {
        break;
      }
      log.warn(
          "Delivery attempt {} for approval {} to {} failed{}: {}",
          attemptNumber,
          approvalId,
          job.conversationId(),
          last.permanent() ? " permanently" : "",
          last.error());
      if (last.permanent() || i == properties.maxAttempts() - 1) {
        break;
      }
      long wait = backOff.nextBackOff();
      if (wait == BackOffExecution.STOP) {
        break;
      }
      try {
        Thread.sleep(wait);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Delivery for approval {} interrupted, left for recovery", approvalId);
        return new DeliveryReport(approvalId, made, null, "interrupted");
      }
    }
    return finish(job, made, last);
  }

  private DeliveryReport finish(Job job, int made, SendResult last) {
    boolean sent = last != null && last.success();
    ApprovalCard card =
        locks.withLock(
            job.conversationId(),
            () ->
                tx.execute(
                    status -> {
                      ApprovalRecordEntity record =
                          records.findById(job.approvalId()).orElseThrow();
                      Instant now = Instant.now();
                      ApprovalState before = record.getState();
                      if (sent) {
                        record.markSent(now);
                        store.appendToWindow(
                            record.getConversationId(),
                            null,
                            MessageDirection.OUTBOUND,
                            record.getFinalText(),
                            now);
                      } else if (before.awaitsDelivery()) {
                        record.markDeliveryFailed(now);
                      }
                      log.info(
                          "Approval {} for {}: {} -> {} after {} attempt(s)",
                          record.getId(),
                          record.getConversationId(),
                          before,
                          record.getState(),
                          made);
                      return ApprovalCard.of(record);
                    }));
    if (sent) {
      audit.record(rowFor(card, AuditStatus.SENT));
    } else {
      audit.record(rowFor(card, AuditStatus.DELIVERY_FAILED));
      notifyFailure(card, made, last);
    }
    updateCard(job, card);
    return new DeliveryReport(job.approvalId(), made, card.state(), sent ? null : last.error());
  }

  private SendResult sendOnce(Job job) {
    try {
      SendResult result =
          job.mediaRef() != null
              ? transport.sendMedia(job.conversationId(), job.mediaRef())
              : transport.send(job.conversationId(), job.finalText());
      return result == null ? SendResult.retryable("no result from transport") : result;
    } catch (RuntimeException e) {
      return SendResult.retryable(e.getMessage());
    }
  }

  private ExponentialBackOff backOff() {
    ExponentialBackOff backOff =
        new ExponentialBackOff(properties.initialBackoff().toMillis(), properties.multiplier());
    backOff.setMaxInterval(properties.maxBackoff().toMillis());
    return backOff;
  }

  private void notifyFailure(ApprovalCard card, int made, SendResult last) {
    String error = last == null || last.error() == null ? "unknown error" : last.error();
    try {
      channel.notifyOperator(
          "Delivery to "
              + card.senderName()
              + " failed after "
              + made
              + " attempt(s): "
              + error
              + "\nUse /retry "
              + card.recordId()
              + " to send again.");
    } catch (RuntimeException e) {
      log.warn("Failed to notify operator about approval {}: {}", card.recordId(), e.getMessage());
    }
  }

  private void updateCard(Job job, ApprovalCard card) {
    if (job.cardId() == null) {
      return;
    }
    try {
      channel.update(job.cardId(), card);
    } catch (RuntimeException e) {
      log.warn("Failed to update card for approval {}: {}", card.recordId(), e.getMessage());
    }
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

  private record Job(
      Long approvalId,
      String conversationId,
      String cardId,
      String finalText,
      String mediaRef,
      int firstAttempt) {

    Job(ApprovalRecordEntity record, int firstAttempt) {
      this(
          record.getId(),
          record.getConversationId(),
          record.getCardId(),
          record.getFinalText(),
          record.getMediaRef(),
          firstAttempt);
    }
  }
}
