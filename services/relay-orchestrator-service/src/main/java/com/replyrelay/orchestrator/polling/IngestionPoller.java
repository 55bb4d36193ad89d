package com.replyrelay.orchestrator.polling;

import com.replyrelay.orchestrator.approval.ApprovalCoordinator;
import com.replyrelay.orchestrator.approval.OfferOutcome;
import com.replyrelay.orchestrator.common.RelayException;
import com.replyrelay.orchestrator.config.DraftProperties;
import com.replyrelay.orchestrator.config.PollerProperties;
import com.replyrelay.orchestrator.domain.ProcessingOutcome;
import com.replyrelay.orchestrator.draft.DraftGeneratorAdapter;
import com.replyrelay.orchestrator.draft.DraftResult;
import com.replyrelay.orchestrator.policy.PolicyFilter;
import com.replyrelay.orchestrator.store.ConversationStore;
import com.replyrelay.orchestrator.transport.InboundMessage;
import com.replyrelay.orchestrator.transport.TransportGateway;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * The driving loop. Each tick reads new inbound messages from the transport log, processes
 * conversations in parallel and the messages of one conversation in arrival order, then moves
 * the persisted poll cursor.
 *
 * <p>The cursor only moves past messages that are settled. Anything unfinished is read again on
 * the next tick, and the processed-message ledger keeps re-reads from being processed twice.
 */
@Service
@Slf4j
public class IngestionPoller {

  private final TransportGateway transport;
  private final ConversationStore store;
  private final PolicyFilter policy;
  private final MessageBodyResolver bodyResolver;
  private final MediaForwarder mediaForwarder;
  private final DraftGeneratorAdapter drafts;
  private final ApprovalCoordinator coordinator;
  private final ThreadPoolTaskExecutor workers;
  private final PollerProperties properties;
  private final DraftProperties draftProperties;

  private final AtomicBoolean ticking = new AtomicBoolean(false);
  private final Set<String> busyConversations = ConcurrentHashMap.newKeySet();

  public IngestionPoller(
      TransportGateway transport,
      ConversationStore store,
      PolicyFilter policy,
      MessageBodyResolver bodyResolver,
      MediaForwarder mediaForwarder,
      DraftGeneratorAdapter drafts,
      ApprovalCoordinator coordinator,
      @Qualifier("relayWorkerExecutor") ThreadPoolTaskExecutor workers,
      PollerProperties properties,
      DraftProperties draftProperties) {
    this.transport = transport;
    this.store = store;
    this.policy = policy;
    this.bodyResolver = bodyResolver;
    this.mediaForwarder = mediaForwarder;
    this.drafts = drafts;
    this.coordinator = coordinator;
    this.workers = workers;
    this.properties = properties;
    this.draftProperties = draftProperties;
  }

  /** One poll cycle. Never throws; a failed read is retried on the next tick. */
  public TickReport tick() {
    if (!ticking.compareAndSet(false, true)) {
      return TickReport.EMPTY;
    }
    try {
      return doTick();
    } catch (RuntimeException e) {
      log.error("Poll tick failed", e);
      return TickReport.EMPTY;
    } finally {
      ticking.set(false);
    }
  }

  private TickReport doTick() {
    Optional<Instant> stored = store.pollCursor();
    if (stored.isEmpty()) {
      // First start: history before now is not relayed.
      store.movePollCursor(Instant.now());
      log.info("Poll cursor initialised");
      return TickReport.EMPTY;
    }
    Instant cursor = stored.get();

    List<InboundMessage> batch;
    try {
      batch = transport.readInboundSince(cursor, properties.batchLimit());
    } catch (RelayException e) {
      log.warn("Transport read failed, retrying next tick: {}", e.getMessage());
      return TickReport.EMPTY;
    }
    if (batch.isEmpty()) {
      return TickReport.EMPTY;
    }

    Set<String> done =
        store.processedAmong(batch.stream().map(InboundMessage::messageId).toList());
    Map<String, List<InboundMessage>> byConversation = new LinkedHashMap<>();
    for (InboundMessage m : batch) {
      if (!done.contains(m.messageId())) {
        byConversation.computeIfAbsent(m.conversationId(), k -> new ArrayList<>()).add(m);
      }
    }

    Set<String> settled = ConcurrentHashMap.newKeySet();
    settled.addAll(done);
    List<CompletableFuture<Void>> running = new ArrayList<>();
    for (Map.Entry<String, List<InboundMessage>> entry : byConversation.entrySet()) {
      String conversationId = entry.getKey();
      if (!busyConversations.add(conversationId)) {
        log.debug("Conversation {} still busy from an earlier tick", conversationId);
        continue;
      }
      List<InboundMessage> messages = entry.getValue();
      messages.sort(Comparator.comparing(InboundMessage::receivedAt));
      try {
        running.add(
            CompletableFuture.runAsync(
                () -> {
                  try {
                    processConversation(messages, settled);
                  } finally {
                    busyConversations.remove(conversationId);
                  }
                },
                workers));
      } catch (RuntimeException e) {
        busyConversations.remove(conversationId);
        log.warn("Could not schedule conversation {}: {}", conversationId, e.getMessage());
      }
    }
    awaitAll(running);

    Instant next = nextCursor(cursor, batch, settled);
    if (next.isAfter(cursor)) {
      store.movePollCursor(next);
    }
    int unsettled = (int) batch.stream().filter(m -> !settled.contains(m.messageId())).count();
    if (unsettled > 0) {
      log.info("Tick read {} message(s), {} left for the next tick", batch.size(), unsettled);
    }
    return new TickReport(batch.size(), batch.size() - unsettled);
  }

  /**
   * Messages that need a draft are collected into a burst and drafted as one. A burst whose newest
   * fragment is younger than the batch window is left for a later tick.
   */
  private void processConversation(List<InboundMessage> messages, Set<String> settled) {
    List<Admission> burst = new ArrayList<>();
    for (InboundMessage message : messages) {
      Admission admission;
      try {
        admission = admit(message);
      } catch (RuntimeException e) {
        log.error("Processing of message {} failed", message.messageId(), e);
        return;
      }
      if (admission.outcome().kind() == OfferOutcome.Kind.NEEDS_DRAFT) {
        burst.add(admission);
        continue;
      }
      if (!flush(burst, settled)) {
        return;
      }
      if (!admission.outcome().settled()) {
        // Later messages of this conversation wait so arrival order is kept.
        return;
      }
      settled.add(message.messageId());
      afterMerge(admission);
    }
    if (burst.isEmpty()) {
      return;
    }
    InboundMessage newest = burst.get(burst.size() - 1).message();
    if (stillTyping(newest)) {
      log.debug(
          "Holding {} fragment(s) of {} until the conversation is quiet",
          burst.size(),
          newest.conversationId());
      return;
    }
    flush(burst, settled);
  }

  /** Policy first, so nothing is downloaded or transcribed for a blacklisted sender. */
  private Admission admit(InboundMessage raw) {
    if (!policy.isEligible(raw.conversationId())) {
      return new Admission(raw, coordinator.admit(raw));
    }
    Optional<InboundMessage> resolved = bodyResolver.resolve(raw);
    if (resolved.isEmpty()) {
      return new Admission(raw, coordinator.discard(raw, ProcessingOutcome.TRANSCRIPTION_FAILED));
    }
    return new Admission(resolved.get(), coordinator.admit(resolved.get()));
  }

  /** Drafts and offers a burst; true when every fragment is settled. */
  private boolean flush(List<Admission> burst, Set<String> settled) {
    if (burst.isEmpty()) {
      return true;
    }
    List<InboundMessage> fragments = burst.stream().map(Admission::message).toList();
    InboundMessage combined = InboundMessage.combine(fragments);
    DraftResult draft = drafts.generate(burst.get(0).outcome().context(), combined);
    OfferOutcome offered = coordinator.offer(fragments, draft);
    if (!offered.settled()) {
      return false;
    }
    boolean carded =
        offered.kind() == OfferOutcome.Kind.OPENED || offered.kind() == OfferOutcome.Kind.MERGED;
    for (InboundMessage fragment : fragments) {
      settled.add(fragment.messageId());
      if (carded) {
        mediaForwarder.forward(fragment, offered.recordId());
      }
    }
    if (offered.kind() == OfferOutcome.Kind.MERGED) {
      redraft(offered, combined);
    }
    burst.clear();
    return true;
  }

  private void afterMerge(Admission admission) {
    OfferOutcome outcome = admission.outcome();
    if (outcome.kind() != OfferOutcome.Kind.MERGED) {
      return;
    }
    mediaForwarder.forward(admission.message(), outcome.recordId());
    redraft(outcome, admission.message());
  }

  private void redraft(OfferOutcome merged, InboundMessage message) {
    if (!draftProperties.redraftOnMerge() || merged.context() == null) {
      return;
    }
    coordinator.redraft(merged.recordId(), drafts.generate(merged.context(), message));
  }

  private boolean stillTyping(InboundMessage newest) {
    Duration window = properties.batchWindow();
    return !window.isZero() && newest.receivedAt().plus(window).isAfter(Instant.now());
  }

  private void awaitAll(List<CompletableFuture<Void>> running) {
    if (running.isEmpty()) {
      return;
    }
    try {
      CompletableFuture.allOf(running.toArray(new CompletableFuture[0]))
          .get(properties.tickTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn(
          "Tick did not finish within {}; unfinished messages are re-read",
          properties.tickTimeout());
    } catch (ExecutionException e) {
      log.error("Conversation worker failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Max received time when everything settled, otherwise the earliest unsettled message so it is
   * read again. Never moves backwards.
   */
  static Instant nextCursor(Instant current, List<InboundMessage> batch, Set<String> settled) {
    Instant earliestOpen = null;
    Instant latest = current;
    for (InboundMessage m : batch) {
      if (m.receivedAt().isAfter(latest)) {
        latest = m.receivedAt();
      }
      if (!settled.contains(m.messageId())
          && (earliestOpen == null || m.receivedAt().isBefore(earliestOpen))) {
        earliestOpen = m.receivedAt();
      }
    }
    Instant next = earliestOpen == null ? latest : earliestOpen;
    return next.isBefore(current) ? current : next;
  }

  private record Admission(InboundMessage message, OfferOutcome outcome) {}

  public record TickReport(int read, int settled) {
    static final TickReport EMPTY = new TickReport(0, 0);
  }
}
