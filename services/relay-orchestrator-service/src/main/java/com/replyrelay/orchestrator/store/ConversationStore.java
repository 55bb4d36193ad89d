package com.replyrelay.orchestrator.store;

import com.replyrelay.orchestrator.config.DraftProperties;
import com.replyrelay.orchestrator.domain.BlacklistEntryEntity;
import com.replyrelay.orchestrator.domain.ConversationEntity;
import com.replyrelay.orchestrator.domain.ConversationMessageEntity;
import com.replyrelay.orchestrator.domain.MessageDirection;
import com.replyrelay.orchestrator.domain.PollCursorEntity;
import com.replyrelay.orchestrator.domain.ProcessedMessageEntity;
import com.replyrelay.orchestrator.domain.ProcessingOutcome;
import com.replyrelay.orchestrator.domain.SubscriptionTag;
import com.replyrelay.orchestrator.repository.BlacklistEntryRepository;
import com.replyrelay.orchestrator.repository.ConversationMessageRepository;
import com.replyrelay.orchestrator.repository.ConversationRepository;
import com.replyrelay.orchestrator.repository.PollCursorRepository;
import com.replyrelay.orchestrator.repository.ProcessedMessageRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable per-conversation state: blacklist, subscription tag, recent message window, watermark
 * and the processed-message ledger.
 *
 * <p>Mutations are expected to run inside the conversation's critical section (see {@link
 * ConversationLocks}); each method joins the caller's transaction when there is one.
 */
@Service
@Slf4j
public class ConversationStore {

  public static final String INBOUND_CURSOR = "bridge-inbound";

  private final ConversationRepository conversations;
  private final ConversationMessageRepository messages;
  private final BlacklistEntryRepository blacklist;
  private final ProcessedMessageRepository processed;
  private final PollCursorRepository cursors;
  private final int windowSize;

  public ConversationStore(
      ConversationRepository conversations,
      ConversationMessageRepository messages,
      BlacklistEntryRepository blacklist,
      ProcessedMessageRepository processed,
      PollCursorRepository cursors,
      DraftProperties draftProperties) {
    this.conversations = conversations;
    this.messages = messages;
    this.blacklist = blacklist;
    this.processed = processed;
    this.cursors = cursors;
    this.windowSize = draftProperties.contextWindow();
  }

  @Transactional
  public ConversationEntity touch(String conversationId, String displayName) {
    Instant now = Instant.now();
    ConversationEntity conversation =
        conversations
            .findById(conversationId)
            .orElseGet(
                () -> conversations.save(new ConversationEntity(conversationId, displayName, now)));
    conversation.rename(displayName, now);
    return conversation;
  }

  @Transactional(readOnly = true)
  public Optional<ConversationEntity> find(String conversationId) {
    return conversations.findById(conversationId);
  }

  @Transactional(readOnly = true)
  public ConversationContext context(String conversationId) {
    Optional<ConversationEntity> conversation = conversations.findById(conversationId);
    List<ConversationMessageEntity> newest =
        messages.findNewest(conversationId, PageRequest.of(0, windowSize));
    List<ConversationContext.WindowMessage> window = new ArrayList<>(newest.size());
    for (int i = newest.size() - 1; i >= 0; i--) {
      ConversationMessageEntity m = newest.get(i);
      window.add(
          new ConversationContext.WindowMessage(m.getDirection(), m.getBody(), m.getOccurredAt()));
    }
    return new ConversationContext(
        conversationId,
        conversation.map(ConversationEntity::getDisplayName).orElse(null),
        window,
        conversation.map(ConversationEntity::getSubscriptionTag).orElse(SubscriptionTag.FREE),
        blacklist.existsById(conversationId));
  }

  /**
   * Appends to the recent window and evicts the oldest rows beyond the window size. A message id
   * that is already in the window is not appended twice.
   */
  @Transactional
  public void appendToWindow(
      String conversationId,
      String messageId,
      MessageDirection direction,
      String body,
      Instant at) {
    if (body == null || body.isBlank()) {
      return;
    }
    if (messageId != null
        && messages.existsByConversationIdAndMessageId(conversationId, messageId)) {
      return;
    }
    messages.save(new ConversationMessageEntity(conversationId, messageId, direction, body, at));
    List<ConversationMessageEntity> newest =
        messages.findNewest(conversationId, PageRequest.of(0, windowSize));
    if (newest.size() == windowSize) {
      messages.deleteOlderThan(conversationId, newest.get(windowSize - 1).getId());
    }
  }

  @Transactional(readOnly = true)
  public boolean isBlacklisted(String conversationId) {
    return blacklist.existsById(conversationId);
  }

  /** @return true when a new entry was created */
  @Transactional
  public boolean block(String conversationId, String reason) {
    if (blacklist.existsById(conversationId)) {
      return false;
    }
    blacklist.save(new BlacklistEntryEntity(conversationId, Instant.now(), reason));
    log.info("Conversation {} blacklisted (reason={})", conversationId, reason);
    return true;
  }

  @Transactional
  public boolean unblock(String conversationId) {
    if (!blacklist.existsById(conversationId)) {
      return false;
    }
    blacklist.deleteById(conversationId);
    log.info("Conversation {} removed from blacklist", conversationId);
    return true;
  }

  @Transactional(readOnly = true)
  public List<BlacklistEntryEntity> blacklist() {
    return blacklist.findAllByOrderByBlockedAtDesc();
  }

  @Transactional(readOnly = true)
  public SubscriptionTag tag(String conversationId) {
    return conversations
        .findById(conversationId)
        .map(ConversationEntity::getSubscriptionTag)
        .orElse(SubscriptionTag.FREE);
  }

  @Transactional
  public ConversationEntity setTag(String conversationId, SubscriptionTag tag) {
    ConversationEntity conversation = touch(conversationId, null);
    conversation.tag(tag, Instant.now());
    log.info("Conversation {} tagged {}", conversationId, tag.label());
    return conversation;
  }

  @Transactional(readOnly = true)
  public boolean isProcessed(String messageId) {
    return processed.existsById(messageId);
  }

  @Transactional(readOnly = true)
  public Set<String> processedAmong(Collection<String> messageIds) {
    if (messageIds.isEmpty()) {
      return Set.of();
    }
    return new HashSet<>(processed.findProcessedIds(messageIds));
  }

  /** Writes the ledger row and moves the conversation watermark past the message. */
  @Transactional
  public void markProcessed(
      String conversationId, String messageId, Instant receivedAt, ProcessingOutcome outcome) {
    Instant now = Instant.now();
    processed.save(new ProcessedMessageEntity(messageId, conversationId, outcome, now));
    conversations
        .findById(conversationId)
        .ifPresent(c -> c.advanceWatermark(messageId, receivedAt, now));
  }

  @Transactional(readOnly = true)
  public Optional<Instant> pollCursor() {
    return cursors.findById(INBOUND_CURSOR).map(PollCursorEntity::getLastReceivedAt);
  }

  @Transactional
  public void movePollCursor(Instant lastReceivedAt) {
    Instant now = Instant.now();
    cursors
        .findById(INBOUND_CURSOR)
        .ifPresentOrElse(
            c -> c.moveTo(lastReceivedAt, now),
            () -> cursors.save(new PollCursorEntity(INBOUND_CURSOR, lastReceivedAt, now)));
  }
}
