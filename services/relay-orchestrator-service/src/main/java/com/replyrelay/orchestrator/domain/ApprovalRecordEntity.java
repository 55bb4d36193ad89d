package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

/**
 * One operator decision request for one conversation.
 *
 * <p>{@code openConversationId} mirrors {@code conversationId} while the record is open and is
 * cleared on every terminal transition. The column is unique, so the database refuses a second
 * open record for the same conversation.
 */
@Entity
@Table(name = "approval_records")
public class ApprovalRecordEntity {

  public static final String VOICE_PLACEHOLDER = "[Voice Message]";

  private static final int TEXT_LIMIT = 8000;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "conversation_id", nullable = false, length = 128)
  private String conversationId;

  @Column(name = "open_conversation_id", unique = true, length = 128)
  private String openConversationId;

  @Column(name = "source_message_id", nullable = false, length = 128)
  private String sourceMessageId;

  @Column(name = "sender_name", length = 256)
  private String senderName;

  @Enumerated(EnumType.STRING)
  @Column(name = "subscription_tag", nullable = false, length = 16)
  private SubscriptionTag subscriptionTag;

  @Column(name = "incoming_text", nullable = false, length = TEXT_LIMIT)
  private String incomingText;

  @Column(name = "draft_text", nullable = false, length = TEXT_LIMIT)
  private String draftText;

  @Column(name = "draft_failure", length = 512)
  private String draftFailure;

  @Enumerated(EnumType.STRING)
  @Column(name = "state", nullable = false, length = 32)
  private ApprovalState state;

  @Column(name = "card_id", length = 128)
  private String cardId;

  @Column(name = "final_text", length = TEXT_LIMIT)
  private String finalText;

  @Column(name = "media_ref", length = 1024)
  private String mediaRef;

  @Column(name = "remind_at")
  private Instant remindAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "decided_at")
  private Instant decidedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  protected ApprovalRecordEntity() {}

  private ApprovalRecordEntity(
      String conversationId,
      String sourceMessageId,
      String senderName,
      SubscriptionTag subscriptionTag,
      String incomingText,
      String draftText,
      String draftFailure,
      Instant createdAt,
      Instant expiresAt) {
    this.conversationId = conversationId;
    this.openConversationId = conversationId;
    this.sourceMessageId = sourceMessageId;
    this.senderName = senderName;
    this.subscriptionTag = subscriptionTag;
    this.incomingText = clip(incomingText);
    this.draftText = draftText == null ? "" : clip(draftText);
    this.draftFailure = draftFailure == null ? null : clip(draftFailure, 512);
    this.state = ApprovalState.PENDING;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  /** Opens a Pending record. A null or empty draft yields a manual-reply card. */
  public static ApprovalRecordEntity open(
      String conversationId,
      String sourceMessageId,
      String senderName,
      SubscriptionTag tag,
      String incomingText,
      String draftText,
      String draftFailure,
      Instant now,
      Instant expiresAt) {
    return new ApprovalRecordEntity(
        conversationId,
        sourceMessageId,
        senderName,
        tag,
        incomingText,
        draftText,
        draftFailure,
        now,
        expiresAt);
  }

  public Long getId() {
    return id;
  }

  public String getConversationId() {
    return conversationId;
  }

  public String getSourceMessageId() {
    return sourceMessageId;
  }

  public String getSenderName() {
    return senderName;
  }

  public SubscriptionTag getSubscriptionTag() {
    return subscriptionTag;
  }

  public String getIncomingText() {
    return incomingText;
  }

  public String getDraftText() {
    return draftText;
  }

  public String getDraftFailure() {
    return draftFailure;
  }

  public ApprovalState getState() {
    return state;
  }

  public String getCardId() {
    return cardId;
  }

  public String getFinalText() {
    return finalText;
  }

  /** Local path of a voice note or file sent instead of text, if any. */
  public String getMediaRef() {
    return mediaRef;
  }

  public Instant getRemindAt() {
    return remindAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getDecidedAt() {
    return decidedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }

  public boolean isOpen() {
    return !state.isTerminal();
  }

  public boolean hasDraft() {
    return draftText != null && !draftText.isBlank();
  }

  public boolean isExpired(Instant now) {
    return state == ApprovalState.PENDING && !expiresAt.isAfter(now);
  }

  public void assignCard(String cardId) {
    this.cardId = cardId;
  }

  /** Folds a newer inbound message into an open record. */
  public void appendIncoming(String text) {
    requireState(ApprovalState.PENDING);
    this.incomingText = clip(incomingText + "\n" + text);
  }

  /** Swaps in a draft that also covers text merged after the card was opened. */
  public void replaceDraft(String text) {
    requireState(ApprovalState.PENDING);
    this.draftText = clip(text);
    this.draftFailure = null;
  }

  /**
   * Operator asked to be reminded later. The record stays Pending and its expiry is pushed out so
   * it cannot lapse before the reminder.
   */
  public void replyLater(Instant remindAt, Instant notExpiringBefore) {
    requireState(ApprovalState.PENDING);
    this.remindAt = remindAt;
    if (expiresAt.isBefore(notExpiringBefore)) {
      this.expiresAt = notExpiringBefore;
    }
  }

  /** Reminder is due: the current card is dropped so a fresh one is presented. */
  public void remindNow() {
    requireState(ApprovalState.PENDING);
    this.remindAt = null;
    this.cardId = null;
  }

  public void approve(Instant now) {
    requireState(ApprovalState.PENDING);
    if (!hasDraft()) {
      throw new IllegalStateException("record " + id + " has no draft to approve");
    }
    this.state = ApprovalState.APPROVED;
    this.finalText = draftText;
    this.decidedAt = now;
  }

  public void edit(String text, Instant now) {
    requireState(ApprovalState.PENDING);
    this.state = ApprovalState.EDITED;
    this.finalText = clip(text);
    this.decidedAt = now;
  }

  public void recordOwn(String audioRef, Instant now) {
    replyWithMedia(audioRef, VOICE_PLACEHOLDER, now);
  }

  /** The operator's own file goes out instead of text; {@code label} is what the audit shows. */
  public void replyWithMedia(String mediaRef, String label, Instant now) {
    requireState(ApprovalState.PENDING);
    this.state = ApprovalState.EDITED;
    this.finalText = clip(label);
    this.mediaRef = mediaRef;
    this.decidedAt = now;
  }

  public void block(Instant now) {
    requireState(ApprovalState.PENDING);
    this.decidedAt = now;
    close(ApprovalState.BLOCKED, now);
  }

  public void reject(Instant now) {
    requireState(ApprovalState.PENDING);
    this.decidedAt = now;
    close(ApprovalState.REJECTED, now);
  }

  public void expire(Instant now) {
    requireState(ApprovalState.PENDING);
    close(ApprovalState.EXPIRED, now);
  }

  public void markSent(Instant now) {
    if (!state.awaitsDelivery() && state != ApprovalState.DELIVERY_FAILED) {
      throw new IllegalStateException("record " + id + " is " + state + ", cannot mark sent");
    }
    close(ApprovalState.SENT, now);
  }

  public void markDeliveryFailed(Instant now) {
    if (!state.awaitsDelivery()) {
      throw new IllegalStateException(
          "record " + id + " is " + state + ", cannot mark delivery failed");
    }
    close(ApprovalState.DELIVERY_FAILED, now);
  }

  private void close(ApprovalState terminal, Instant now) {
    this.state = terminal;
    this.remindAt = null;
    this.openConversationId = null;
    this.closedAt = now;
  }

  private void requireState(ApprovalState expected) {
    if (state != expected) {
      throw new IllegalStateException("record " + id + " is " + state + ", expected " + expected);
    }
  }

  private static String clip(String s) {
    return clip(s, TEXT_LIMIT);
  }

  private static String clip(String s, int limit) {
    if (s == null) return "";
    return s.length() <= limit ? s : s.substring(s.length() - limit);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    ApprovalRecordEntity that = (ApprovalRecordEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
