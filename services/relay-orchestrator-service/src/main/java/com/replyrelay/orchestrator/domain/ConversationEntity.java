package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

@Entity
@Table(name = "conversations")
public class ConversationEntity {

  @Id
  @Column(name = "conversation_id", nullable = false, length = 128)
  private String conversationId;

  @Column(name = "display_name", length = 256)
  private String displayName;

  @Enumerated(EnumType.STRING)
  @Column(name = "subscription_tag", nullable = false, length = 16)
  private SubscriptionTag subscriptionTag = SubscriptionTag.FREE;

  // Watermark of the last inbound message taken into processing.
  @Column(name = "last_message_id", length = 128)
  private String lastMessageId;

  @Column(name = "last_message_at")
  private Instant lastMessageAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ConversationEntity() {}

  public ConversationEntity(String conversationId, String displayName, Instant now) {
    this.conversationId = conversationId;
    this.displayName = displayName;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public String getConversationId() {
    return conversationId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public SubscriptionTag getSubscriptionTag() {
    return subscriptionTag;
  }

  public String getLastMessageId() {
    return lastMessageId;
  }

  public Instant getLastMessageAt() {
    return lastMessageAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void rename(String displayName, Instant now) {
    if (displayName != null && !displayName.isBlank() && !displayName.equals(this.displayName)) {
      this.displayName = displayName;
      this.updatedAt = now;
    }
  }

  public void tag(SubscriptionTag tag, Instant now) {
    this.subscriptionTag = tag;
    this.updatedAt = now;
  }

  /** Moves the watermark forward; an older message never moves it back. */
  public void advanceWatermark(String messageId, Instant receivedAt, Instant now) {
    if (lastMessageAt != null && receivedAt.isBefore(lastMessageAt)) {
      return;
    }
    this.lastMessageId = messageId;
    this.lastMessageAt = receivedAt;
    this.updatedAt = now;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    ConversationEntity that = (ConversationEntity) o;
    return conversationId != null && conversationId.equals(that.conversationId);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
