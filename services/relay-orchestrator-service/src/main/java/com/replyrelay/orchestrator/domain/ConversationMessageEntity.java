package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "conversation_messages")
public class ConversationMessageEntity {

  static final int BODY_LIMIT = 8000;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "conversation_id", nullable = false, length = 128)
  private String conversationId;

  @Column(name = "message_id", length = 128)
  private String messageId;

  @Enumerated(EnumType.STRING)
  @Column(name = "direction", nullable = false, length = 16)
  private MessageDirection direction;

  @Column(name = "body", nullable = false, length = BODY_LIMIT)
  private String body;

  @Column(name = "occurred_at", nullable = false)
  private Instant occurredAt;

  protected ConversationMessageEntity() {}

  public ConversationMessageEntity(
      String conversationId,
      String messageId,
      MessageDirection direction,
      String body,
      Instant occurredAt) {
    this.conversationId = conversationId;
    this.messageId = messageId;
    this.direction = direction;
    this.body = clip(body);
    this.occurredAt = occurredAt;
  }

  /** Keeps the head of an oversized body. */
  static String clip(String body) {
    if (body == null) return "";
    return body.length() <= BODY_LIMIT ? body : body.substring(0, BODY_LIMIT);
  }

  public Long getId() {
    return id;
  }

  public String getConversationId() {
    return conversationId;
  }

  public String getMessageId() {
    return messageId;
  }

  public MessageDirection getDirection() {
    return direction;
  }

  public String getBody() {
    return body;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
