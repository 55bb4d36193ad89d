package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;

/** Ledger row: an inbound message id that has been taken through the pipeline once. */
@Entity
@Table(name = "processed_messages")
public class ProcessedMessageEntity {

  @Id
  @Column(name = "message_id", nullable = false, length = 128)
  private String messageId;

  @Column(name = "conversation_id", nullable = false, length = 128)
  private String conversationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "outcome", nullable = false, length = 32)
  private ProcessingOutcome outcome;

  @Column(name = "processed_at", nullable = false)
  private Instant processedAt;

  protected ProcessedMessageEntity() {}

  public ProcessedMessageEntity(
      String messageId, String conversationId, ProcessingOutcome outcome, Instant processedAt) {
    this.messageId = messageId;
    this.conversationId = conversationId;
    this.outcome = outcome;
    this.processedAt = processedAt;
  }

  public String getMessageId() {
    return messageId;
  }

  public String getConversationId() {
    return conversationId;
  }

  public ProcessingOutcome getOutcome() {
    return outcome;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }
}
