package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "audit_rows")
public class AuditRowEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "logged_at", nullable = false)
  private Instant loggedAt;

  @Column(name = "conversation_id", nullable = false, length = 128)
  private String conversationId;

  @Column(name = "sender_name", length = 256)
  private String senderName;

  @Column(name = "incoming_text", length = 8000)
  private String incomingText;

  @Column(name = "draft_text", length = 8000)
  private String draftText;

  @Column(name = "status", nullable = false, length = 32)
  private String status;

  @Column(name = "final_text", length = 8000)
  private String finalText;

  protected AuditRowEntity() {}

  public AuditRowEntity(
      Instant loggedAt,
      String conversationId,
      String senderName,
      String incomingText,
      String draftText,
      String status,
      String finalText) {
    this.loggedAt = loggedAt;
    this.conversationId = conversationId;
    this.senderName = senderName;
    this.incomingText = incomingText;
    this.draftText = draftText;
    this.status = status;
    this.finalText = finalText;
  }

  public Long getId() {
    return id;
  }

  public Instant getLoggedAt() {
    return loggedAt;
  }

  public String getConversationId() {
    return conversationId;
  }

  public String getSenderName() {
    return senderName;
  }

  public String getIncomingText() {
    return incomingText;
  }

  public String getDraftText() {
    return draftText;
  }

  public String getStatus() {
    return status;
  }

  public String getFinalText() {
    return finalText;
  }
}
