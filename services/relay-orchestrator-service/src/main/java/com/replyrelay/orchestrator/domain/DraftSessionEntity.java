package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "draft_sessions")
public class DraftSessionEntity {

  @Id
  @Column(name = "conversation_id", nullable = false, length = 128)
  private String conversationId;

  @Column(name = "session_handle", nullable = false, length = 256)
  private String sessionHandle;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected DraftSessionEntity() {}

  public DraftSessionEntity(String conversationId, String sessionHandle, Instant createdAt) {
    this.conversationId = conversationId;
    this.sessionHandle = sessionHandle;
    this.createdAt = createdAt;
  }

  public String getConversationId() {
    return conversationId;
  }

  public String getSessionHandle() {
    return sessionHandle;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
