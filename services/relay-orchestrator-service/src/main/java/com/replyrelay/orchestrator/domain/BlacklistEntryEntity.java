package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "blacklist_entries")
public class BlacklistEntryEntity {

  @Id
  @Column(name = "conversation_id", nullable = false, length = 128)
  private String conversationId;

  @Column(name = "blocked_at", nullable = false)
  private Instant blockedAt;

  @Column(name = "reason", length = 512)
  private String reason;

  protected BlacklistEntryEntity() {}

  public BlacklistEntryEntity(String conversationId, Instant blockedAt, String reason) {
    this.conversationId = conversationId;
    this.blockedAt = blockedAt;
    this.reason = reason;
  }

  public String getConversationId() {
    return conversationId;
  }

  public Instant getBlockedAt() {
    return blockedAt;
  }

  public String getReason() {
    return reason;
  }
}
