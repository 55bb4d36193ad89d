package com.replyrelay.orchestrator.domain;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "poll_cursors")
public class PollCursorEntity {

  @Id
  @Column(name = "name", nullable = false, length = 64)
  private String name;

  @Column(name = "last_received_at", nullable = false)
  private Instant lastReceivedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PollCursorEntity() {}

  public PollCursorEntity(String name, Instant lastReceivedAt, Instant now) {
    this.name = name;
    this.lastReceivedAt = lastReceivedAt;
    this.updatedAt = now;
  }

  public String getName() {
    return name;
  }

  public Instant getLastReceivedAt() {
    return lastReceivedAt;
  }

  public void moveTo(Instant lastReceivedAt, Instant now) {
    this.lastReceivedAt = lastReceivedAt;
    this.updatedAt = now;
  }
}
