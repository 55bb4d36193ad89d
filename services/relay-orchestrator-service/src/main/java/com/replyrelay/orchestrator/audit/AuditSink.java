package com.replyrelay.orchestrator.audit;

/** Append-only audit destination. Implementations may throw; callers use {@link AuditTrail}. */
public interface AuditSink {

  void append(AuditRow row);
}
