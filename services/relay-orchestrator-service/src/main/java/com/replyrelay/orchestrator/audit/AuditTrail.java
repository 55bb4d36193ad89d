package com.replyrelay.orchestrator.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/** Fire-and-forget front of the audit sink: failures are logged, never propagated. */
@Service
@Slf4j
public class AuditTrail {

  private final AuditSink sink;
  private final ThreadPoolTaskExecutor executor;

  public AuditTrail(
      AuditSink sink, @Qualifier("auditTaskExecutor") ThreadPoolTaskExecutor executor) {
    this.sink = sink;
    this.executor = executor;
  }

  public void record(AuditRow row) {
    try {
      executor.execute(() -> append(row));
    } catch (TaskRejectedException e) {
      log.warn(
          "Audit executor rejected {} row for {}: {}",
          row.status().label(),
          row.conversationId(),
          e.getMessage());
    }
  }

  private void append(AuditRow row) {
    try {
      sink.append(row);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to write {} audit row for {}: {}",
          row.status().label(),
          row.conversationId(),
          e.getMessage());
    }
  }
}
