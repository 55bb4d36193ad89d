package com.replyrelay.orchestrator.audit;

import com.replyrelay.orchestrator.domain.AuditRowEntity;
import com.replyrelay.orchestrator.repository.AuditRowRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "relay.audit.mode", havingValue = "table", matchIfMissing = true)
public class TableAuditSink implements AuditSink {

  private final AuditRowRepository repository;

  public TableAuditSink(AuditRowRepository repository) {
    this.repository = repository;
  }

  @Override
  public void append(AuditRow row) {
    repository.save(
        new AuditRowEntity(
            row.timestamp(),
            row.conversationId(),
            row.senderName(),
            row.incomingText(),
            row.draftText(),
            row.status().label(),
            row.finalText()));
  }
}
