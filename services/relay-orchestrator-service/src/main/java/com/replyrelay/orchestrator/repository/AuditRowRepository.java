package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.AuditRowEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditRowRepository extends JpaRepository<AuditRowEntity, Long> {

  List<AuditRowEntity> findByConversationIdOrderByIdAsc(String conversationId);
}
