package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.ProcessedMessageEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ProcessedMessageRepository
    extends JpaRepository<ProcessedMessageEntity, String> {

  @Query("select p.messageId from ProcessedMessageEntity p where p.messageId in ?1")
  List<String> findProcessedIds(Collection<String> messageIds);

  long countByConversationId(String conversationId);
}
