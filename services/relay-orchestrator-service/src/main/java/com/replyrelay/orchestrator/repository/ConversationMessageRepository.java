package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.ConversationMessageEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface ConversationMessageRepository
    extends JpaRepository<ConversationMessageEntity, Long> {

  @Query(
      "select m from ConversationMessageEntity m where m.conversationId = ?1 order by m.id desc")
  List<ConversationMessageEntity> findNewest(String conversationId, Pageable page);

  long countByConversationId(String conversationId);

  boolean existsByConversationIdAndMessageId(String conversationId, String messageId);

  /** Drops every row older than {@code keepFromId} for the conversation. */
  @Modifying
  @Query("delete from ConversationMessageEntity m where m.conversationId = ?1 and m.id < ?2")
  int deleteOlderThan(String conversationId, Long keepFromId);
}
