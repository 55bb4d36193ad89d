package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ApprovalState;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ApprovalRecordRepository extends JpaRepository<ApprovalRecordEntity, Long> {

  @Query("select r from ApprovalRecordEntity r where r.openConversationId = ?1")
  Optional<ApprovalRecordEntity> findOpen(String conversationId);

  Optional<ApprovalRecordEntity> findByCardId(String cardId);

  List<ApprovalRecordEntity> findByStateInOrderByCreatedAtAsc(Collection<ApprovalState> states);

  @Query(
      "select r.id from ApprovalRecordEntity r"
          + " where r.state = com.replyrelay.orchestrator.domain.ApprovalState.PENDING"
          + " and r.expiresAt <= ?1")
  List<Long> findExpiredPendingIds(Instant now);

  @Query(
      "select r.id from ApprovalRecordEntity r"
          + " where r.state = com.replyrelay.orchestrator.domain.ApprovalState.PENDING"
          + " and r.cardId is null")
  List<Long> findPendingWithoutCard();

  @Query(
      "select r.id from ApprovalRecordEntity r"
          + " where r.state = com.replyrelay.orchestrator.domain.ApprovalState.PENDING"
          + " and r.remindAt <= ?1")
  List<Long> findDueReminderIds(Instant now);
}
