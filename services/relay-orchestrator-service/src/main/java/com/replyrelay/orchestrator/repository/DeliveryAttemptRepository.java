package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.DeliveryAttemptEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface DeliveryAttemptRepository extends JpaRepository<DeliveryAttemptEntity, Long> {

  List<DeliveryAttemptEntity> findByApprovalIdOrderByAttemptNumberAsc(Long approvalId);

  @Query(
      "select coalesce(max(a.attemptNumber), 0) from DeliveryAttemptEntity a"
          + " where a.approvalId = ?1")
  int lastAttemptNumber(Long approvalId);
}
