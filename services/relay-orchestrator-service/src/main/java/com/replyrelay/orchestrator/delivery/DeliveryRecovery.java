package com.replyrelay.orchestrator.delivery;

import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ApprovalState;
import com.replyrelay.orchestrator.repository.ApprovalRecordRepository;
import java.util.EnumSet;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Re-submits records that were approved but not yet delivered when the process stopped. */
@Component
@Slf4j
@ConditionalOnProperty(
    name = "relay.delivery.recover-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class DeliveryRecovery {

  private final ApprovalRecordRepository records;
  private final DeliveryExecutor delivery;

  public DeliveryRecovery(ApprovalRecordRepository records, DeliveryExecutor delivery) {
    this.records = records;
    this.delivery = delivery;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void recover() {
    List<ApprovalRecordEntity> stranded =
        records.findByStateInOrderByCreatedAtAsc(
            EnumSet.of(ApprovalState.APPROVED, ApprovalState.EDITED));
    if (stranded.isEmpty()) {
      return;
    }
    log.info("Re-submitting {} approved record(s) left undelivered", stranded.size());
    for (ApprovalRecordEntity record : stranded) {
      delivery.submit(record.getId());
    }
  }
}
