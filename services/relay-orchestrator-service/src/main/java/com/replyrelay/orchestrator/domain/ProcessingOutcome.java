package com.replyrelay.orchestrator.domain;

/** Why an inbound message id was written to the processed-message ledger. */
public enum ProcessingOutcome {
  QUEUED_FOR_APPROVAL,
  DRAFT_FAILED,
  MERGED_INTO_PENDING,
  POLICY_REJECTED,
  TRANSCRIPTION_FAILED
}
