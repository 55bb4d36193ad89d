package com.replyrelay.orchestrator.approval;

public enum DecisionKind {
  APPROVE,
  EDIT,
  BLOCK,
  REJECT,
  RECORD_OWN,
  /** Photo, video or document sent by the operator as the reply. */
  SEND_MEDIA,
  /** Keeps the card pending and shows it again after a delay. */
  REPLY_LATER
}
