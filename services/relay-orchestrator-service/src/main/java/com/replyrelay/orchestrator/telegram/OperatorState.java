package com.replyrelay.orchestrator.telegram;

/** What the operator chat's next message means. */
public enum OperatorState {
  NONE,
  /** Next text message replaces the draft of the pending record. */
  AWAITING_EDIT,
  /** Next voice message is sent as the reply. */
  AWAITING_VOICE
}
