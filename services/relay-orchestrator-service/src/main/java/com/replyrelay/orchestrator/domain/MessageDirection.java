package com.replyrelay.orchestrator.domain;

public enum MessageDirection {
  INBOUND,
  OUTBOUND
}
