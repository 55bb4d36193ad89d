package com.replyrelay.orchestrator.domain;

public enum AttemptOutcome {
  SUCCESS,
  FAILURE
}
