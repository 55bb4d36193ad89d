package com.replyrelay.orchestrator.common;

/** Why a call to an external collaborator failed; both kinds are worth another try. */
public enum RelayErrorKind {
  /** Network or API hiccup. */
  TRANSIENT_IO,
  TIMEOUT
}
