package com.replyrelay.orchestrator.common;

public class RelayException extends RuntimeException {

  private final RelayErrorKind kind;

  public RelayException(RelayErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public RelayException(RelayErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public RelayErrorKind kind() {
    return kind;
  }
}
