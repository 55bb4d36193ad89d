package com.replyrelay.orchestrator.transport;

/** Outcome of one send attempt; {@code permanent} failures are never retried. */
public record SendResult(boolean success, boolean permanent, String error) {

  public static SendResult ok() {
    return new SendResult(true, false, null);
  }

  public static SendResult retryable(String error) {
    return new SendResult(false, false, error);
  }

  public static SendResult permanentFailure(String error) {
    return new SendResult(false, true, error);
  }
}
