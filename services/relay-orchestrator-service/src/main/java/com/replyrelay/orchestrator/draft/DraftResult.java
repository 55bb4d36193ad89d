package com.replyrelay.orchestrator.draft;

import com.replyrelay.orchestrator.common.RelayErrorKind;

/** Either a draft or the reason there is none; a failed draft still opens a manual-reply card. */
public record DraftResult(DraftReply reply, RelayErrorKind failureKind, String failureReason) {

  public static DraftResult of(DraftReply reply) {
    return new DraftResult(reply, null, null);
  }

  public static DraftResult failed(RelayErrorKind kind, String reason) {
    return new DraftResult(null, kind, reason);
  }

  public boolean succeeded() {
    return reply != null;
  }

  public String text() {
    return reply == null ? "" : reply.text();
  }

  public String failureSummary() {
    if (succeeded()) return null;
    return failureKind + (failureReason == null ? "" : ": " + failureReason);
  }
}
