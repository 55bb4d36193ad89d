package com.replyrelay.orchestrator.approval;

import com.replyrelay.orchestrator.store.ConversationContext;

/**
 * Result of taking an inbound message through the coordinator. {@code context} is the window as
 * it was before the message, set for {@link Kind#NEEDS_DRAFT} and {@link Kind#MERGED}.
 */
public record OfferOutcome(Kind kind, Long recordId, ConversationContext context) {

  public enum Kind {
    /** A new Pending record was opened. */
    OPENED,
    /** Folded into the conversation's open record; no second card. */
    MERGED,
    NEEDS_DRAFT,
    POLICY_REJECTED,
    DUPLICATE,
    /** Recorded in the ledger without a card, e.g. failed transcription. */
    DISCARDED,
    /** The open record is awaiting delivery; the message is retried once it settles. */
    DEFERRED,
    /** Unexpected failure; the message stays unprocessed and is retried. */
    FAILED
  }

  static OfferOutcome of(Kind kind) {
    return new OfferOutcome(kind, null, null);
  }

  static OfferOutcome of(Kind kind, Long recordId) {
    return new OfferOutcome(kind, recordId, null);
  }

  static OfferOutcome needsDraft(ConversationContext context) {
    return new OfferOutcome(Kind.NEEDS_DRAFT, null, context);
  }

  static OfferOutcome merged(Long recordId, ConversationContext context) {
    return new OfferOutcome(Kind.MERGED, recordId, context);
  }

  /** True when the message is settled and the poll cursor may move past it. */
  public boolean settled() {
    return kind != Kind.FAILED && kind != Kind.DEFERRED && kind != Kind.NEEDS_DRAFT;
  }
}
