package com.replyrelay.orchestrator.approval;

/**
 * An operator decision. The record is addressed by {@code recordId} when the channel knows it,
 * otherwise by {@code cardId}. {@code mediaRef} is a local file for voice and media replies;
 * {@code text} is the reply for edits and the audit label for media.
 */
public record Decision(
    Long recordId, String cardId, DecisionKind kind, String text, String mediaRef) {

  public static Decision approve(Long recordId) {
    return new Decision(recordId, null, DecisionKind.APPROVE, null, null);
  }

  public static Decision edit(Long recordId, String text) {
    return new Decision(recordId, null, DecisionKind.EDIT, text, null);
  }

  public static Decision block(Long recordId) {
    return new Decision(recordId, null, DecisionKind.BLOCK, null, null);
  }

  public static Decision reject(Long recordId) {
    return new Decision(recordId, null, DecisionKind.REJECT, null, null);
  }

  public static Decision recordOwn(Long recordId, String audioRef) {
    return new Decision(recordId, null, DecisionKind.RECORD_OWN, null, audioRef);
  }

  public static Decision sendMedia(Long recordId, String mediaRef, String label) {
    return new Decision(recordId, null, DecisionKind.SEND_MEDIA, label, mediaRef);
  }

  public static Decision replyLater(Long recordId) {
    return new Decision(recordId, null, DecisionKind.REPLY_LATER, null, null);
  }

  public Decision onCard(String cardId) {
    return new Decision(recordId, cardId, kind, text, mediaRef);
  }

  /** Null when well formed, otherwise what is wrong. */
  String problem() {
    if (kind == null) return "decision kind is missing";
    if (recordId == null && (cardId == null || cardId.isBlank())) return "no record or card id";
    if (kind == DecisionKind.EDIT && (text == null || text.isBlank())) return "edit without text";
    if (kind == DecisionKind.RECORD_OWN && (mediaRef == null || mediaRef.isBlank())) {
      return "record_own without audio";
    }
    if (kind == DecisionKind.SEND_MEDIA && (mediaRef == null || mediaRef.isBlank())) {
      return "send_media without a file";
    }
    return null;
  }
}
