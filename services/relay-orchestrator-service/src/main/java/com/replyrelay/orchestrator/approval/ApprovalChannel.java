package com.replyrelay.orchestrator.approval;

import java.nio.file.Path;

/**
 * Operator-facing front end. Implementations are best-effort: they log and swallow their own
 * transport failures instead of throwing into the coordinator.
 */
public interface ApprovalChannel {

  /**
   * Shows a new card to the operator.
   *
   * @return the channel's id for the card, or {@code null} when it could not be shown
   */
  String present(ApprovalCard card);

  /** Re-renders an existing card, e.g. after a merge or a decision. */
  void update(String cardId, ApprovalCard card);

  void notifyOperator(String text);

  /** Shows the operator a photo, video or document that arrived with an inbound message. */
  void forwardMedia(Long recordId, String senderName, String mediaType, Path file);
}
