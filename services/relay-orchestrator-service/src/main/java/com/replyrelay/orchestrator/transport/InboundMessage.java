package com.replyrelay.orchestrator.transport;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One message read from the transport log. {@code mediaType} is empty for plain text.
 */
public record InboundMessage(
    String conversationId,
    String messageId,
    String senderDisplayName,
    String body,
    Instant receivedAt,
    String mediaType) {

  public InboundMessage {
    body = body == null ? "" : body;
    mediaType = mediaType == null ? "" : mediaType;
  }

  public InboundMessage withBody(String newBody) {
    return new InboundMessage(
        conversationId, messageId, senderDisplayName, newBody, receivedAt, mediaType);
  }

  /**
   * One message standing for a burst of fragments from the same sender: the last fragment's ids
   * and time, every fragment's body on its own line.
   */
  public static InboundMessage combine(List<InboundMessage> fragments) {
    if (fragments.isEmpty()) {
      throw new IllegalArgumentException("no fragments to combine");
    }
    InboundMessage last = fragments.get(fragments.size() - 1);
    if (fragments.size() == 1) {
      return last;
    }
    String joined =
        fragments.stream()
            .map(InboundMessage::body)
            .filter(b -> !b.isBlank())
            .collect(Collectors.joining("\n"));
    return last.withBody(joined);
  }

  public boolean isAudio() {
    return "audio".equalsIgnoreCase(mediaType);
  }

  public boolean hasMedia() {
    return !mediaType.isBlank();
  }

  public String senderOrConversation() {
    return senderDisplayName == null || senderDisplayName.isBlank()
        ? conversationId
        : senderDisplayName;
  }
}
