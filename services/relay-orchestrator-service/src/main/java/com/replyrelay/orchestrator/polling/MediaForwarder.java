package com.replyrelay.orchestrator.polling;

import com.replyrelay.orchestrator.approval.ApprovalChannel;
import com.replyrelay.orchestrator.transport.InboundMessage;
import com.replyrelay.orchestrator.transport.TransportGateway;
import java.nio.file.Path;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Passes the attachment of an inbound photo, video or document on to the operator next to its
 * card. Best-effort: the card carries the caption or a placeholder either way.
 */
@Component
@Slf4j
public class MediaForwarder {

  private final TransportGateway transport;
  private final ApprovalChannel channel;

  public MediaForwarder(TransportGateway transport, ApprovalChannel channel) {
    this.transport = transport;
    this.channel = channel;
  }

  /** @return true when the file reached the channel */
  public boolean forward(InboundMessage message, Long recordId) {
    if (!message.hasMedia() || message.isAudio() || recordId == null) {
      return false;
    }
    Optional<Path> file = transport.downloadMedia(message.conversationId(), message.messageId());
    if (file.isEmpty()) {
      log.warn(
          "No {} file for message {}; card #{} shows the placeholder only",
          message.mediaType(),
          message.messageId(),
          recordId);
      return false;
    }
    try {
      channel.forwardMedia(
          recordId, message.senderOrConversation(), message.mediaType(), file.get());
      return true;
    } catch (RuntimeException e) {
      log.warn("Failed to forward media of {}: {}", message.messageId(), e.getMessage());
      return false;
    }
  }
}
