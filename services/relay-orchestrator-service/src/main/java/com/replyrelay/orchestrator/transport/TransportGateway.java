package com.replyrelay.orchestrator.transport;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** The chat transport as seen by the orchestrator. */
public interface TransportGateway {

  /**
   * Inbound messages received at or after {@code since}, oldest first.
   *
   * @throws com.replyrelay.orchestrator.common.RelayException when the log cannot be read
   */
  List<InboundMessage> readInboundSince(Instant since, int limit);

  /** Never throws; failures come back as a {@link SendResult}. */
  SendResult send(String conversationId, String text);

  SendResult sendMedia(String conversationId, String mediaPath);

  /** Downloads the media attached to a message; empty when the transport cannot provide it. */
  Optional<Path> downloadMedia(String conversationId, String messageId);
}
