package com.replyrelay.orchestrator.polling;

import com.replyrelay.orchestrator.common.RelayException;
import com.replyrelay.orchestrator.draft.AiBackend;
import com.replyrelay.orchestrator.transport.InboundMessage;
import com.replyrelay.orchestrator.transport.TransportGateway;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gives media messages a text body: voice notes are transcribed, other media without a caption
 * get a {@code [type]} placeholder.
 */
@Component
@Slf4j
public class MessageBodyResolver {

  private final TransportGateway transport;
  private final AiBackend ai;

  public MessageBodyResolver(TransportGateway transport, AiBackend ai) {
    this.transport = transport;
    this.ai = ai;
  }

  /** Empty when the message needs a transcript and none could be produced. */
  public Optional<InboundMessage> resolve(InboundMessage message) {
    if (!message.body().isBlank() || !message.hasMedia()) {
      return Optional.of(message);
    }
    if (!message.isAudio()) {
      return Optional.of(
          message.withBody("[" + message.mediaType().toLowerCase(Locale.ROOT) + "]"));
    }
    Optional<Path> audio = transport.downloadMedia(message.conversationId(), message.messageId());
    if (audio.isEmpty()) {
      return Optional.empty();
    }
    try {
      String transcript = ai.transcribe(audio.get());
      if (transcript == null || transcript.isBlank()) {
        log.warn("Empty transcript for voice message {}", message.messageId());
        return Optional.empty();
      }
      return Optional.of(message.withBody(transcript.trim()));
    } catch (RelayException e) {
      log.warn("Transcription of {} failed: {}", message.messageId(), e.getMessage());
      return Optional.empty();
    }
  }
}
