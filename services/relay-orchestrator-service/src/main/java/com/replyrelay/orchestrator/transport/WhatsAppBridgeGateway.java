package com.replyrelay.orchestrator.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.replyrelay.orchestrator.common.RelayErrorKind;
import com.replyrelay.orchestrator.common.RelayException;
import com.replyrelay.orchestrator.config.BridgeProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Transport backed by the WhatsApp bridge: inbound messages from its SQLite store, outbound
 * through {@code POST /send} and media through {@code POST /download}.
 */
@Component
@Slf4j
public class WhatsAppBridgeGateway implements TransportGateway {

  private final RestClient rest;
  private final BridgeMessageLog messageLog;

  public WhatsAppBridgeGateway(RestClient bridgeRestClient, BridgeProperties properties) {
    this.rest = bridgeRestClient;
    this.messageLog =
        properties.databasePath() == null || properties.databasePath().isBlank()
            ? null
            : new BridgeMessageLog(properties.databasePath(), properties.zone());
  }

  @Override
  public List<InboundMessage> readInboundSince(Instant since, int limit) {
    if (messageLog == null) {
      throw new RelayException(
          RelayErrorKind.TRANSIENT_IO, "relay.bridge.database-path is not configured");
    }
    return messageLog.readSince(since, limit);
  }

  @Override
  public SendResult send(String conversationId, String text) {
    Map<String, Object> body = new HashMap<>();
    body.put("recipient", conversationId);
    body.put("message", text);
    return post(body);
  }

  @Override
  public SendResult sendMedia(String conversationId, String mediaPath) {
    Map<String, Object> body = new HashMap<>();
    body.put("recipient", conversationId);
    body.put("message", "");
    body.put("media_path", mediaPath);
    return post(body);
  }

  @Override
  public Optional<Path> downloadMedia(String conversationId, String messageId) {
    try {
      JsonNode resp =
          rest.post()
              .uri("/download")
              .body(Map.of("message_id", messageId, "chat_jid", conversationId))
              .retrieve()
              .body(JsonNode.class);
      if (resp == null || !resp.path("success").asBoolean(false)) {
        log.warn("Bridge could not download media {} in {}", messageId, conversationId);
        return Optional.empty();
      }
      String path = resp.path("Path").asText(resp.path("path").asText(""));
      if (path.isBlank() || !Files.exists(Path.of(path))) {
        log.warn("Bridge returned no usable path for media {}", messageId);
        return Optional.empty();
      }
      return Optional.of(Path.of(path));
    } catch (RestClientException e) {
      log.warn("Failed to download media {} from bridge: {}", messageId, e.getMessage());
      return Optional.empty();
    }
  }

  private SendResult post(Map<String, Object> body) {
    try {
      JsonNode resp = rest.post().uri("/send").body(body).retrieve().body(JsonNode.class);
      if (resp != null && resp.path("success").asBoolean(false)) {
        return SendResult.ok();
      }
      String message = resp == null ? "empty response" : resp.path("message").asText("");
      return isRecipientError(message)
          ? SendResult.permanentFailure(message)
          : SendResult.retryable(message);
    } catch (RestClientResponseException e) {
      HttpStatusCode status = e.getStatusCode();
      String detail = status.value() + " " + e.getResponseBodyAsString();
      if (status.is4xxClientError() && status.value() != 408 && status.value() != 429) {
        return SendResult.permanentFailure(detail);
      }
      return SendResult.retryable(detail);
    } catch (RestClientException e) {
      return SendResult.retryable(e.getMessage());
    }
  }

  static boolean isRecipientError(String message) {
    if (message == null) return false;
    String m = message.toLowerCase(Locale.ROOT);
    return m.contains("invalid recipient")
        || m.contains("invalid jid")
        || m.contains("not on whatsapp")
        || m.contains("unknown recipient");
  }
}
