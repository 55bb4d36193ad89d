package com.replyrelay.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.replyrelay.orchestrator.telegram.TelegramUpdateDispatcher;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Telegram webhook endpoint; needs a public URL registered with setWebhook. */
@RestController
@RequestMapping("/telegram")
@Slf4j
public class TelegramWebhookController {

  private final TelegramUpdateDispatcher dispatcher;
  private final String secretToken;

  public TelegramWebhookController(
      TelegramUpdateDispatcher dispatcher,
      @Value("${telegram.webhook.secret-token:}") String secretToken) {
    this.dispatcher = dispatcher;
    this.secretToken = secretToken == null ? "" : secretToken.trim();
  }

  @PostMapping("/webhook")
  public Map<String, Object> webhook(
      @RequestBody JsonNode update,
      @RequestHeader(value = "X-Telegram-Bot-Api-Secret-Token", required = false)
          String headerSecret) {

    if (!secretToken.isBlank()) {
      if (headerSecret == null || !secretToken.equals(headerSecret)) {
        log.warn("Webhook secret token mismatch");
        return Map.of("ok", false);
      }
    }

    // Telegram retries on non-2xx, so failures are reported in the body
    try {
      return Map.of("ok", true, "handled", dispatcher.dispatch(update));
    } catch (RuntimeException e) {
      log.error("Failed to handle webhook update {}", update.path("update_id").asLong(-1), e);
      return Map.of("ok", false);
    }
  }
}
