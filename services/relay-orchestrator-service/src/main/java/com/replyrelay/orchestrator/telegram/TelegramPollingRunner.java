package com.replyrelay.orchestrator.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.replyrelay.orchestrator.client.TelegramBotClient;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Long-polls the Bot API for operator updates. Used when no public webhook URL is available;
 * enabled only with telegram.polling.enabled=true.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "telegram.polling.enabled", havingValue = "true")
public class TelegramPollingRunner {

  private final TelegramBotClient bot;
  private final TelegramUpdateDispatcher dispatcher;
  private final int timeoutSeconds;
  private final AtomicLong offset = new AtomicLong(0);

  public TelegramPollingRunner(
      TelegramBotClient bot,
      TelegramUpdateDispatcher dispatcher,
      @Value("${telegram.polling.timeout-seconds:20}") int timeoutSeconds) {
    this.bot = bot;
    this.dispatcher = dispatcher;
    this.timeoutSeconds = timeoutSeconds;
  }

  @Scheduled(fixedDelayString = "${telegram.polling.fixed-delay-ms:1000}")
  public void poll() {
    if (!bot.isConfigured()) {
      log.warn("telegram.polling.enabled=true but TELEGRAM_BOT_TOKEN is empty; polling is skipped");
      return;
    }

    JsonNode resp = bot.getUpdates(offset.get(), timeoutSeconds);
    if (resp == null) return;

    JsonNode result = resp.path("result");
    if (!result.isArray() || result.isEmpty()) return;

    for (JsonNode upd : result) {
      long updateId = upd.path("update_id").asLong(-1);
      try {
        String handled = dispatcher.dispatch(upd);
        log.debug("Update {} -> {}", updateId, handled);
      } catch (RuntimeException e) {
        // skip the poison update instead of refetching it forever
        log.error("Failed to handle Telegram update {}", updateId, e);
      }
      // Telegram expects next offset = last_update_id + 1
      if (updateId >= offset.get()) {
        offset.set(updateId + 1);
      }
    }
  }
}
