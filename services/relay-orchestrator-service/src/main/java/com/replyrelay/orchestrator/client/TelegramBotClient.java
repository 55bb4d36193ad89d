package com.replyrelay.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.replyrelay.orchestrator.telegram.InlineKeyboard;
import com.replyrelay.orchestrator.telegram.TelegramMediaKind;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/** Thin Telegram Bot API client. Failures are logged and reported as null/false results. */
@Service
@Slf4j
public class TelegramBotClient {

  private static final String API = "https://api.telegram.org";

  private final RestClient rest;
  private final String botToken;

  public TelegramBotClient(
      RestClient.Builder builder, @Value("${telegram.bot-token:}") String botToken) {
    this.botToken = botToken == null ? "" : botToken.trim();
    this.rest = builder.build();
  }

  public boolean isConfigured() {
    return !botToken.isBlank();
  }

  public JsonNode getUpdates(long offset, int timeoutSeconds) {
    if (!isConfigured()) {
      log.warn("Telegram bot token is not configured; skip getUpdates");
      return null;
    }
    try {
      return rest.get()
          .uri(method("getUpdates") + "?offset={offset}&timeout={timeout}", offset, timeoutSeconds)
          .retrieve()
          .body(JsonNode.class);
    } catch (Exception e) {
      log.warn("Failed to call getUpdates: {}", e.getMessage());
      return null;
    }
  }

  /**
   * Sends an HTML message.
   *
   * @return the Telegram message id, or {@code null} when sending failed
   */
  public Long sendMessage(String chatId, String text, InlineKeyboard keyboard) {
    if (!isConfigured()) {
      log.warn("Telegram bot token is not configured; skip sending message to chatId={}", chatId);
      return null;
    }
    try {
      Map<String, Object> body = messageBody(chatId, text, keyboard);
      JsonNode resp =
          rest.post().uri(method("sendMessage")).body(body).retrieve().body(JsonNode.class);
      if (resp == null || !resp.path("ok").asBoolean(false)) {
        log.warn("Telegram rejected sendMessage to chatId={}", chatId);
        return null;
      }
      long messageId = resp.path("result").path("message_id").asLong(-1);
      return messageId < 0 ? null : messageId;
    } catch (Exception e) {
      log.warn("Failed to send Telegram message: {}", e.getMessage());
      return null;
    }
  }

  /** Uploads a local file with a plain-text caption. */
  public boolean sendMedia(String chatId, TelegramMediaKind kind, Path file, String caption) {
    if (!isConfigured()) {
      log.warn("Telegram bot token is not configured; skip {} to chatId={}", kind.method(), chatId);
      return false;
    }
    MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
    form.add("chat_id", chatId);
    form.add(kind.field(), new FileSystemResource(file));
    if (caption != null && !caption.isBlank()) {
      form.add("caption", caption);
    }
    try {
      rest.post()
          .uri(method(kind.method()))
          .contentType(MediaType.MULTIPART_FORM_DATA)
          .body(form)
          .retrieve()
          .toBodilessEntity();
      return true;
    } catch (Exception e) {
      log.warn("Failed to {} {}: {}", kind.method(), file, e.getMessage());
      return false;
    }
  }

  public boolean editMessageText(
      String chatId, String messageId, String text, InlineKeyboard keyboard) {
    if (!isConfigured()) {
      log.warn("Telegram bot token is not configured; skip editMessageText");
      return false;
    }
    if (messageId == null || messageId.isBlank()) {
      return false;
    }
    try {
      Map<String, Object> body = messageBody(chatId, text, keyboard);
      body.put("message_id", messageId);
      if (keyboard == null) {
        // an empty markup removes the buttons of a resolved card
        body.put("reply_markup", Map.of("inline_keyboard", List.of()));
      }
      rest.post().uri(method("editMessageText")).body(body).retrieve().toBodilessEntity();
      return true;
    } catch (Exception e) {
      log.warn("Failed to edit Telegram message {}: {}", messageId, e.getMessage());
      return false;
    }
  }

  public void answerCallbackQuery(String callbackQueryId, String text) {
    if (!isConfigured() || callbackQueryId == null || callbackQueryId.isBlank()) {
      return;
    }
    Map<String, Object> body = new HashMap<>();
    body.put("callback_query_id", callbackQueryId);
    if (text != null && !text.isBlank()) {
      body.put("text", text);
    }
    try {
      rest.post().uri(method("answerCallbackQuery")).body(body).retrieve().toBodilessEntity();
    } catch (Exception e) {
      log.warn("Failed to answer callback query: {}", e.getMessage());
    }
  }

  /** Resolves a file id to the path used by {@link #downloadFile}. */
  public String getFilePath(String fileId) {
    if (!isConfigured() || fileId == null || fileId.isBlank()) {
      return null;
    }
    try {
      JsonNode resp =
          rest.get()
              .uri(method("getFile") + "?file_id={fileId}", fileId)
              .retrieve()
              .body(JsonNode.class);
      if (resp == null) {
        return null;
      }
      String path = resp.path("result").path("file_path").asText("");
      return path.isBlank() ? null : path;
    } catch (Exception e) {
      log.warn("Failed to resolve Telegram file {}: {}", fileId, e.getMessage());
      return null;
    }
  }

  public boolean downloadFile(String filePath, Path target) {
    if (!isConfigured() || filePath == null) {
      return false;
    }
    try {
      byte[] bytes =
          rest.get()
              .uri(API + "/file/bot" + botToken + "/" + filePath)
              .retrieve()
              .body(byte[].class);
      if (bytes == null || bytes.length == 0) {
        return false;
      }
      try (InputStream in = new ByteArrayInputStream(bytes)) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
      return true;
    } catch (IOException e) {
      log.warn("Failed to store Telegram file {} at {}: {}", filePath, target, e.getMessage());
      return false;
    } catch (Exception e) {
      log.warn("Failed to download Telegram file {}: {}", filePath, e.getMessage());
      return false;
    }
  }

  private String method(String name) {
    return API + "/bot" + botToken + "/" + name;
  }

  private static Map<String, Object> messageBody(
      String chatId, String text, InlineKeyboard keyboard) {
    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put("text", text);
    body.put("parse_mode", "HTML");
    body.put("disable_web_page_preview", true);
    if (keyboard != null) {
      body.put("reply_markup", toInlineKeyboard(keyboard));
    }
    return body;
  }

  private static Map<String, Object> toInlineKeyboard(InlineKeyboard keyboard) {
    List<List<Map<String, Object>>> rows = new ArrayList<>();
    for (List<InlineKeyboard.Button> row : keyboard.rows()) {
      List<Map<String, Object>> outRow = new ArrayList<>();
      for (InlineKeyboard.Button btn : row) {
        outRow.add(Map.of("text", btn.text(), "callback_data", btn.callbackData()));
      }
      if (!outRow.isEmpty()) {
        rows.add(outRow);
      }
    }
    return Map.of("inline_keyboard", rows);
  }
}
