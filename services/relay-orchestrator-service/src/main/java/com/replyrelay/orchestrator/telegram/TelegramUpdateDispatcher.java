package com.replyrelay.orchestrator.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.replyrelay.orchestrator.approval.ApprovalCoordinator;
import com.replyrelay.orchestrator.approval.Decision;
import com.replyrelay.orchestrator.approval.DecisionOutcome;
import com.replyrelay.orchestrator.client.TelegramBotClient;
import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ApprovalState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns Telegram updates from the operator chat into approval decisions and commands. Shared by
 * the polling runner and the webhook.
 */
@Component
@Slf4j
public class TelegramUpdateDispatcher {

  private static final Pattern SAFE_EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,8}");

  private final TelegramBotClient bot;
  private final ApprovalCoordinator coordinator;
  private final OperatorStateStore states;
  private final OperatorCommandHandler commands;
  private final String operatorChatId;
  private final Path uploadDir;

  public TelegramUpdateDispatcher(
      TelegramBotClient bot,
      ApprovalCoordinator coordinator,
      OperatorStateStore states,
      OperatorCommandHandler commands,
      @Value("${telegram.operator-chat-id:}") String operatorChatId,
      @Value("${telegram.voice-dir:${java.io.tmpdir}/reply-relay-voice}") String uploadDir) {
    this.bot = bot;
    this.coordinator = coordinator;
    this.states = states;
    this.commands = commands;
    this.operatorChatId = operatorChatId == null ? "" : operatorChatId.trim();
    this.uploadDir = Path.of(uploadDir);
  }

  /** @return short label of what happened, for logs and the webhook response */
  public String dispatch(JsonNode update) {
    if (update == null) {
      return "ignored:empty";
    }
    JsonNode callback = update.path("callback_query");
    if (!callback.isMissingNode() && !callback.isNull()) {
      return handleCallback(callback);
    }
    JsonNode message = update.path("message");
    if (message.isMissingNode() || message.isNull()) {
      return "ignored:no_message";
    }
    String chatId = message.path("chat").path("id").asText();
    if (!isOperator(chatId)) {
      log.warn("Ignoring message from non-operator chat {}", chatId);
      return "ignored:foreign_chat";
    }

    JsonNode voice = message.has("voice") ? message.path("voice") : message.path("audio");
    if (!voice.isMissingNode() && !voice.isNull()) {
      return handleVoice(chatId, voice.path("file_id").asText(""));
    }
    Optional<OperatorMedia> media = OperatorMedia.from(message);
    if (media.isPresent()) {
      return handleMedia(chatId, media.get());
    }

    String text = message.path("text").asText("").trim();
    if (text.isBlank()) {
      return "ignored:blank_text";
    }
    if (text.startsWith("/") && !(awaitingEdit(chatId) && !isCancel(text))) {
      reply(chatId, commands.handle(chatId, text));
      return "command";
    }
    return handleText(chatId, text);
  }

  private boolean awaitingEdit(String chatId) {
    return states
        .get(chatId)
        .filter(p -> p.state() == OperatorState.AWAITING_EDIT)
        .isPresent();
  }

  private static boolean isCancel(String text) {
    String command = text.split("\\s+", 2)[0];
    int at = command.indexOf('@');
    return (at < 0 ? command : command.substring(0, at)).equalsIgnoreCase("/cancel");
  }

  private String handleCallback(JsonNode callback) {
    JsonNode message = callback.path("message");
    String callbackId = callback.path("id").asText(null);
    String chatId = message.path("chat").path("id").asText();
    if (!isOperator(chatId)) {
      log.warn("Ignoring callback from non-operator chat {}", chatId);
      bot.answerCallbackQuery(callbackId, null);
      return "ignored:foreign_chat";
    }

    String data = callback.path("data").asText("");
    Optional<CardAction.Parsed> parsed = CardAction.parse(data);
    if (parsed.isEmpty()) {
      log.warn("Malformed callback data dropped: {}", data);
      bot.answerCallbackQuery(callbackId, "Unknown action");
      return "ignored:malformed_callback";
    }

    Long recordId = parsed.get().recordId();
    String cardId =
        TelegramApprovalChannel.cardId(chatId, message.path("message_id").asLong(-1));
    switch (parsed.get().action()) {
      case APPROVE -> answer(callbackId, decide(Decision.approve(recordId).onCard(cardId)));
      case REJECT -> answer(callbackId, decide(Decision.reject(recordId).onCard(cardId)));
      case BLOCK -> answer(callbackId, decide(Decision.block(recordId).onCard(cardId)));
      case LATER -> answer(callbackId, decide(Decision.replyLater(recordId).onCard(cardId)));
      case EDIT -> {
        bot.answerCallbackQuery(callbackId, null);
        awaitInput(chatId, recordId, OperatorState.AWAITING_EDIT);
      }
      case VOICE -> {
        bot.answerCallbackQuery(callbackId, null);
        awaitInput(chatId, recordId, OperatorState.AWAITING_VOICE);
      }
    }
    return "callback";
  }

  private void awaitInput(String chatId, Long recordId, OperatorState state) {
    Optional<ApprovalRecordEntity> record = coordinator.find(recordId);
    if (record.isEmpty() || record.get().getState() != ApprovalState.PENDING) {
      reply(chatId, "#" + recordId + " is no longer pending.");
      return;
    }
    states.set(chatId, state, recordId);
    if (state == OperatorState.AWAITING_EDIT) {
      reply(
          chatId,
          "Send the reply for #" + recordId + " (text, photo, video or document), or /cancel.");
    } else {
      reply(chatId, "Send a voice message for #" + recordId + ", or /cancel.");
    }
  }

  private String handleText(String chatId, String text) {
    Optional<OperatorStateStore.Pending> pending = states.get(chatId);
    if (pending.isEmpty() || pending.get().state() != OperatorState.AWAITING_EDIT) {
      reply(chatId, "Use the buttons on a card, or /help.");
      return "ignored:no_pending_edit";
    }
    states.clear(chatId);
    DecisionOutcome outcome = decide(Decision.edit(pending.get().recordId(), text));
    reply(chatId, describe(outcome));
    return "edit";
  }

  private String handleVoice(String chatId, String fileId) {
    Optional<OperatorStateStore.Pending> pending = states.get(chatId);
    if (pending.isEmpty() || pending.get().state() == OperatorState.NONE) {
      reply(chatId, "Press \"" + CardAction.VOICE.label() + "\" on a card first.");
      return "ignored:no_pending_voice";
    }
    Long recordId = pending.get().recordId();
    Path file = download(fileId, recordId, null);
    if (file == null) {
      reply(chatId, "Could not fetch the voice message, please send it again.");
      return "voice:download_failed";
    }
    states.clear(chatId);
    reply(chatId, describe(decide(Decision.recordOwn(recordId, file.toString()))));
    return "voice";
  }

  private String handleMedia(String chatId, OperatorMedia media) {
    Optional<OperatorStateStore.Pending> pending = states.get(chatId);
    if (pending.isEmpty() || pending.get().state() != OperatorState.AWAITING_EDIT) {
      reply(chatId, "Press \"" + CardAction.EDIT.label() + "\" on a card first.");
      return "ignored:no_pending_edit";
    }
    Long recordId = pending.get().recordId();
    Path file = download(media.fileId(), recordId, media.fileName());
    if (file == null) {
      reply(chatId, "Could not fetch the file, please send it again.");
      return "media:download_failed";
    }
    states.clear(chatId);
    reply(chatId, describe(decide(Decision.sendMedia(recordId, file.toString(), media.label()))));
    return "media";
  }

  private Path download(String fileId, Long recordId, String fileName) {
    String filePath = bot.getFilePath(fileId);
    if (filePath == null) {
      return null;
    }
    String extension = extensionOf(fileName);
    if (extension.isEmpty()) {
      extension = extensionOf(filePath);
    }
    try {
      Files.createDirectories(uploadDir);
      Path target = uploadDir.resolve("reply-" + recordId + "-" + System.nanoTime() + extension);
      return bot.downloadFile(filePath, target) ? target : null;
    } catch (IOException e) {
      log.warn("Cannot prepare upload directory {}: {}", uploadDir, e.getMessage());
      return null;
    }
  }

  private static String extensionOf(String name) {
    if (name == null || name.lastIndexOf('.') < 0) {
      return "";
    }
    String extension = name.substring(name.lastIndexOf('.'));
    return SAFE_EXTENSION.matcher(extension).matches() ? extension : "";
  }

  private DecisionOutcome decide(Decision decision) {
    DecisionOutcome outcome = coordinator.decide(decision);
    log.info(
        "Operator {} on #{} -> {}", decision.kind(), outcome.recordId(), outcome.status());
    return outcome;
  }

  private void answer(String callbackId, DecisionOutcome outcome) {
    bot.answerCallbackQuery(callbackId, describe(outcome));
  }

  static String describe(DecisionOutcome outcome) {
    return switch (outcome.status()) {
      case APPLIED ->
          outcome.state() == ApprovalState.PENDING ? "Reminder set" : "Done: " + outcome.state();
      case DUPLICATE -> "Already resolved";
      case NOT_FOUND -> "Unknown approval";
      case REFUSED -> "Not allowed: " + outcome.detail();
      case MALFORMED -> "Malformed request";
      case FAILED -> "Failed, try again";
    };
  }

  private boolean isOperator(String chatId) {
    return !operatorChatId.isBlank() && operatorChatId.equals(chatId);
  }

  private void reply(String chatId, String text) {
    if (text != null && !text.isBlank()) {
      bot.sendMessage(chatId, CardRenderer.escape(text), null);
    }
  }
}
