package com.replyrelay.orchestrator.telegram;

import com.replyrelay.orchestrator.approval.ApprovalCard;
import com.replyrelay.orchestrator.approval.ApprovalChannel;
import com.replyrelay.orchestrator.client.TelegramBotClient;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Approval cards as messages in the operator's Telegram chat. Card id is "chatId:messageId". */
@Component
@Slf4j
public class TelegramApprovalChannel implements ApprovalChannel {

  private final TelegramBotClient bot;
  private final CardRenderer renderer;
  private final String operatorChatId;

  public TelegramApprovalChannel(
      TelegramBotClient bot,
      CardRenderer renderer,
      @Value("${telegram.operator-chat-id:}") String operatorChatId) {
    this.bot = bot;
    this.renderer = renderer;
    this.operatorChatId = operatorChatId == null ? "" : operatorChatId.trim();
  }

  @Override
  public String present(ApprovalCard card) {
    if (operatorChatId.isBlank()) {
      log.warn("telegram.operator-chat-id is empty; card #{} not shown", card.recordId());
      return null;
    }
    Long messageId = bot.sendMessage(operatorChatId, renderer.text(card), renderer.keyboard(card));
    return messageId == null ? null : cardId(operatorChatId, messageId);
  }

  @Override
  public void update(String cardId, ApprovalCard card) {
    String[] parts = cardId == null ? new String[0] : cardId.split(":", 2);
    if (parts.length != 2) {
      log.warn("Cannot update card #{} with malformed card id {}", card.recordId(), cardId);
      return;
    }
    bot.editMessageText(parts[0], parts[1], renderer.text(card), renderer.keyboard(card));
  }

  @Override
  public void notifyOperator(String text) {
    if (operatorChatId.isBlank()) {
      log.warn("telegram.operator-chat-id is empty; notification dropped: {}", text);
      return;
    }
    bot.sendMessage(operatorChatId, CardRenderer.escape(text), null);
  }

  @Override
  public void forwardMedia(Long recordId, String senderName, String mediaType, Path file) {
    if (operatorChatId.isBlank()) {
      log.warn("telegram.operator-chat-id is empty; media for #{} not forwarded", recordId);
      return;
    }
    String caption =
        "Media for #" + recordId + " from " + senderName + "\nFile: " + file.getFileName();
    bot.sendMedia(operatorChatId, TelegramMediaKind.of(mediaType), file, caption);
  }

  public static String cardId(String chatId, long messageId) {
    return chatId + ":" + messageId;
  }
}
