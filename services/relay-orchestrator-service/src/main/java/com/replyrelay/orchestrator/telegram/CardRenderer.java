package com.replyrelay.orchestrator.telegram;

import com.replyrelay.orchestrator.approval.ApprovalCard;
import com.replyrelay.orchestrator.domain.ApprovalState;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Renders approval cards as Telegram HTML plus buttons. */
@Component
public class CardRenderer {

  // Telegram caps message text at 4096 chars; leave room for markup
  static final int MAX_SECTION = 1500;

  private static final DateTimeFormatter REMINDER_TIME =
      DateTimeFormatter.ofPattern("HH:mm 'UTC'").withZone(ZoneOffset.UTC);

  public String text(ApprovalCard card) {
    StringBuilder sb = new StringBuilder();
    sb.append("<b>#").append(card.recordId()).append("</b> ");
    sb.append(escape(senderOf(card)));
    if (card.tag() != null) {
      sb.append(" [").append(card.tag().label()).append("]");
    }
    sb.append("\n<code>").append(escape(card.conversationId())).append("</code>\n\n");
    sb.append("<b>Incoming:</b>\n").append(escape(truncate(card.incomingText()))).append("\n\n");

    if (card.hasDraft()) {
      sb.append("<b>Draft:</b>\n").append(escape(truncate(card.draftText())));
    } else {
      sb.append("<i>No draft");
      if (card.draftFailure() != null && !card.draftFailure().isBlank()) {
        sb.append(" (").append(escape(truncate(card.draftFailure()))).append(")");
      }
      sb.append(". Edit or record a reply.</i>");
    }

    String status = statusLine(card);
    if (status != null) {
      sb.append("\n\n").append(status);
    }
    return sb.toString();
  }

  /** Buttons only while the card is Pending. */
  public InlineKeyboard keyboard(ApprovalCard card) {
    if (card.state() != ApprovalState.PENDING) {
      return null;
    }
    Long id = card.recordId();
    List<InlineKeyboard.Button> first = new ArrayList<>();
    if (card.hasDraft()) {
      first.add(CardAction.APPROVE.button(id));
    }
    first.add(CardAction.EDIT.button(id));
    first.add(CardAction.LATER.button(id));
    return new InlineKeyboard(
        List.of(
            first,
            List.of(
                CardAction.VOICE.button(id),
                CardAction.REJECT.button(id),
                CardAction.BLOCK.button(id))));
  }

  String statusLine(ApprovalCard card) {
    if (card.state() == null) {
      return null;
    }
    return switch (card.state()) {
      case PENDING ->
          card.remindAt() == null
              ? null
              : "Reply later: reminder at " + REMINDER_TIME.format(card.remindAt());
      case APPROVED -> "Approved, sending...";
      case EDITED -> "Edited, sending:\n" + escape(truncate(card.finalText()));
      case SENT -> "Sent: " + escape(truncate(card.finalText()));
      case DELIVERY_FAILED -> "Delivery failed. /retry " + card.recordId();
      case BLOCKED -> "Blocked";
      case REJECTED -> "Rejected";
      case EXPIRED -> "Expired";
    };
  }

  private static String senderOf(ApprovalCard card) {
    String name = card.senderName();
    return name == null || name.isBlank() ? card.conversationId() : name;
  }

  static String truncate(String s) {
    if (s == null) {
      return "";
    }
    return s.length() <= MAX_SECTION ? s : s.substring(0, MAX_SECTION - 1) + "…";
  }

  static String escape(String s) {
    if (s == null) return "";
    return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
