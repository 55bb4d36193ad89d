package com.replyrelay.orchestrator.telegram;

import java.util.Optional;

/**
 * Buttons on an approval card. Callback data is {@code "<code>:<recordId>"}, well inside
 * Telegram's 64 byte limit.
 */
public enum CardAction {
  APPROVE("ap", "Approve"),
  EDIT("ed", "Edit"),
  VOICE("vo", "Record voice"),
  LATER("lt", "Reply later"),
  REJECT("rj", "Reject"),
  BLOCK("bl", "Block");

  private final String code;
  private final String label;

  CardAction(String code, String label) {
    this.code = code;
    this.label = label;
  }

  public String label() {
    return label;
  }

  public String callbackData(Long recordId) {
    return code + ":" + recordId;
  }

  public InlineKeyboard.Button button(Long recordId) {
    return new InlineKeyboard.Button(label, callbackData(recordId));
  }

  /** Parses callback data; empty for anything that is not a card action. */
  public static Optional<Parsed> parse(String data) {
    if (data == null) {
      return Optional.empty();
    }
    String[] parts = data.trim().split(":", 2);
    if (parts.length != 2) {
      return Optional.empty();
    }
    for (CardAction action : values()) {
      if (action.code.equals(parts[0])) {
        try {
          long id = Long.parseLong(parts[1]);
          return id > 0 ? Optional.of(new Parsed(action, id)) : Optional.empty();
        } catch (NumberFormatException e) {
          return Optional.empty();
        }
      }
    }
    return Optional.empty();
  }

  public record Parsed(CardAction action, Long recordId) {}
}
