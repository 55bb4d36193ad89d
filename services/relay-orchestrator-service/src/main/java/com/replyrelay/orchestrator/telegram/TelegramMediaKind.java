package com.replyrelay.orchestrator.telegram;

import java.util.Locale;

/** Bot API upload method and form field per media type; anything unknown goes as a document. */
public enum TelegramMediaKind {
  PHOTO("sendPhoto", "photo"),
  VIDEO("sendVideo", "video"),
  DOCUMENT("sendDocument", "document");

  private final String method;
  private final String field;

  TelegramMediaKind(String method, String field) {
    this.method = method;
    this.field = field;
  }

  public String method() {
    return method;
  }

  public String field() {
    return field;
  }

  public static TelegramMediaKind of(String mediaType) {
    String type = mediaType == null ? "" : mediaType.toLowerCase(Locale.ROOT);
    return switch (type) {
      case "image", "photo" -> PHOTO;
      case "video" -> VIDEO;
      default -> DOCUMENT;
    };
  }
}
