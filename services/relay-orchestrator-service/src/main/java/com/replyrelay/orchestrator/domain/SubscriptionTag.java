package com.replyrelay.orchestrator.domain;

import java.util.Locale;

/** Informational tier shown on approval cards. Never used to gate processing. */
public enum SubscriptionTag {
  FREE,
  BASIC,
  PREMIUM;

  public static SubscriptionTag parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("subscription tag is required");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown subscription tag: " + raw);
    }
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
