package com.replyrelay.orchestrator.draft;

/** One chat-completions message; role is {@code system}, {@code user} or {@code assistant}. */
public record PromptMessage(String role, String content) {

  public static PromptMessage system(String content) {
    return new PromptMessage("system", content);
  }

  public static PromptMessage user(String content) {
    return new PromptMessage("user", content);
  }

  public static PromptMessage assistant(String content) {
    return new PromptMessage("assistant", content);
  }
}
