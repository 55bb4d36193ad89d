package com.replyrelay.orchestrator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param mode {@code chat} rebuilds the context on every call, {@code assistants} keeps one
 *     server-side thread per conversation
 * @param redraftOnMerge ask for a new draft when a message is merged into a Pending card
 */
@ConfigurationProperties(prefix = "relay.draft")
public record DraftProperties(
    String mode,
    Duration timeout,
    int contextWindow,
    String systemPrompt,
    boolean redraftOnMerge) {

  public DraftProperties {
    mode = mode == null || mode.isBlank() ? "chat" : mode.trim();
    timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    contextWindow = contextWindow <= 0 ? 10 : contextWindow;
    systemPrompt =
        systemPrompt == null || systemPrompt.isBlank()
            ? "You are a helpful assistant replying on behalf of the account owner."
            : systemPrompt;
  }

  public boolean statefulMode() {
    return "assistants".equalsIgnoreCase(mode);
  }
}
