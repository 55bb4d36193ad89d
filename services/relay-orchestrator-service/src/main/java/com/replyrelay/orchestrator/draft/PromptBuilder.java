package com.replyrelay.orchestrator.draft;

import com.replyrelay.orchestrator.config.DraftProperties;
import com.replyrelay.orchestrator.domain.MessageDirection;
import com.replyrelay.orchestrator.store.ConversationContext;
import com.replyrelay.orchestrator.transport.InboundMessage;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PromptBuilder {

  private final String systemPrompt;
  private final int window;

  public PromptBuilder(DraftProperties properties) {
    this.systemPrompt = properties.systemPrompt();
    this.window = properties.contextWindow();
  }

  /**
   * System prompt, then at most {@code window - 1} trailing context messages, then the new
   * message. Blank bodies (untranscribed media) are skipped.
   */
  public List<PromptMessage> build(ConversationContext context, InboundMessage message) {
    List<ConversationContext.WindowMessage> history = context.recentWindow();
    int from = Math.max(0, history.size() - (window - 1));
    List<PromptMessage> prompt = new ArrayList<>();
    prompt.add(PromptMessage.system(systemPrompt));
    for (ConversationContext.WindowMessage m : history.subList(from, history.size())) {
      if (m.body() == null || m.body().isBlank()) {
        continue;
      }
      prompt.add(
          m.direction() == MessageDirection.OUTBOUND
              ? PromptMessage.assistant(m.body())
              : PromptMessage.user(m.body()));
    }
    prompt.add(PromptMessage.user(message.body()));
    return prompt;
  }
}
