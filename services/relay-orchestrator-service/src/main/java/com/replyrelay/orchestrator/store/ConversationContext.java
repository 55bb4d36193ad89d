package com.replyrelay.orchestrator.store;

import com.replyrelay.orchestrator.domain.MessageDirection;
import com.replyrelay.orchestrator.domain.SubscriptionTag;
import java.time.Instant;
import java.util.List;

/** Read model of one conversation: the recent window, oldest first. */
public record ConversationContext(
    String conversationId,
    String displayName,
    List<WindowMessage> recentWindow,
    SubscriptionTag subscriptionTag,
    boolean blacklisted) {

  public ConversationContext {
    recentWindow = recentWindow == null ? List.of() : List.copyOf(recentWindow);
    subscriptionTag = subscriptionTag == null ? SubscriptionTag.FREE : subscriptionTag;
  }

  /** The same context without window messages from {@code cutoff} on. */
  public ConversationContext before(Instant cutoff) {
    List<WindowMessage> earlier =
        recentWindow.stream().filter(m -> m.at() == null || m.at().isBefore(cutoff)).toList();
    return new ConversationContext(
        conversationId, displayName, earlier, subscriptionTag, blacklisted);
  }

  public record WindowMessage(MessageDirection direction, String body, Instant at) {}
}
