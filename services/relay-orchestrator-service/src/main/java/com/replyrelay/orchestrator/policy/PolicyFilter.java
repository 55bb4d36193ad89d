package com.replyrelay.orchestrator.policy;

import com.replyrelay.orchestrator.domain.SubscriptionTag;
import com.replyrelay.orchestrator.store.ConversationStore;
import org.springframework.stereotype.Component;

/**
 * Eligibility of an inbound message by sender. The subscription tag is display-only and never
 * gates processing.
 */
@Component
public class PolicyFilter {

  private final ConversationStore store;

  public PolicyFilter(ConversationStore store) {
    this.store = store;
  }

  public boolean isEligible(String conversationId) {
    return !store.isBlacklisted(conversationId);
  }

  public SubscriptionTag tag(String conversationId) {
    return store.tag(conversationId);
  }
}
