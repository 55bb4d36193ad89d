package com.replyrelay.orchestrator.operator;

import com.replyrelay.orchestrator.domain.ApprovalState;
import com.replyrelay.orchestrator.domain.SubscriptionTag;
import java.time.Instant;

public record ConversationSummary(
    String conversationId,
    String displayName,
    SubscriptionTag subscriptionTag,
    boolean blacklisted,
    String lastMessageId,
    Instant lastMessageAt,
    Long openApprovalId,
    ApprovalState openApprovalState) {}
