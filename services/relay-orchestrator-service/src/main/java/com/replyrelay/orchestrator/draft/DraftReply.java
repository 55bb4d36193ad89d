package com.replyrelay.orchestrator.draft;

import java.time.Instant;

public record DraftReply(
    String conversationId, String sourceMessageId, String text, Instant generatedAt) {}
