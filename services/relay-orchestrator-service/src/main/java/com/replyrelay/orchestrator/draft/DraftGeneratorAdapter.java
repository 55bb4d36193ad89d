package com.replyrelay.orchestrator.draft;

import com.replyrelay.orchestrator.common.RelayErrorKind;
import com.replyrelay.orchestrator.common.RelayException;
import com.replyrelay.orchestrator.config.DraftProperties;
import com.replyrelay.orchestrator.store.ConversationContext;
import com.replyrelay.orchestrator.transport.InboundMessage;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Produces a draft reply for a new inbound message. Never throws: every failure comes back as a
 * failed {@link DraftResult}, and the call is cut off after {@code relay.draft.timeout}.
 */
@Component
@Slf4j
public class DraftGeneratorAdapter {

  private final AiBackend backend;
  private final DraftSessionRegistry sessions;
  private final PromptBuilder promptBuilder;
  private final ThreadPoolTaskExecutor executor;
  private final DraftProperties properties;

  public DraftGeneratorAdapter(
      AiBackend backend,
      DraftSessionRegistry sessions,
      PromptBuilder promptBuilder,
      @Qualifier("draftTaskExecutor") ThreadPoolTaskExecutor executor,
      DraftProperties properties) {
    this.backend = backend;
    this.sessions = sessions;
    this.promptBuilder = promptBuilder;
    this.executor = executor;
    this.properties = properties;
  }

  public DraftResult generate(ConversationContext context, InboundMessage message) {
    if (!backend.isConfigured()) {
      return DraftResult.failed(RelayErrorKind.TRANSIENT_IO, "AI backend is not configured");
    }
    Duration timeout = properties.timeout();
    Future<String> future;
    try {
      future = executor.submit(() -> draftText(context, message));
    } catch (TaskRejectedException e) {
      log.warn("Draft executor saturated, skipping draft for {}", message.messageId());
      return DraftResult.failed(RelayErrorKind.TRANSIENT_IO, "draft executor saturated");
    }
    try {
      String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (text == null || text.isBlank()) {
        return DraftResult.failed(RelayErrorKind.TRANSIENT_IO, "empty draft");
      }
      return DraftResult.of(
          new DraftReply(
              message.conversationId(), message.messageId(), text.trim(), Instant.now()));
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn(
          "Draft for message {} in {} timed out after {}",
          message.messageId(),
          message.conversationId(),
          timeout);
      return DraftResult.failed(RelayErrorKind.TIMEOUT, "no draft within " + timeout);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      RelayErrorKind kind =
          cause instanceof RelayException re ? re.kind() : RelayErrorKind.TRANSIENT_IO;
      log.warn(
          "Draft for message {} in {} failed: {}",
          message.messageId(),
          message.conversationId(),
          cause.getMessage());
      return DraftResult.failed(kind, cause.getMessage());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return DraftResult.failed(RelayErrorKind.TIMEOUT, "interrupted");
    }
  }

  private String draftText(ConversationContext context, InboundMessage message) {
    if (properties.statefulMode()) {
      try {
        String handle = sessions.handleFor(message.conversationId());
        return backend.continueSession(handle, message.body());
      } catch (RelayException e) {
        log.warn(
            "Stateful draft failed for {} ({}), falling back to chat completions",
            message.conversationId(),
            e.getMessage());
      }
    }
    return backend.complete(promptBuilder.build(context, message));
  }
}
