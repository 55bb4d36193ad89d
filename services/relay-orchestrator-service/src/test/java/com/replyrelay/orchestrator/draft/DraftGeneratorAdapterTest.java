package com.replyrelay.orchestrator.draft;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.replyrelay.orchestrator.common.RelayErrorKind;
import com.replyrelay.orchestrator.common.RelayException;
import com.replyrelay.orchestrator.config.DraftProperties;
import com.replyrelay.orchestrator.domain.SubscriptionTag;
import com.replyrelay.orchestrator.store.ConversationContext;
import com.replyrelay.orchestrator.transport.InboundMessage;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class DraftGeneratorAdapterTest {

  private final AiBackend backend = mock(AiBackend.class);
  private final DraftSessionRegistry sessions = mock(DraftSessionRegistry.class);
  private ThreadPoolTaskExecutor executor;

  private final ConversationContext context =
      new ConversationContext("c1", "Alice", List.of(), SubscriptionTag.FREE, false);
  private final InboundMessage message =
      new InboundMessage("c1", "m1", "Alice", "what time?", Instant.now(), null);

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.initialize();
    when(backend.isConfigured()).thenReturn(true);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void returnsTrimmedDraft() {
    when(backend.complete(anyList())).thenReturn("  Around 5pm.  ");

    DraftResult result = adapter("chat").generate(context, message);

    assertThat(result.succeeded()).isTrue();
    assertThat(result.text()).isEqualTo("Around 5pm.");
  }

  @Test
  void slowBackend_timesOutInsteadOfBlocking() {
    when(backend.complete(anyList()))
        .thenAnswer(
            inv -> {
              Thread.sleep(2_000);
              return "late";
            });

    long started = System.nanoTime();
    DraftResult result = adapter("chat").generate(context, message);

    assertThat(result.succeeded()).isFalse();
    assertThat(result.failureKind()).isEqualTo(RelayErrorKind.TIMEOUT);
    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
  }

  @Test
  void backendError_isReportedWithItsKind() {
    when(backend.complete(anyList()))
        .thenThrow(new RelayException(RelayErrorKind.TRANSIENT_IO, "503 from backend"));

    DraftResult result = adapter("chat").generate(context, message);

    assertThat(result.succeeded()).isFalse();
    assertThat(result.failureKind()).isEqualTo(RelayErrorKind.TRANSIENT_IO);
    assertThat(result.failureReason()).contains("503");
  }

  @Test
  void blankDraft_countsAsFailure() {
    when(backend.complete(anyList())).thenReturn("   ");

    assertThat(adapter("chat").generate(context, message).succeeded()).isFalse();
  }

  @Test
  void unconfiguredBackend_failsFast() {
    when(backend.isConfigured()).thenReturn(false);

    assertThat(adapter("chat").generate(context, message).succeeded()).isFalse();
  }

  @Test
  void statefulMode_fallsBackToChatWhenSessionFails() {
    when(sessions.handleFor("c1")).thenReturn("thread_1");
    when(backend.continueSession(anyString(), anyString()))
        .thenThrow(new RelayException(RelayErrorKind.TRANSIENT_IO, "run failed"));
    when(backend.complete(anyList())).thenReturn("fallback");

    DraftResult result = adapter("assistants").generate(context, message);

    assertThat(result.text()).isEqualTo("fallback");
  }

  private DraftGeneratorAdapter adapter(String mode) {
    DraftProperties properties = new DraftProperties(mode, Duration.ofMillis(300), 10, null, false);
    return new DraftGeneratorAdapter(
        backend, sessions, new PromptBuilder(properties), executor, properties);
  }
}
