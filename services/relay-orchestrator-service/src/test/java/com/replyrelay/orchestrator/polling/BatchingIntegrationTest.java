package com.replyrelay.orchestrator.polling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.replyrelay.orchestrator.RelayIntegrationTestBase;
import com.replyrelay.orchestrator.approval.ApprovalCoordinator;
import com.replyrelay.orchestrator.approval.Decision;
import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ProcessedMessageEntity;
import com.replyrelay.orchestrator.domain.ProcessingOutcome;
import com.replyrelay.orchestrator.draft.DraftReply;
import com.replyrelay.orchestrator.draft.DraftResult;
import com.replyrelay.orchestrator.draft.PromptMessage;
import com.replyrelay.orchestrator.repository.ProcessedMessageRepository;
import com.replyrelay.orchestrator.transport.InboundMessage;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

@TestPropertySource(
    properties = {"relay.poller.batch-window=PT2S", "relay.draft.redraft-on-merge=true"})
class BatchingIntegrationTest extends RelayIntegrationTestBase {

  @Autowired IngestionPoller poller;
  @Autowired ApprovalCoordinator coordinator;
  @Autowired ProcessedMessageRepository processed;

  @Test
  void fragmentsTypedInARow_areHeldThenDraftedAsOne() {
    when(ai.complete(anyList())).thenReturn("We open at 9.");
    Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    inbox.add(fragment("nina", "f1", now, "hi"));
    inbox.add(fragment("nina", "f2", now, "are you open"));
    inbox.add(fragment("nina", "f3", now, "on sunday?"));

    IngestionPoller.TickReport held = poller.tick();

    assertThat(held.settled()).isZero();
    assertThat(recordsOf("nina")).isEmpty();
    assertThat(store.pollCursor()).contains(now);
    verify(ai, never()).complete(anyList());

    waitUntil(
        () -> {
          poller.tick();
          return !recordsOf("nina").isEmpty();
        });

    ApprovalRecordEntity record = onlyRecordOf("nina");
    assertThat(record.getIncomingText()).isEqualTo("hi\nare you open\non sunday?");
    assertThat(record.getSourceMessageId()).isEqualTo("f1");
    assertThat(record.getDraftText()).isEqualTo("We open at 9.");
    assertThat(processed.findAll())
        .extracting(ProcessedMessageEntity::getOutcome)
        .containsOnly(ProcessingOutcome.QUEUED_FOR_APPROVAL)
        .hasSize(3);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<PromptMessage>> prompt = ArgumentCaptor.forClass(List.class);
    verify(ai, times(1)).complete(prompt.capture());
    assertThat(prompt.getValue()).extracting(PromptMessage::role).containsExactly("system", "user");
    assertThat(prompt.getValue().get(1).content()).isEqualTo("hi\nare you open\non sunday?");
    verify(channel, times(1)).present(any());
  }

  @Test
  void oldFragments_areNotHeld() {
    when(ai.complete(anyList())).thenReturn("Sure.");
    inbound("otto", "o1", 1, "can I");
    inbound("otto", "o2", 2, "book a table");

    IngestionPoller.TickReport report = poller.tick();

    assertThat(report.settled()).isEqualTo(2);
    assertThat(onlyRecordOf("otto").getIncomingText()).isEqualTo("can I\nbook a table");
  }

  @Test
  void mergedMessage_getsAFreshDraft() {
    when(ai.complete(anyList())).thenReturn("Yes, table for two.", "Yes, and parking is free.");
    inbound("pia", "p1", 1, "table for two tonight?");
    poller.tick();
    ApprovalRecordEntity pending = onlyRecordOf("pia");
    assertThat(pending.getDraftText()).isEqualTo("Yes, table for two.");

    inbox.add(fragment("pia", "p2", Instant.now().truncatedTo(ChronoUnit.SECONDS), "parking?"));
    poller.tick();

    ApprovalRecordEntity merged = onlyRecordOf("pia");
    assertThat(merged.getIncomingText()).contains("table for two tonight?").contains("parking?");
    assertThat(merged.getDraftText()).isEqualTo("Yes, and parking is free.");
    verify(channel, times(2)).update(eq(pending.getCardId()), any());
  }

  @Test
  void redraftAfterDecision_isDropped() {
    when(ai.complete(anyList())).thenReturn("Done.");
    inbound("quin", "q1", 1, "cancel my order");
    poller.tick();
    Long id = onlyRecordOf("quin").getId();
    coordinator.decide(Decision.reject(id));

    DraftResult late = DraftResult.of(new DraftReply("quin", "q1", "too late", Instant.now()));

    assertThat(coordinator.redraft(id, late)).isFalse();
    assertThat(onlyRecordOf("quin").getDraftText()).isEqualTo("Done.");
  }

  private static InboundMessage fragment(
      String conversationId, String messageId, Instant at, String body) {
    return new InboundMessage(
        conversationId, messageId, "Sender " + conversationId, body, at, null);
  }
}
