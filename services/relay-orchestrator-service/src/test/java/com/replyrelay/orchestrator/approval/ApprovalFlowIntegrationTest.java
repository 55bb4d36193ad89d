package com.replyrelay.orchestrator.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.replyrelay.orchestrator.RelayIntegrationTestBase;
import com.replyrelay.orchestrator.common.RelayErrorKind;
import com.replyrelay.orchestrator.common.RelayException;
import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ApprovalState;
import com.replyrelay.orchestrator.domain.MessageDirection;
import com.replyrelay.orchestrator.polling.IngestionPoller;
import com.replyrelay.orchestrator.store.ConversationContext;
import com.replyrelay.orchestrator.transport.SendResult;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ApprovalFlowIntegrationTest extends RelayIntegrationTestBase {

  @Autowired IngestionPoller poller;
  @Autowired ApprovalCoordinator coordinator;

  @BeforeEach
  void happyBackends() {
    when(ai.complete(anyList())).thenReturn("See you at 5pm!");
    when(transport.send(anyString(), anyString())).thenReturn(SendResult.ok());
    when(transport.sendMedia(anyString(), anyString())).thenReturn(SendResult.ok());
  }

  @Test
  void approve_sendsDraftVerbatimAndAudits() {
    inbound("alice", "m1", 1, "are we meeting today?");
    poller.tick();

    ApprovalRecordEntity pending = onlyRecordOf("alice");
    assertThat(pending.getState()).isEqualTo(ApprovalState.PENDING);
    assertThat(pending.getDraftText()).isEqualTo("See you at 5pm!");
    assertThat(pending.getCardId()).startsWith("4242:");
    verify(channel).present(any());

    DecisionOutcome outcome =
        coordinator.decide(Decision.approve(null).onCard(pending.getCardId()));

    assertThat(outcome.status()).isEqualTo(DecisionOutcome.Status.APPLIED);
    verify(transport, timeout(5_000)).send("alice", "See you at 5pm!");
    waitUntil(() -> onlyRecordOf("alice").getState() == ApprovalState.SENT);
    waitUntil(() -> auditStatuses("alice").size() == 2);
    assertThat(auditStatuses("alice")).containsExactly("Pending", "Sent");

    ConversationContext context = store.context("alice");
    assertThat(context.recentWindow())
        .extracting(ConversationContext.WindowMessage::direction)
        .containsExactly(MessageDirection.INBOUND, MessageDirection.OUTBOUND);
  }

  @Test
  void edit_sendsOperatorTextInsteadOfDraft() {
    inbound("bob", "m1", 1, "price?");
    poller.tick();
    Long id = onlyRecordOf("bob").getId();

    coordinator.decide(Decision.edit(id, "  It is 20 EUR.  "));

    verify(transport, timeout(5_000)).send("bob", "It is 20 EUR.");
    verify(transport, never()).send("bob", "See you at 5pm!");
    waitUntil(() -> onlyRecordOf("bob").getState() == ApprovalState.SENT);
    assertThat(onlyRecordOf("bob").getFinalText()).isEqualTo("It is 20 EUR.");
  }

  @Test
  void recordOwn_sendsVoiceFile() {
    inbound("carol", "m1", 1, "call me?");
    poller.tick();
    Long id = onlyRecordOf("carol").getId();

    coordinator.decide(Decision.recordOwn(id, "/tmp/reply-1.ogg"));

    verify(transport, timeout(5_000)).sendMedia("carol", "/tmp/reply-1.ogg");
    waitUntil(() -> onlyRecordOf("carol").getState() == ApprovalState.SENT);
    assertThat(onlyRecordOf("carol").getFinalText())
        .isEqualTo(ApprovalRecordEntity.VOICE_PLACEHOLDER);
  }

  @Test
  void block_blacklistsAndDropsLaterMessages() {
    inbound("spam", "m1", 1, "buy now");
    poller.tick();
    Long id = onlyRecordOf("spam").getId();

    DecisionOutcome outcome = coordinator.decide(Decision.block(id));

    assertThat(outcome.state()).isEqualTo(ApprovalState.BLOCKED);
    assertThat(store.isBlacklisted("spam")).isTrue();

    inbound("spam", "m2", 5, "last chance");
    poller.tick();

    assertThat(recordsOf("spam")).hasSize(1);
    verify(transport, never()).send(eq("spam"), anyString());
    waitUntil(() -> auditStatuses("spam").size() == 2);
    assertThat(auditStatuses("spam")).containsExactly("Pending", "Blocked");
  }

  @Test
  void reject_closesWithoutSending() {
    inbound("dave", "m1", 1, "hello?");
    poller.tick();

    coordinator.decide(Decision.reject(onlyRecordOf("dave").getId()));

    assertThat(onlyRecordOf("dave").getState()).isEqualTo(ApprovalState.REJECTED);
    assertThat(onlyRecordOf("dave").isOpen()).isFalse();
    waitUntil(() -> auditStatuses("dave").contains("Rejected"));
    verify(transport, never()).send(eq("dave"), anyString());
  }

  @Test
  void duplicateDecision_isAcknowledgedAndIgnored() {
    inbound("erin", "m1", 1, "ok?");
    poller.tick();
    Long id = onlyRecordOf("erin").getId();

    DecisionOutcome first = coordinator.decide(Decision.approve(id));
    DecisionOutcome second = coordinator.decide(Decision.reject(id));

    assertThat(first.applied()).isTrue();
    assertThat(second.status()).isEqualTo(DecisionOutcome.Status.DUPLICATE);
    verify(transport, timeout(5_000)).send("erin", "See you at 5pm!");
    waitUntil(() -> onlyRecordOf("erin").getState() == ApprovalState.SENT);
    verify(transport, times(1)).send(eq("erin"), anyString());
  }

  @Test
  void malformedAndUnknownDecisions_neverThrow() {
    assertThat(coordinator.decide(null).status()).isEqualTo(DecisionOutcome.Status.MALFORMED);
    assertThat(coordinator.decide(Decision.edit(1L, " ")).status())
        .isEqualTo(DecisionOutcome.Status.MALFORMED);
    assertThat(coordinator.decide(Decision.approve(999_999L)).status())
        .isEqualTo(DecisionOutcome.Status.NOT_FOUND);
  }

  @Test
  void newerMessage_isMergedIntoPendingCard() {
    inbound("frank", "m1", 1, "hi");
    poller.tick();
    inbound("frank", "m2", 2, "are you there?");
    poller.tick();

    ApprovalRecordEntity record = onlyRecordOf("frank");
    assertThat(record.getIncomingText()).contains("hi").contains("are you there?");
    verify(channel).update(eq(record.getCardId()), any());
    verify(ai, times(1)).complete(anyList());
  }

  @Test
  void failedDraft_stillGivesOperatorAManualCard() {
    when(ai.complete(anyList()))
        .thenThrow(new RelayException(RelayErrorKind.TRANSIENT_IO, "backend down"));
    inbound("gina", "m1", 1, "need help");
    poller.tick();

    ApprovalRecordEntity record = onlyRecordOf("gina");
    assertThat(record.getState()).isEqualTo(ApprovalState.PENDING);
    assertThat(record.hasDraft()).isFalse();
    assertThat(record.getDraftFailure()).contains("backend down");
    verify(channel).present(any());

    assertThat(coordinator.decide(Decision.approve(record.getId())).status())
        .isEqualTo(DecisionOutcome.Status.REFUSED);
    assertThat(coordinator.decide(Decision.edit(record.getId(), "On it")).applied()).isTrue();
    verify(transport, timeout(5_000)).send("gina", "On it");
  }

  @Test
  void overdueCard_expiresAndFreesTheSlot() {
    inbound("hank", "m1", 1, "anyone?");
    poller.tick();

    int expired = coordinator.expireOverdue(Instant.now().plus(25, ChronoUnit.HOURS));

    assertThat(expired).isEqualTo(1);
    assertThat(onlyRecordOf("hank").getState()).isEqualTo(ApprovalState.EXPIRED);
    waitUntil(() -> auditStatuses("hank").contains("Expired"));

    inbound("hank", "m2", 10, "hello again");
    poller.tick();
    List<ApprovalRecordEntity> all = recordsOf("hank");
    assertThat(all).hasSize(2);
    assertThat(all.get(1).getState()).isEqualTo(ApprovalState.PENDING);
  }

  @Test
  void cardThatFailedToShow_isPresentedBySweep() {
    when(channel.present(any())).thenReturn(null);
    inbound("ivy", "m1", 1, "ping");
    poller.tick();
    assertThat(onlyRecordOf("ivy").getCardId()).isNull();

    when(channel.present(any())).thenReturn("4242:7");

    assertThat(coordinator.presentMissingCards()).isEqualTo(1);
    assertThat(onlyRecordOf("ivy").getCardId()).isEqualTo("4242:7");
  }

  @Test
  void operatorBlockByConversation_resolvesPendingCard() {
    inbound("jack", "m1", 1, "hey");
    poller.tick();

    assertThat(coordinator.blockConversation("jack", "abusive")).isTrue();
    assertThat(coordinator.blockConversation("jack", "again")).isFalse();

    assertThat(onlyRecordOf("jack").getState()).isEqualTo(ApprovalState.BLOCKED);
    assertThat(store.blacklist())
        .singleElement()
        .satisfies(e -> assertThat(e.getReason()).isEqualTo("abusive"));
  }

  @Test
  void customMediaReply_sendsOperatorFileAndAuditsItsLabel() {
    inbound("kate", "m1", 1, "send me the menu");
    poller.tick();
    Long id = onlyRecordOf("kate").getId();

    DecisionOutcome outcome =
        coordinator.decide(Decision.sendMedia(id, "/tmp/menu.pdf", "[Document: menu.pdf]"));

    assertThat(outcome.applied()).isTrue();
    verify(transport, timeout(5_000)).sendMedia("kate", "/tmp/menu.pdf");
    waitUntil(() -> onlyRecordOf("kate").getState() == ApprovalState.SENT);
    assertThat(onlyRecordOf("kate").getFinalText()).isEqualTo("[Document: menu.pdf]");
    assertThat(onlyRecordOf("kate").getMediaRef()).isEqualTo("/tmp/menu.pdf");
    verify(transport, never()).send(eq("kate"), anyString());
  }

  @Test
  void mediaDecisionWithoutFile_isMalformed() {
    assertThat(coordinator.decide(Decision.sendMedia(1L, null, "[Photo]")).status())
        .isEqualTo(DecisionOutcome.Status.MALFORMED);
  }

  @Test
  void replyLater_keepsRecordPendingAndPresentsFreshCardWhenDue() {
    inbound("liam", "m1", 1, "can we talk tomorrow?");
    poller.tick();
    ApprovalRecordEntity pending = onlyRecordOf("liam");
    String firstCard = pending.getCardId();

    DecisionOutcome outcome = coordinator.decide(Decision.replyLater(pending.getId()));

    assertThat(outcome.applied()).isTrue();
    assertThat(outcome.state()).isEqualTo(ApprovalState.PENDING);
    ApprovalRecordEntity putOff = onlyRecordOf("liam");
    assertThat(putOff.getRemindAt()).isAfter(Instant.now().plus(59, ChronoUnit.MINUTES));
    assertThat(putOff.getExpiresAt()).isAfter(putOff.getRemindAt().plus(23, ChronoUnit.HOURS));
    assertThat(coordinator.remindDue(Instant.now())).isZero();
    assertThat(coordinator.expireOverdue(Instant.now().plus(24, ChronoUnit.HOURS))).isZero();

    assertThat(coordinator.remindDue(Instant.now().plus(2, ChronoUnit.HOURS))).isEqualTo(1);

    ApprovalRecordEntity reminded = onlyRecordOf("liam");
    assertThat(reminded.getState()).isEqualTo(ApprovalState.PENDING);
    assertThat(reminded.getRemindAt()).isNull();
    assertThat(reminded.getCardId()).isNotNull().isNotEqualTo(firstCard);
    verify(channel, times(2)).present(any());
    verify(transport, never()).send(eq("liam"), anyString());

    coordinator.decide(Decision.approve(reminded.getId()).onCard(reminded.getCardId()));
    verify(transport, timeout(5_000)).send("liam", "See you at 5pm!");
  }

  @Test
  void mergeRacingApproval_neverOpensTwoCardsOrLosesTheMessage() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      for (int round = 0; round < 5; round++) {
        String conversation = "race-" + round;
        inbound(conversation, conversation + "-m1", round * 10 + 1, "first");
        poller.tick();
        Long id = onlyRecordOf(conversation).getId();
        inbound(conversation, conversation + "-m2", round * 10 + 2, "second");

        CountDownLatch start = new CountDownLatch(1);
        Future<IngestionPoller.TickReport> tick =
            pool.submit(
                () -> {
                  start.await(5, TimeUnit.SECONDS);
                  return poller.tick();
                });
        Future<DecisionOutcome> approval =
            pool.submit(
                () -> {
                  start.await(5, TimeUnit.SECONDS);
                  return coordinator.decide(Decision.approve(id));
                });
        start.countDown();
        tick.get(10, TimeUnit.SECONDS);

        assertThat(approval.get(10, TimeUnit.SECONDS).applied()).isTrue();
        assertThat(recordsOf(conversation).stream().filter(ApprovalRecordEntity::isOpen).count())
            .isLessThanOrEqualTo(1);

        waitUntil(() -> recordsOf(conversation).get(0).getState() == ApprovalState.SENT);
        poller.tick();

        List<ApprovalRecordEntity> all = recordsOf(conversation);
        assertThat(all).hasSizeBetween(1, 2);
        assertThat(all.stream().filter(r -> r.getIncomingText().contains("second")).count())
            .isEqualTo(1);
        assertThat(all.stream().filter(ApprovalRecordEntity::isOpen).count())
            .isLessThanOrEqualTo(1);
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
