package com.replyrelay.orchestrator.telegram;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replyrelay.orchestrator.approval.ApprovalCoordinator;
import com.replyrelay.orchestrator.approval.Decision;
import com.replyrelay.orchestrator.approval.DecisionKind;
import com.replyrelay.orchestrator.approval.DecisionOutcome;
import com.replyrelay.orchestrator.client.TelegramBotClient;
import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.ApprovalState;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class TelegramUpdateDispatcherTest {

  private static final ObjectMapper JSON = new ObjectMapper();

  @TempDir Path uploadDir;

  private final TelegramBotClient bot = mock(TelegramBotClient.class);
  private final ApprovalCoordinator coordinator = mock(ApprovalCoordinator.class);
  private final OperatorCommandHandler commands = mock(OperatorCommandHandler.class);
  private final OperatorStateStore states = new OperatorStateStore(Duration.ofMinutes(5));
  private TelegramUpdateDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher =
        new TelegramUpdateDispatcher(
            bot, coordinator, states, commands, "4242", uploadDir.toString());
    when(coordinator.decide(any()))
        .thenAnswer(
            inv -> {
              Decision d = inv.getArgument(0);
              return new DecisionOutcome(
                  DecisionOutcome.Status.APPLIED, d.recordId(), ApprovalState.APPROVED, null);
            });
  }

  @Test
  void approveButton_decidesWithCardId() throws Exception {
    String result = dispatcher.dispatch(callback("4242", 77, "ap:5"));

    ArgumentCaptor<Decision> decision = ArgumentCaptor.forClass(Decision.class);
    verify(coordinator).decide(decision.capture());
    assertThat(result).isEqualTo("callback");
    assertThat(decision.getValue().kind()).isEqualTo(DecisionKind.APPROVE);
    assertThat(decision.getValue().recordId()).isEqualTo(5L);
    assertThat(decision.getValue().cardId()).isEqualTo("4242:77");
    verify(bot).answerCallbackQuery(eq("cb-1"), anyString());
  }

  @Test
  void editButtonThenText_appliesEdit() throws Exception {
    ApprovalRecordEntity record = mock(ApprovalRecordEntity.class);
    when(record.getState()).thenReturn(ApprovalState.PENDING);
    when(coordinator.find(5L)).thenReturn(Optional.of(record));

    dispatcher.dispatch(callback("4242", 77, "ed:5"));
    assertThat(states.get("4242"))
        .contains(new OperatorStateStore.Pending(OperatorState.AWAITING_EDIT, 5L));

    String result = dispatcher.dispatch(text("4242", "We open at 9."));

    ArgumentCaptor<Decision> decision = ArgumentCaptor.forClass(Decision.class);
    verify(coordinator).decide(decision.capture());
    assertThat(result).isEqualTo("edit");
    assertThat(decision.getValue().kind()).isEqualTo(DecisionKind.EDIT);
    assertThat(decision.getValue().text()).isEqualTo("We open at 9.");
    assertThat(states.get("4242")).isEmpty();
  }

  @Test
  void voiceAfterVoiceButton_recordsOwnReply() throws Exception {
    ApprovalRecordEntity record = mock(ApprovalRecordEntity.class);
    when(record.getState()).thenReturn(ApprovalState.PENDING);
    when(coordinator.find(8L)).thenReturn(Optional.of(record));
    when(bot.getFilePath("file-1")).thenReturn("voice/file_1.oga");
    when(bot.downloadFile(eq("voice/file_1.oga"), any())).thenReturn(true);

    dispatcher.dispatch(callback("4242", 78, "vo:8"));
    String result = dispatcher.dispatch(voice("4242", "file-1"));

    ArgumentCaptor<Decision> decision = ArgumentCaptor.forClass(Decision.class);
    verify(coordinator).decide(decision.capture());
    assertThat(result).isEqualTo("voice");
    assertThat(decision.getValue().kind()).isEqualTo(DecisionKind.RECORD_OWN);
    assertThat(decision.getValue().mediaRef()).startsWith(uploadDir.toString()).endsWith(".oga");
  }

  @Test
  void slashTextWhileEditing_becomesTheReply() throws Exception {
    awaitingEdit(5L);

    String result = dispatcher.dispatch(text("4242", "/help is on its way"));

    ArgumentCaptor<Decision> decision = ArgumentCaptor.forClass(Decision.class);
    verify(coordinator).decide(decision.capture());
    assertThat(result).isEqualTo("edit");
    assertThat(decision.getValue().kind()).isEqualTo(DecisionKind.EDIT);
    assertThat(decision.getValue().text()).isEqualTo("/help is on its way");
    verify(commands, never()).handle(anyString(), anyString());
  }

  @Test
  void cancelWhileEditing_isStillACommand() throws Exception {
    awaitingEdit(5L);
    when(commands.handle("4242", "/cancel")).thenReturn("Cancelled.");

    assertThat(dispatcher.dispatch(text("4242", "/cancel"))).isEqualTo("command");
    assertThat(dispatcher.dispatch(text("4242", "/CANCEL@relay_bot"))).isEqualTo("command");

    verify(coordinator, never()).decide(any());
    verify(commands).handle("4242", "/cancel");
  }

  @Test
  void documentWhileEditing_sendsItAsTheReply() throws Exception {
    awaitingEdit(6L);
    when(bot.getFilePath("doc-1")).thenReturn("documents/file_3");
    when(bot.downloadFile(eq("documents/file_3"), any())).thenReturn(true);

    String result = dispatcher.dispatch(document("4242", "doc-1", "menu.pdf"));

    ArgumentCaptor<Decision> decision = ArgumentCaptor.forClass(Decision.class);
    verify(coordinator).decide(decision.capture());
    assertThat(result).isEqualTo("media");
    assertThat(decision.getValue().kind()).isEqualTo(DecisionKind.SEND_MEDIA);
    assertThat(decision.getValue().recordId()).isEqualTo(6L);
    assertThat(decision.getValue().text()).isEqualTo("[Document: menu.pdf]");
    assertThat(decision.getValue().mediaRef()).startsWith(uploadDir.toString()).endsWith(".pdf");
    assertThat(states.get("4242")).isEmpty();
  }

  @Test
  void photoWhileEditing_usesLargestSize() throws Exception {
    awaitingEdit(7L);
    when(bot.getFilePath("big")).thenReturn("photos/file_9.jpg");
    when(bot.downloadFile(eq("photos/file_9.jpg"), any())).thenReturn(true);

    String result =
        dispatcher.dispatch(
            JSON.readTree(
                "{\"update_id\":4,\"message\":{\"message_id\":11,\"chat\":{\"id\":4242},"
                    + "\"photo\":[{\"file_id\":\"small\"},{\"file_id\":\"big\"}]}}"));

    ArgumentCaptor<Decision> decision = ArgumentCaptor.forClass(Decision.class);
    verify(coordinator).decide(decision.capture());
    assertThat(result).isEqualTo("media");
    assertThat(decision.getValue().text()).isEqualTo("[Photo]");
    assertThat(decision.getValue().mediaRef()).endsWith(".jpg");
    verify(bot, never()).getFilePath("small");
  }

  @Test
  void mediaWithoutPendingEdit_isNotADecision() throws Exception {
    assertThat(dispatcher.dispatch(document("4242", "doc-1", "menu.pdf")))
        .isEqualTo("ignored:no_pending_edit");
    verify(coordinator, never()).decide(any());
    verify(bot, never()).getFilePath(anyString());
  }

  @Test
  void unsafeFileName_keepsNoExtension() throws Exception {
    awaitingEdit(6L);
    when(bot.getFilePath("doc-2")).thenReturn("documents/file_4");
    when(bot.downloadFile(eq("documents/file_4"), any())).thenReturn(true);

    dispatcher.dispatch(document("4242", "doc-2", "evil.p/../x"));

    ArgumentCaptor<Decision> decision = ArgumentCaptor.forClass(Decision.class);
    verify(coordinator).decide(decision.capture());
    Path stored = Path.of(decision.getValue().mediaRef());
    assertThat(stored.getParent()).isEqualTo(uploadDir);
    assertThat(stored.getFileName().toString()).doesNotContain(".");
  }

  @Test
  void replyLaterButton_putsCardOff() throws Exception {
    doReturn(new DecisionOutcome(DecisionOutcome.Status.APPLIED, 5L, ApprovalState.PENDING, null))
        .when(coordinator)
        .decide(any());

    assertThat(dispatcher.dispatch(callback("4242", 77, "lt:5"))).isEqualTo("callback");

    ArgumentCaptor<Decision> decision = ArgumentCaptor.forClass(Decision.class);
    verify(coordinator).decide(decision.capture());
    assertThat(decision.getValue().kind()).isEqualTo(DecisionKind.REPLY_LATER);
    assertThat(decision.getValue().cardId()).isEqualTo("4242:77");
    verify(bot).answerCallbackQuery("cb-1", "Reminder set");
  }

  @Test
  void foreignChat_isIgnored() throws Exception {
    assertThat(dispatcher.dispatch(callback("999", 1, "ap:5")))
        .isEqualTo("ignored:foreign_chat");
    assertThat(dispatcher.dispatch(text("999", "/pending"))).isEqualTo("ignored:foreign_chat");

    verify(coordinator, never()).decide(any());
    verify(commands, never()).handle(anyString(), anyString());
  }

  @Test
  void malformedCallback_isDroppedWithAnswer() throws Exception {
    assertThat(dispatcher.dispatch(callback("4242", 1, "ap:oops")))
        .isEqualTo("ignored:malformed_callback");

    verify(coordinator, never()).decide(any());
    verify(bot).answerCallbackQuery("cb-1", "Unknown action");
  }

  @Test
  void slashCommand_goesToHandler() throws Exception {
    when(commands.handle("4242", "/pending")).thenReturn("No open approvals.");

    assertThat(dispatcher.dispatch(text("4242", "/pending"))).isEqualTo("command");

    verify(bot).sendMessage(eq("4242"), eq("No open approvals."), isNull());
  }

  @Test
  void plainTextWithoutPendingEdit_isNotADecision() throws Exception {
    assertThat(dispatcher.dispatch(text("4242", "hello"))).isEqualTo("ignored:no_pending_edit");
    verify(coordinator, never()).decide(any());
  }

  private void awaitingEdit(Long recordId) throws Exception {
    ApprovalRecordEntity record = mock(ApprovalRecordEntity.class);
    when(record.getState()).thenReturn(ApprovalState.PENDING);
    when(coordinator.find(recordId)).thenReturn(Optional.of(record));
    dispatcher.dispatch(callback("4242", 70, "ed:" + recordId));
  }

  private static JsonNode callback(String chatId, long messageId, String data) throws Exception {
    return JSON.readTree(
        "{\"update_id\":1,\"callback_query\":{\"id\":\"cb-1\",\"data\":\""
            + data
            + "\",\"message\":{\"message_id\":"
            + messageId
            + ",\"chat\":{\"id\":"
            + chatId
            + "}}}}");
  }

  private static JsonNode text(String chatId, String text) throws Exception {
    return JSON.readTree(
        "{\"update_id\":2,\"message\":{\"message_id\":9,\"chat\":{\"id\":"
            + chatId
            + "},\"text\":\""
            + text
            + "\"}}");
  }

  private static JsonNode voice(String chatId, String fileId) throws Exception {
    return JSON.readTree(
        "{\"update_id\":3,\"message\":{\"message_id\":10,\"chat\":{\"id\":"
            + chatId
            + "},\"voice\":{\"file_id\":\""
            + fileId
            + "\",\"duration\":3}}}");
  }

  private static JsonNode document(String chatId, String fileId, String name) throws Exception {
    return JSON.readTree(
        "{\"update_id\":5,\"message\":{\"message_id\":12,\"chat\":{\"id\":"
            + chatId
            + "},\"document\":{\"file_id\":\""
            + fileId
            + "\",\"file_name\":\""
            + name
            + "\"}}}");
  }
}
