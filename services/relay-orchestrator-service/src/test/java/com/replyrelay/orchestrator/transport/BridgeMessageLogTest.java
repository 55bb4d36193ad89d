package com.replyrelay.orchestrator.transport;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BridgeMessageLogTest {

  @TempDir Path dir;

  private BridgeMessageLog log;

  @BeforeEach
  void setUp() throws Exception {
    Path db = dir.resolve("messages.db");
    try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + db);
        Statement s = c.createStatement()) {
      s.execute(
          "CREATE TABLE chats (jid TEXT PRIMARY KEY, name TEXT, last_message_time TIMESTAMP)");
      s.execute(
          "CREATE TABLE messages (id TEXT, chat_jid TEXT, sender TEXT, content TEXT,"
              + " timestamp TIMESTAMP, is_from_me BOOLEAN, media_type TEXT,"
              + " PRIMARY KEY (id, chat_jid))");
      s.execute("INSERT INTO chats VALUES ('111@s.whatsapp.net', 'Alice', NULL)");
      s.execute(
          "INSERT INTO messages VALUES"
              + " ('old', '111@s.whatsapp.net', '111', 'e', '2026-03-01 09:59:59+00:00', 0, ''),"
              + " ('m1', '111@s.whatsapp.net', '111', 'hello', '2026-03-01 10:00:05+00:00', 0, ''),"
              + " ('mine', '111@s.whatsapp.net', 'me', 'own', '2026-03-01 10:00:06+00:00', 1, ''),"
              + " ('v1', '222@s.whatsapp.net', '222', '', '2026-03-01 10:00:07+00:00', 0, 'audio'),"
              + " ('empty', '222@s.whatsapp.net', '222', '', '2026-03-01 10:00:08+00:00', 0, '')");
    }
    log = new BridgeMessageLog(db.toString(), ZoneId.of("UTC"));
  }

  @Test
  void readsInboundOnlyFromCursorOn() {
    List<InboundMessage> read = log.readSince(Instant.parse("2026-03-01T10:00:00Z"), 100);

    assertThat(read).extracting(InboundMessage::messageId).containsExactly("m1", "v1");
    InboundMessage first = read.get(0);
    assertThat(first.conversationId()).isEqualTo("111@s.whatsapp.net");
    assertThat(first.senderDisplayName()).isEqualTo("Alice");
    assertThat(first.receivedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:05Z"));
    assertThat(read.get(1).senderDisplayName()).isEqualTo("222");
    assertThat(read.get(1).isAudio()).isTrue();
  }

  @Test
  void respectsLimit() {
    assertThat(log.readSince(Instant.parse("2026-03-01T09:00:00Z"), 1))
        .extracting(InboundMessage::messageId)
        .containsExactly("old");
  }

  @Test
  void parsesBridgeTimestampShapes() {
    BridgeMessageLog local =
        new BridgeMessageLog(dir.resolve("x.db").toString(), ZoneId.of("+02:00"));

    assertThat(local.parseTimestamp("2026-03-01 12:00:00"))
        .isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
    assertThat(local.parseTimestamp("2026-03-01T10:00:00.250+00:00"))
        .isEqualTo(Instant.parse("2026-03-01T10:00:00.250Z"));
    assertThat(local.parseTimestamp(1_772_359_200L))
        .isEqualTo(Instant.ofEpochSecond(1_772_359_200L));
    assertThat(local.parseTimestamp("garbage")).isEqualTo(Instant.EPOCH);
  }
}
