package com.replyrelay.orchestrator.transport;

import com.replyrelay.orchestrator.common.RelayErrorKind;
import com.replyrelay.orchestrator.common.RelayException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * Read-only view of the message store the WhatsApp bridge writes (SQLite tables {@code messages}
 * and {@code chats}).
 */
@Slf4j
public class BridgeMessageLog {

  private static final String INBOUND_SQL =
      "SELECT m.id, m.chat_jid, m.sender, m.content, m.timestamp, c.name, m.media_type"
          + " FROM messages m LEFT JOIN chats c ON m.chat_jid = c.jid"
          + " WHERE m.timestamp >= ? AND m.is_from_me = 0"
          + " AND (m.content != '' OR m.media_type != '')"
          + " ORDER BY m.timestamp ASC, m.id ASC LIMIT ?";

  private static final DateTimeFormatter QUERY_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

  private static final DateTimeFormatter STORED_FORMAT =
      new DateTimeFormatterBuilder()
          .appendPattern("yyyy-MM-dd[ ]['T']HH:mm:ss")
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .optionalStart()
          .appendOffset("+HH:MM", "Z")
          .optionalEnd()
          .toFormatter(Locale.ROOT);

  private final JdbcTemplate jdbc;
  private final ZoneId zone;

  public BridgeMessageLog(String databasePath, ZoneId zone) {
    SQLiteConfig config = new SQLiteConfig();
    config.setReadOnly(true);
    SQLiteDataSource dataSource = new SQLiteDataSource(config);
    dataSource.setUrl("jdbc:sqlite:" + databasePath);
    this.jdbc = new JdbcTemplate(dataSource);
    this.zone = zone;
  }

  public List<InboundMessage> readSince(Instant since, int limit) {
    String from = QUERY_FORMAT.format(since.atZone(zone));
    try {
      return jdbc.query(INBOUND_SQL, (rs, rowNum) -> map(rs), from, limit);
    } catch (DataAccessException e) {
      throw new RelayException(
          RelayErrorKind.TRANSIENT_IO, "Failed to read bridge message log: " + e.getMessage(), e);
    }
  }

  private InboundMessage map(ResultSet rs) throws SQLException {
    String chatJid = rs.getString("chat_jid");
    String chatName = rs.getString("name");
    String sender = rs.getString("sender");
    return new InboundMessage(
        chatJid,
        rs.getString("id"),
        chatName != null && !chatName.isBlank() ? chatName : sender,
        rs.getString("content"),
        parseTimestamp(rs.getObject("timestamp")),
        rs.getString("media_type"));
  }

  Instant parseTimestamp(Object raw) {
    if (raw instanceof Number n) {
      return Instant.ofEpochSecond(n.longValue());
    }
    if (raw == null) {
      return Instant.EPOCH;
    }
    try {
      TemporalAccessor parsed = STORED_FORMAT.parse(raw.toString().trim());
      if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
        return OffsetDateTime.from(parsed).toInstant();
      }
      return LocalDateTime.from(parsed).atZone(zone).toInstant();
    } catch (DateTimeParseException e) {
      log.warn("Unparseable bridge timestamp '{}', treating as epoch", raw);
      return Instant.EPOCH;
    }
  }
}
