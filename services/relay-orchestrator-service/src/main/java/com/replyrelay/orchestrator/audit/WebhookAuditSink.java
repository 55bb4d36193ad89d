package com.replyrelay.orchestrator.audit;

import com.replyrelay.orchestrator.config.AuditProperties;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Posts each row as JSON, e.g. to a spreadsheet web-app endpoint. */
@Component
@Slf4j
@ConditionalOnProperty(name = "relay.audit.mode", havingValue = "webhook")
public class WebhookAuditSink implements AuditSink {

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

  private final RestClient rest;
  private final String url;

  public WebhookAuditSink(RestClient auditRestClient, AuditProperties properties) {
    this.rest = auditRestClient;
    this.url = properties.webhookUrl() == null ? "" : properties.webhookUrl().trim();
    if (url.isBlank()) {
      log.warn("relay.audit.mode=webhook but relay.audit.webhook-url is empty; rows are dropped");
    }
  }

  @Override
  public void append(AuditRow row) {
    if (url.isBlank()) {
      return;
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", TIMESTAMP.format(row.timestamp()));
    body.put("conversation_id", row.conversationId());
    body.put("sender_name", row.senderName());
    body.put("incoming_text", row.incomingText());
    body.put("draft_text", row.draftText());
    body.put("status", row.status().label());
    body.put("final_text", row.finalText());
    rest.post().uri(url).body(body).retrieve().toBodilessEntity();
  }
}
