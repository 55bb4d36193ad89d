package com.replyrelay.orchestrator.telegram;

import com.replyrelay.orchestrator.common.web.ConflictException;
import com.replyrelay.orchestrator.common.web.NotFoundException;
import com.replyrelay.orchestrator.domain.ApprovalRecordEntity;
import com.replyrelay.orchestrator.domain.BlacklistEntryEntity;
import com.replyrelay.orchestrator.operator.OperatorService;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Slash commands in the operator chat. Replies are plain text. */
@Component
@RequiredArgsConstructor
@Slf4j
public class OperatorCommandHandler {

  static final String HELP =
      "/pending - open approvals\n"
          + "/blacklist - blocked conversations\n"
          + "/block <conversation> [reason]\n"
          + "/unblock <conversation>\n"
          + "/tier <conversation> <free|basic|premium>\n"
          + "/retry <approval id> - resend a failed delivery\n"
          + "/cancel - stop editing or recording";

  private static final int LIST_LIMIT = 20;

  private final OperatorService operator;
  private final OperatorStateStore states;

  public String handle(String chatId, String text) {
    String[] parts = text.trim().split("\\s+", 3);
    String command = parts[0].toLowerCase(Locale.ROOT);
    int at = command.indexOf('@');
    if (at > 0) {
      command = command.substring(0, at);
    }
    try {
      return switch (command) {
        case "/start", "/help" -> HELP;
        case "/pending" -> pending();
        case "/blacklist" -> blacklist();
        case "/block" -> block(parts);
        case "/unblock" -> unblock(parts);
        case "/tier" -> tier(parts);
        case "/retry" -> retry(parts);
        case "/cancel" -> {
          states.clear(chatId);
          yield "Cancelled.";
        }
        default -> "Unknown command. " + HELP;
      };
    } catch (NotFoundException | ConflictException | IllegalArgumentException e) {
      return e.getMessage();
    } catch (RuntimeException e) {
      log.error("Operator command {} failed", command, e);
      return "Command failed: " + command;
    }
  }

  private String pending() {
    List<ApprovalRecordEntity> open = operator.openApprovals();
    if (open.isEmpty()) {
      return "No open approvals.";
    }
    StringBuilder sb = new StringBuilder("Open approvals (" + open.size() + "):");
    open.stream()
        .limit(LIST_LIMIT)
        .forEach(
            r ->
                sb.append("\n#")
                    .append(r.getId())
                    .append(' ')
                    .append(r.getState())
                    .append(' ')
                    .append(r.getSenderName() == null ? r.getConversationId() : r.getSenderName()));
    return sb.toString();
  }

  private String blacklist() {
    List<BlacklistEntryEntity> entries = operator.blacklist();
    if (entries.isEmpty()) {
      return "Blacklist is empty.";
    }
    StringBuilder sb = new StringBuilder("Blacklisted:");
    entries.stream()
        .limit(LIST_LIMIT)
        .forEach(
            e -> {
              sb.append("\n").append(e.getConversationId());
              if (e.getReason() != null) {
                sb.append(" (").append(e.getReason()).append(")");
              }
            });
    return sb.toString();
  }

  private String block(String[] parts) {
    String conversationId = arg(parts, 1, "/block <conversation> [reason]");
    String reason = parts.length > 2 ? parts[2] : null;
    return operator.block(conversationId, reason)
        ? "Blocked " + conversationId
        : conversationId + " is already blocked";
  }

  private String unblock(String[] parts) {
    String conversationId = arg(parts, 1, "/unblock <conversation>");
    return operator.unblock(conversationId)
        ? "Unblocked " + conversationId
        : conversationId + " was not blocked";
  }

  private String tier(String[] parts) {
    String usage = "/tier <conversation> <free|basic|premium>";
    String conversationId = arg(parts, 1, usage);
    String tag = arg(parts, 2, usage);
    return conversationId + " is now " + operator.setTag(conversationId, tag).label();
  }

  private String retry(String[] parts) {
    String raw = arg(parts, 1, "/retry <approval id>");
    long id;
    try {
      id = Long.parseLong(raw.startsWith("#") ? raw.substring(1) : raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Usage: /retry <approval id>");
    }
    operator.retry(id);
    return "Retrying delivery of #" + id;
  }

  private static String arg(String[] parts, int index, String usage) {
    if (parts.length <= index || parts[index].isBlank()) {
      throw new IllegalArgumentException("Usage: " + usage);
    }
    return parts[index].trim();
  }
}
