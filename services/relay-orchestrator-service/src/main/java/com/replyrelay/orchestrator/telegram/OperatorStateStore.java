package com.replyrelay.orchestrator.telegram;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** In-memory per-chat input mode with TTL. Lost on restart; the card stays actionable. */
@Service
public class OperatorStateStore {

  private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
  private final Duration ttl;

  public OperatorStateStore(@Value("${telegram.operator.state-ttl:PT15M}") Duration ttl) {
    this.ttl = ttl;
  }

  public Optional<Pending> get(String chatId) {
    Entry e = map.get(chatId);
    if (e == null) {
      return Optional.empty();
    }
    if (e.expiresAt.isBefore(Instant.now())) {
      map.remove(chatId);
      return Optional.empty();
    }
    return Optional.of(new Pending(e.state, e.recordId));
  }

  public void set(String chatId, OperatorState state, Long recordId) {
    if (state == null || state == OperatorState.NONE) {
      map.remove(chatId);
      return;
    }
    map.put(chatId, new Entry(state, recordId, Instant.now().plus(ttl)));
  }

  public void clear(String chatId) {
    map.remove(chatId);
  }

  public record Pending(OperatorState state, Long recordId) {}

  private record Entry(OperatorState state, Long recordId, Instant expiresAt) {}
}
