package com.replyrelay.orchestrator.draft;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.replyrelay.orchestrator.domain.DraftSessionEntity;
import com.replyrelay.orchestrator.repository.DraftSessionRepository;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * conversation id → stateful session handle, with create-if-absent semantics.
 *
 * <p>The cache computes at most once per key at a time, and the table keeps handles across
 * restarts, so a conversation never gets a second session.
 */
@Component
@Slf4j
public class DraftSessionRegistry {

  private final DraftSessionRepository repository;
  private final AiBackend backend;
  private final Cache<String, String> cache;

  public DraftSessionRegistry(DraftSessionRepository repository, AiBackend backend) {
    this.repository = repository;
    this.backend = backend;
    this.cache =
        Caffeine.newBuilder().expireAfterAccess(Duration.ofHours(12)).maximumSize(10_000).build();
  }

  public String handleFor(String conversationId) {
    return cache.get(conversationId, this::loadOrCreate);
  }

  private String loadOrCreate(String conversationId) {
    return repository
        .findById(conversationId)
        .map(DraftSessionEntity::getSessionHandle)
        .orElseGet(
            () -> {
              String handle = backend.createSession();
              repository.save(new DraftSessionEntity(conversationId, handle, Instant.now()));
              log.info("Created draft session {} for conversation {}", handle, conversationId);
              return handle;
            });
  }
}
