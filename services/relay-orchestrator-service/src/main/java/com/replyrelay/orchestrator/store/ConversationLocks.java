package com.replyrelay.orchestrator.store;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One exclusive lock per conversation id.
 *
 * <p>The registry itself is only synchronized while a new conversation id is inserted; lookups of
 * an existing lock and the critical sections themselves never touch the coarse monitor. Work for
 * different conversations runs in parallel.
 */
@Component
public class ConversationLocks {

  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(String conversationId, Supplier<T> action) {
    ReentrantLock lock = lockFor(conversationId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void run(String conversationId, Runnable action) {
    withLock(
        conversationId,
        () -> {
          action.run();
          return null;
        });
  }

  int size() {
    return locks.size();
  }

  private ReentrantLock lockFor(String conversationId) {
    if (conversationId == null || conversationId.isBlank()) {
      throw new IllegalArgumentException("conversationId is required");
    }
    ReentrantLock lock = locks.get(conversationId);
    if (lock != null) {
      return lock;
    }
    synchronized (this) {
      lock = locks.get(conversationId);
      if (lock == null) {
        lock = new ReentrantLock();
        locks.put(conversationId, lock);
      }
      return lock;
    }
  }
}
