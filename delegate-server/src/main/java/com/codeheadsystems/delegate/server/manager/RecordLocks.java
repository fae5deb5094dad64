package com.codeheadsystems.delegate.server.manager;

import com.codeheadsystems.delegate.server.model.SessionKeyId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per session key record. Different records never contend.
 * <p>
 * Locks are created on first use and kept for the life of the process; records are never
 * deleted, so the map is bounded by the number of records ever granted.
 */
class RecordLocks {

  private final ConcurrentHashMap<SessionKeyId, ReentrantLock> locks = new ConcurrentHashMap<>();

  <T> T withLock(SessionKeyId id, Supplier<T> action) {
    ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs the action holding the locks of every given record. Locks are taken in sorted order,
   * so two callers locking overlapping sets cannot deadlock.
   */
  <T> T withLocks(Collection<SessionKeyId> ids, Supplier<T> action) {
    List<ReentrantLock> held = new ArrayList<>();
    try {
      for (SessionKeyId id : new TreeSet<>(ids)) {
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        held.add(lock);
      }
      return action.get();
    } finally {
      for (int i = held.size() - 1; i >= 0; i--) {
        held.get(i).unlock();
      }
    }
  }

  int size() {
    return locks.size();
  }
}
