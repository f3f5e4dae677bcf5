package com.gentoro.injob.daemon;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Last-asserted timestamps of named conditions. Guarded by its own read/write lock, independent of
 * the daemon's job list, so external signals never wait on scheduling.
 */
public final class ConditionRegistry {
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Long> conditions = new HashMap<>();

  public void set(String name, long atMillis) {
    requireName(name);
    lock.writeLock().lock();
    try {
      conditions.put(name, atMillis);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** @return {@code true} if the condition was present */
  public boolean remove(String name) {
    requireName(name);
    lock.writeLock().lock();
    try {
      return conditions.remove(name) != null;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<Long> get(String name) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(conditions.get(name));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Sorted copy of all conditions. */
  public Map<String, Long> snapshot() {
    lock.readLock().lock();
    try {
      return new TreeMap<>(conditions);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Runs {@code check} against a consistent view of the registry. Used by the gate so that all of
   * a job's conditions are read under one read lock.
   */
  <T> T read(Function<Map<String, Long>, T> check) {
    lock.readLock().lock();
    try {
      return check.apply(Collections.unmodifiableMap(conditions));
    } finally {
      lock.readLock().unlock();
    }
  }

  private static void requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Condition name must not be blank");
    }
  }
}
