// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store;

import org.h2.mvstore.Cursor;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// A single node store engine on top of an embedded H2 [MVStore]. It can be in-memory (tests, a store server
/// that does not need to survive restarts) or file-backed.
///
/// Several participants in one JVM may share an instance. Every mutation runs under the instance monitor so that
/// [#compareAndPut] and [#deleteRecursive] are atomic with respect to plain writes.
public class MVStoreKeyValueStore implements KeyValueStore {
  private static final Logger LOGGER = Logger.getLogger(MVStoreKeyValueStore.class.getName());

  public static final Duration DEFAULT_LOCK_HOLD = Duration.ofSeconds(60);
  public static final Duration DEFAULT_LOCK_WAIT = Duration.ofSeconds(30);
  static final Duration LOCK_RETRY_INTERVAL = Duration.ofMillis(10);

  private final MVStore store;
  private final MVMap<String, byte[]> data;
  private final LockTable lockTable;
  private final Duration lockHold;
  private final Duration lockWait;
  private final Clock clock;
  private final AtomicLong stampGen;

  public MVStoreKeyValueStore(MVStore store, Duration lockHold, Duration lockWait, Clock clock) {
    this.store = store;
    this.data = store.openMap("com.github.rendezvous.store#data");
    this.lockTable = new LockTable(store, clock);
    this.lockHold = lockHold;
    this.lockWait = lockWait;
    this.clock = clock;
    this.stampGen = new AtomicLong(clock.millis());
  }

  /// An in-memory store with the default lock lease and wait.
  public static MVStoreKeyValueStore inMemory() {
    return new MVStoreKeyValueStore(MVStore.open(null), DEFAULT_LOCK_HOLD, DEFAULT_LOCK_WAIT, Clock.systemUTC());
  }

  /// A store that is persisted to the given file.
  public static MVStoreKeyValueStore open(Path file) {
    final var mvStore = new MVStore.Builder()
        .fileName(file.toString())
        .open();
    LOGGER.info(() -> "Opened store file " + file);
    return new MVStoreKeyValueStore(mvStore, DEFAULT_LOCK_HOLD, DEFAULT_LOCK_WAIT, Clock.systemUTC());
  }

  @Override
  public synchronized void put(@NotNull String key, byte[] value) {
    data.put(key, value.clone());
  }

  @Override
  public Optional<byte[]> get(@NotNull String key) {
    return Optional.ofNullable(data.get(key)).map(byte[]::clone);
  }

  @Override
  public synchronized void delete(@NotNull String key) {
    data.remove(key);
  }

  @Override
  public List<String> listPrefix(@NotNull String prefix) {
    final var keys = new ArrayList<String>();
    // keys are sorted so everything with the prefix is contiguous from the prefix onwards
    final Cursor<String, byte[]> cursor = data.cursor(prefix);
    while (cursor.hasNext()) {
      final var key = cursor.next();
      if (!key.startsWith(prefix)) break;
      keys.add(key);
    }
    return keys;
  }

  @Override
  public synchronized int deleteRecursive(@NotNull String prefix) {
    final var keys = listPrefix(prefix);
    keys.forEach(data::remove);
    LOGGER.finer(() -> "deleteRecursive prefix=" + prefix + " removed=" + keys.size());
    return keys.size();
  }

  @Override
  public synchronized boolean compareAndPut(@NotNull String key, @NotNull Optional<byte[]> expected, byte[] value) {
    final var current = Optional.ofNullable(data.get(key));
    final boolean matches = expected.isPresent()
        ? current.isPresent() && Arrays.equals(current.get(), expected.get())
        : current.isEmpty();
    if (matches) {
      data.put(key, value.clone());
    }
    return matches;
  }

  @Override
  public LockToken acquireLock(@NotNull String key) {
    final long stamp = stampGen.incrementAndGet();
    final Instant deadline = clock.instant().plus(lockWait);
    while (true) {
      final Optional<LockTable.LockEntry> entry;
      synchronized (this) {
        entry = lockTable.tryAcquireLock(key, lockHold, stamp);
      }
      if (entry.isPresent()) {
        LOGGER.fine(() -> "acquired lock " + key + " stamp=" + stamp);
        return new LockToken(key, stamp, entry.get().expiryTime());
      }
      if (clock.instant().isAfter(deadline)) {
        throw new StoreException("Timed out after " + lockWait + " waiting for lock " + key);
      }
      try {
        //noinspection BusyWait
        Thread.sleep(LOCK_RETRY_INTERVAL.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new StoreException("Interrupted waiting for lock " + key, e);
      }
    }
  }

  @Override
  public synchronized boolean releaseLock(@NotNull LockToken token) {
    final boolean released = lockTable.releaseLock(token.key(), token.stamp());
    LOGGER.fine(() -> "release lock " + token.key() + " stamp=" + token.stamp() + " released=" + released);
    return released;
  }

  /// Used by tests to check the state of the lock table.
  Optional<LockTable.LockEntry> lockEntry(String key) {
    return lockTable.getLock(key);
  }

  @Override
  public synchronized void close() {
    if (!store.isClosed()) {
      // this will commit any pending changes
      store.close();
    }
  }
}
