// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.jetbrains.annotations.NotNull;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static java.util.Optional.ofNullable;

/// The advisory lock table of the embedded store. Locks are leases: a holder that dies without releasing only blocks
/// others until the lease expires.
///
/// This class does no synchronisation of its own. [MVStoreKeyValueStore] calls it while holding its monitor.
public class LockTable {
  private final MVMap<String, LockEntry> locks;
  private final Clock clock;

  public LockTable(MVStore store, Clock clock) {
    this.locks = store.openMap("com.github.rendezvous.store#locks");
    this.clock = clock;
  }

  /// Try to acquire the lock. We can get the lock if:
  ///
  /// 1. The lock does not exist.
  /// 2. The lock exists but is expired.
  /// 3. The lock exists yet the stamp is the same which makes this a lease extension.
  ///
  /// @param lockId       The key being locked.
  /// @param holdDuration How long the lease lasts if it is never released.
  /// @param stamp        Unique identifier of this acquisition attempt.
  /// @return the new entry or empty if someone else holds a live lease.
  public Optional<LockEntry> tryAcquireLock(@NotNull String lockId, Duration holdDuration, long stamp) {
    final var otherLock = ofNullable(locks.get(lockId))
        .filter(existingLock -> !isExpired(existingLock) && existingLock.stamp() != stamp);
    if (otherLock.isPresent()) {
      return Optional.empty();
    }
    final var now = clock.instant();
    final var entry = new LockEntry(lockId, stamp, now.plus(holdDuration), now.toEpochMilli());
    locks.put(lockId, entry);
    return Optional.of(entry);
  }

  /// Releases the lock only if the stamp matches the current holder.
  ///
  /// @return true if the lock was released; false if there was no lock or it now belongs to another stamp.
  public boolean releaseLock(@NotNull String lockId, long stamp) {
    return ofNullable(locks.get(lockId))
        .filter(existingLock -> existingLock.stamp() == stamp)
        .map(existingLock -> {
          locks.remove(lockId);
          return true;
        })
        .orElse(false);
  }

  public Optional<LockEntry> getLock(String lockId) {
    return ofNullable(locks.get(lockId));
  }

  private boolean isExpired(LockEntry lock) {
    return lock.expiryTime().isBefore(clock.instant());
  }

  /// MVStore estimates the size of values it does not know by serializing them so the entry must be serializable.
  public record LockEntry(
      String lockId,
      long stamp,
      Instant expiryTime,
      long acquiredTimeMillis
  ) implements Serializable {
  }
}
