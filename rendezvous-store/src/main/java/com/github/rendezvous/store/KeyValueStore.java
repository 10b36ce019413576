// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store;

import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/// The capability surface the coordination runtime needs from a shared key-value store. This is the only boundary
/// between the protocol code and the store. The store is expected to give linearizable single key reads and writes.
///
/// Every method may be a remote round-trip. Implementations either complete within a bounded time or throw a
/// [StoreException]. Nothing is pipelined or batched.
public interface KeyValueStore extends Closeable {

  /// Upsert. The value is an opaque blob.
  void put(@NotNull String key, byte[] value);

  /// @return the value or empty when the key is absent. A value is never partial.
  Optional<byte[]> get(@NotNull String key);

  /// Removes one key. A no-op when the key is absent.
  void delete(@NotNull String key);

  /// @return every key that starts with the prefix in no particular order.
  List<String> listPrefix(@NotNull String prefix);

  /// Removes every key under the prefix.
  ///
  /// @return the number of keys removed.
  int deleteRecursive(@NotNull String prefix);

  /// Write `value` only if the current value equals `expected`. An empty `expected` means the key must be absent.
  /// This is the conditional write used for every shared counter so that concurrent increments cannot be lost.
  ///
  /// @return true if the write happened.
  boolean compareAndPut(@NotNull String key, @NotNull Optional<byte[]> expected, byte[] value);

  /// Blocks until the exclusive advisory lock on `key` is held or the implementation gives up.
  ///
  /// @return the token needed to release the lock.
  /// @throws StoreException if the lock could not be acquired.
  LockToken acquireLock(@NotNull String key);

  /// Releases a lock previously acquired with [#acquireLock(String)].
  ///
  /// @return false if the lock had already expired or was taken over by someone else.
  boolean releaseLock(@NotNull LockToken token);

  @Override
  void close();
}
