// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.KeyValueStore;
import com.github.rendezvous.store.LockToken;
import com.github.rendezvous.store.StoreException;

import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.rendezvous.PayloadCodec.encodeInt;
import static com.github.rendezvous.PayloadCodec.text;

/// Hands out ranks `0..k-1` in the order processes join. The `size` counter is read and bumped while holding the
/// namespace lock so concurrent joins never get the same rank.
public class MembershipRegistrar {
  private static final Logger LOGGER = Logger.getLogger(MembershipRegistrar.class.getName());

  static final String ACTIVE = "active";

  private final KeyValueStore store;
  private final KeyNamespace keys;

  public MembershipRegistrar(KeyValueStore store, KeyNamespace keys) {
    this.store = store;
    this.keys = keys;
  }

  /// @return our rank.
  /// @throws RegistrationException if the lock cannot be acquired or the store fails.
  public int register() {
    final LockToken token;
    try {
      token = store.acquireLock(keys.lock());
    } catch (StoreException e) {
      throw new RegistrationException("Failed to acquire lock " + keys.lock(), e);
    }
    try {
      final int rank = store.get(keys.size()).map(PayloadCodec::decodeInt).orElse(0);
      store.put(keys.size(), encodeInt(rank + 1));
      store.put(keys.rank(rank), text(ACTIVE));
      LOGGER.fine(() -> "registered rank " + rank + " under " + keys.prefix());
      return rank;
    } catch (StoreException | NumberFormatException e) {
      throw new RegistrationException("Failed to register under " + keys.prefix(), e);
    } finally {
      try {
        if (!store.releaseLock(token)) {
          LOGGER.warning(() -> "Lock " + keys.lock() + " had expired before release");
        }
      } catch (StoreException e) {
        LOGGER.log(Level.WARNING, "Failed to release lock " + keys.lock(), e);
      }
    }
  }

  /// Removes our own registration record. The owner also removes the size counter, every barrier and then the whole
  /// namespace. This is best effort and assumes everyone else has finished.
  public void deregister(int rank, boolean owner) {
    try {
      store.delete(keys.rank(rank));
      if (owner) {
        store.delete(keys.size());
        store.deleteRecursive(keys.barriers());
        final int removed = store.deleteRecursive(keys.prefix());
        LOGGER.fine(() -> "rank " + rank + " purged " + keys.prefix() + " removing " + removed + " keys");
      }
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Rank " + rank + " failed to deregister", e);
    }
  }

  /// @return how many processes have registered so far.
  int registeredCount() {
    return store.get(keys.size()).map(PayloadCodec::decodeInt).orElse(0);
  }
}
