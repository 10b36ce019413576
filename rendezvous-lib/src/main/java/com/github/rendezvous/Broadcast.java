// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.KeyValueStore;
import com.github.rendezvous.store.StoreException;

import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.rendezvous.PayloadCodec.*;

/// One-to-many delivery of an int buffer from a root rank. The root writes the slot, a `_write` barrier makes sure it
/// is there before anyone reads, and a `_read` barrier makes sure nobody is still reading when the root deletes it. The
/// root deletes the slot however the broadcast ends.
public class Broadcast {
  private static final Logger LOGGER = Logger.getLogger(Broadcast.class.getName());

  private final GroupContext context;
  private final KeyValueStore store;
  private final KeyNamespace keys;
  private final Barrier barrier;

  public Broadcast(GroupContext context, Barrier barrier) {
    this.context = context;
    this.store = context.store();
    this.keys = context.keys();
    this.barrier = barrier;
  }

  /// On the root `buffer` is the input; everywhere else the first `count` ints of `buffer` are overwritten.
  public Outcome<Void> broadcastInt(int[] buffer, int count, int rootRank) {
    if (rootRank < 0 || rootRank >= context.size()) {
      return Outcome.failure("Root rank " + rootRank + " is outside group of size " + context.size());
    }
    if (count < 0 || count > buffer.length) {
      return Outcome.failure("count " + count + " outside buffer of length " + buffer.length);
    }
    final boolean root = context.rank() == rootRank;
    final String slot = keys.broadcastSlot(rootRank);
    final String barrierId = "bcast_int_" + rootRank;
    final int expectedBytes = count * INT_BYTES;
    try {
      if (root) {
        store.put(slot, encodeInts(buffer, count));
      }

      final Outcome<Void> written = barrier.enter(barrierId + "_write");
      if (!written.isSuccess()) {
        return written;
      }

      if (!root) {
        final Outcome<byte[]> read = context
            .poll("broadcast data from rank " + rootRank, context.timing().broadcastAttempts(),
                context.timing().fastPollInterval())
            .await(() -> store.get(slot).filter(value -> {
              if (value.length < expectedBytes) {
                LOGGER.fine(() -> "Received data size (" + value.length + ") is smaller than expected ("
                    + expectedBytes + ")");
                return false;
              }
              return true;
            }));
        if (!read.isSuccess()) {
          LOGGER.warning(() -> "Failed to read broadcast data from rank " + rootRank + ": " + read.reason());
          return Outcome.failure(read.reason());
        }
        decodeInts(read.value(), buffer, count);
      }

      return barrier.enter(barrierId + "_read");
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Error in broadcast operation from rank " + rootRank, e);
      return Outcome.failure("Error in broadcast operation: " + e.getMessage());
    } finally {
      if (root) {
        deleteSlot(slot);
      }
    }
  }

  private void deleteSlot(String slot) {
    try {
      store.delete(slot);
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Failed to delete broadcast slot " + slot, e);
    }
  }
}
