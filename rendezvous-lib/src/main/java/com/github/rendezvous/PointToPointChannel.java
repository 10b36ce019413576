// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.KeyValueStore;
import com.github.rendezvous.store.StoreException;

import java.util.Arrays;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.rendezvous.PayloadCodec.*;

/// Store-and-acknowledge delivery of one int or one byte buffer between two ranks.
///
/// The sender writes the payload and polls for the ack. The receiver polls for the payload, writes the ack, waits a
/// short grace so that the sender's poll sees it, then deletes the payload. The sender deletes the ack. Only one
/// message may be in flight per `(src, dst, kind)` at a time; that is up to the caller.
public class PointToPointChannel {
  private static final Logger LOGGER = Logger.getLogger(PointToPointChannel.class.getName());

  static final String OPERATION = "msg";
  static final String RECEIVED = "received";

  private final GroupContext context;
  private final KeyValueStore store;
  private final KeyNamespace keys;

  public PointToPointChannel(GroupContext context) {
    this.context = context;
    this.store = context.store();
    this.keys = context.keys();
  }

  public Outcome<Void> sendInt(int value, int destRank) {
    final var invalid = checkPeer(destRank);
    if (invalid.isPresent()) return Outcome.failure(invalid.get());
    final String messageKey = keys.message(OPERATION, context.rank(), destRank, PayloadKind.INT);
    try {
      store.put(messageKey, encodeInt(value));
      return awaitAck(messageKey, destRank, "int data");
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Error sending int data to rank " + destRank, e);
      return Outcome.failure("Error sending int data: " + e.getMessage());
    }
  }

  public Outcome<Integer> recvInt(int srcRank) {
    final var invalid = checkPeer(srcRank);
    if (invalid.isPresent()) return Outcome.failure(invalid.get());
    final String messageKey = keys.message(OPERATION, srcRank, context.rank(), PayloadKind.INT);
    try {
      final Outcome<byte[]> payload = context
          .poll("int data from rank " + srcRank, context.timing().messageAttempts(), context.timing().pollInterval())
          .await(() -> store.get(messageKey));
      if (!payload.isSuccess()) {
        LOGGER.warning(payload::reason);
        return Outcome.failure(payload.reason());
      }
      final int value;
      try {
        value = decodeInt(payload.value());
      } catch (NumberFormatException e) {
        LOGGER.warning(() -> "Error converting value from rank " + srcRank + " to integer: " + e.getMessage());
        return Outcome.failure("Malformed int data: " + e.getMessage());
      }
      acknowledge(messageKey);
      store.delete(messageKey);
      return Outcome.success(value);
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Error receiving int data from rank " + srcRank, e);
      return Outcome.failure("Error receiving int data: " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Outcome.failure("Interrupted receiving int data from rank " + srcRank);
    }
  }

  /// Sends the first `count` bytes of `buffer`. The bytes go to the `/data` key first and the `src:dst:length`
  /// metadata last, so a receiver that sees the metadata also sees the data.
  public Outcome<Void> sendBytes(byte[] buffer, int count, int destRank) {
    final var invalid = checkPeer(destRank);
    if (invalid.isPresent()) return Outcome.failure(invalid.get());
    if (count < 0 || count > buffer.length) {
      return Outcome.failure("count " + count + " outside buffer of length " + buffer.length);
    }
    final String messageKey = keys.message(OPERATION, context.rank(), destRank, PayloadKind.BYTES);
    try {
      store.put(KeyNamespace.data(messageKey), Arrays.copyOf(buffer, count));
      store.put(messageKey, encodeMetadata(context.rank(), destRank, count));
      return awaitAck(messageKey, destRank, "char data");
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Error sending char data to rank " + destRank, e);
      return Outcome.failure("Error sending char data: " + e.getMessage());
    }
  }

  /// Receives into the first `count` bytes of `buffer`. If the sender sent more than that the rest is silently
  /// dropped.
  ///
  /// @return how many bytes were copied.
  public Outcome<Integer> recvBytes(byte[] buffer, int count, int srcRank) {
    final var invalid = checkPeer(srcRank);
    if (invalid.isPresent()) return Outcome.failure(invalid.get());
    if (count < 0) {
      return Outcome.failure("count " + count + " must not be negative");
    }
    final int capacity = Math.min(count, buffer.length);
    final String messageKey = keys.message(OPERATION, srcRank, context.rank(), PayloadKind.BYTES);
    final String dataKey = KeyNamespace.data(messageKey);
    try {
      final Outcome<byte[]> payload = context
          .poll("char data from rank " + srcRank, context.timing().messageAttempts(), context.timing().pollInterval())
          .await(() -> store.get(messageKey).isPresent() ? store.get(dataKey) : Optional.empty());
      if (!payload.isSuccess()) {
        LOGGER.warning(payload::reason);
        return Outcome.failure(payload.reason());
      }
      final byte[] data = payload.value();
      final int copied = Math.min(data.length, capacity);
      System.arraycopy(data, 0, buffer, 0, copied);
      if (data.length > capacity) {
        LOGGER.fine(() -> "rank " + context.rank() + " truncated " + data.length + " bytes from rank " + srcRank
            + " to " + capacity);
      }
      acknowledge(messageKey);
      store.delete(dataKey);
      store.delete(messageKey);
      return Outcome.success(copied);
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Error receiving char data from rank " + srcRank, e);
      return Outcome.failure("Error receiving char data: " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Outcome.failure("Interrupted receiving char data from rank " + srcRank);
    }
  }

  private Outcome<Void> awaitAck(String messageKey, int destRank, String what) {
    final String ackKey = KeyNamespace.ack(messageKey);
    final Outcome<byte[]> ack = context
        .poll(what + " acknowledgment from rank " + destRank, context.timing().messageAttempts(),
            context.timing().pollInterval())
        .await(() -> store.get(ackKey).filter(v -> RECEIVED.equals(text(v))));
    if (!ack.isSuccess()) {
      // the payload stays for a later attempt or manual cleanup
      LOGGER.warning(ack::reason);
      return Outcome.failure(ack.reason());
    }
    store.delete(ackKey);
    return Outcome.ok();
  }

  /// Writes the ack then gives the sender's poll time to see it before the payload disappears.
  private void acknowledge(String messageKey) throws InterruptedException {
    store.put(KeyNamespace.ack(messageKey), text(RECEIVED));
    context.pause(context.timing().ackGrace());
  }

  private Optional<String> checkPeer(int peer) {
    if (peer < 0 || peer >= context.size()) {
      return Optional.of("Rank " + peer + " is outside group of size " + context.size());
    }
    return Optional.empty();
  }
}
