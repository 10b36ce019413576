// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.KeyValueStore;
import com.github.rendezvous.store.StoreException;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.rendezvous.PayloadCodec.*;

/// An N-party rendezvous: nobody leaves until everyone has arrived.
///
/// Each participant writes an arrival marker and bumps the shared counter with a compare-and-put loop. The participant
/// whose increment makes the count equal to the group size raises the ready flag. Everyone then waits for the count
/// and for the flag, removes its own marker, and rank 0 removes the barrier's keys after a grace delay that lets slow
/// readers see the flag.
///
/// ```
/// ARRIVING -> COUNTED -> READY_WAIT -> DONE
/// ```
/// A timeout in `COUNTED` or `READY_WAIT` is final; the caller decides whether to try the whole barrier again. A retry
/// goes to the same store keys as the failed call and does not count this participant twice.
public class Barrier {
  private static final Logger LOGGER = Logger.getLogger(Barrier.class.getName());

  static final String ARRIVED = "arrived";
  static final String READY = "true";
  static final int MAX_INCREMENT_ATTEMPTS = 1000;

  public enum Phase {
    ARRIVING,
    COUNTED,
    READY_WAIT,
    DONE
  }

  private final GroupContext context;
  private final KeyValueStore store;
  private final KeyNamespace keys;

  public Barrier(GroupContext context) {
    this.context = context;
    this.store = context.store();
    this.keys = context.keys();
  }

  /// @param barrierId must not contain `/` nor end in `.<digits>`, which is reserved for re-used ids.
  public Outcome<Void> enter(String barrierId) {
    final var invalid = KeyNamespace.checkBarrierId(barrierId);
    if (invalid.isPresent()) return Outcome.failure(invalid.get());
    final String instance = context.barrierInstance(barrierId);
    final int rank = context.rank();
    final int expected = context.size();
    final String countKey = keys.barrierCount(instance);
    final String readyKey = keys.barrierReady(instance);
    final String arrivalKey = keys.barrierArrival(instance, rank);
    var phase = Phase.ARRIVING;
    try {
      store.put(arrivalKey, text(ARRIVED));
      if (context.isArrivalCounted(instance)) {
        LOGGER.fine(() -> "rank " + rank + " retrying barrier " + instance + " without counting again");
      } else {
        final OptionalInt arrived = increment(countKey);
        if (arrived.isEmpty()) {
          return fail(barrierId, phase, "gave up incrementing",
              MAX_INCREMENT_ATTEMPTS + " lost updates of " + countKey);
        }
        context.arrivalCounted(instance);
        if (arrived.getAsInt() == expected) {
          store.put(readyKey, text(READY));
          LOGGER.fine(() -> "rank " + rank + " was last into barrier " + instance);
        }
      }

      phase = Phase.COUNTED;
      final BoundedPoll countPoll = context.poll("barrier " + barrierId + " completion",
          context.timing().barrierCountAttempts(), context.timing().pollInterval());
      final Outcome<Integer> counted = countPoll
          .await(() -> store.get(countKey).map(PayloadCodec::decodeInt).filter(count -> count >= expected));
      if (!counted.isSuccess()) {
        final int seen = store.get(countKey).map(PayloadCodec::decodeInt).orElse(0);
        return fail(barrierId, phase, waited(countPoll), "got " + seen + "/" + expected + " processes");
      }

      phase = Phase.READY_WAIT;
      final BoundedPoll readyPoll = context.poll("barrier " + barrierId + " ready signal",
          context.timing().barrierReadyAttempts(), context.timing().pollInterval());
      final Outcome<String> ready = readyPoll
          .await(() -> store.get(readyKey).map(PayloadCodec::text).filter(READY::equals));
      if (!ready.isSuccess()) {
        return fail(barrierId, phase, waited(readyPoll), ready.reason());
      }

      store.delete(arrivalKey);
      context.barrierPassed(barrierId, instance);
      if (context.isOwner()) {
        context.pause(context.timing().barrierGrace());
        store.deleteRecursive(keys.barrier(instance));
      }
      LOGGER.finer(() -> "rank " + rank + " " + Phase.DONE + " barrier " + instance);
      return Outcome.ok();
    } catch (StoreException | NumberFormatException e) {
      LOGGER.log(Level.WARNING, "Rank " + rank + " error in barrier " + barrierId + " during " + phase, e);
      return Outcome.failure("Error in barrier " + barrierId + ": " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Outcome.failure("Interrupted in barrier " + barrierId + " during " + phase);
    }
  }

  /// Adds one to the counter without losing concurrent increments.
  ///
  /// @return the value we wrote, or empty if we lost the race too many times.
  OptionalInt increment(String countKey) {
    for (int attempt = 0; attempt < MAX_INCREMENT_ATTEMPTS; attempt++) {
      final Optional<byte[]> current = store.get(countKey);
      final int next = current.map(PayloadCodec::decodeInt).orElse(0) + 1;
      if (store.compareAndPut(countKey, current, encodeInt(next))) {
        return OptionalInt.of(next);
      }
    }
    return OptionalInt.empty();
  }

  private static String waited(BoundedPoll poll) {
    return poll.state() == BoundedPoll.State.INTERRUPTED ? "was interrupted waiting" : "timed out waiting";
  }

  private Outcome<Void> fail(String barrierId, Phase phase, String what, String detail) {
    final String reason = "Rank " + context.rank() + " " + what + " for barrier " + barrierId + " in " + phase
        + " (" + detail + ")";
    LOGGER.warning(reason);
    return Outcome.failure(reason);
  }
}
