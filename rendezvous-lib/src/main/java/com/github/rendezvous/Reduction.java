// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.KeyValueStore;
import com.github.rendezvous.store.StoreException;

import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.rendezvous.PayloadCodec.*;

/// Many-to-one sum of doubles. Every rank writes its contribution under the reduction context; the destination folds
/// in the others as they appear, deleting each one it has consumed, then deletes the context. Other ranks return as
/// soon as their contribution is written.
public class Reduction {
  private static final Logger LOGGER = Logger.getLogger(Reduction.class.getName());

  private final GroupContext context;
  private final KeyValueStore store;
  private final KeyNamespace keys;

  public Reduction(GroupContext context) {
    this.context = context;
    this.store = context.store();
    this.keys = context.keys();
  }

  /// Uses the next id of this process's reduction sequence.
  public Outcome<OptionalDouble> reduceSum(double localValue, int destRank) {
    return reduceSum(context.nextReductionId(), localValue, destRank);
  }

  /// @param reductionId must be the same on every rank, unique within the run and free of `/`.
  /// @return the global sum on `destRank` and an empty value on every other rank.
  public Outcome<OptionalDouble> reduceSum(String reductionId, double localValue, int destRank) {
    final var invalid = KeyNamespace.checkReductionId(reductionId);
    if (invalid.isPresent()) return Outcome.failure(invalid.get());
    if (destRank < 0 || destRank >= context.size()) {
      return Outcome.failure("Destination rank " + destRank + " is outside group of size " + context.size());
    }
    final String contextKey = keys.reduction(reductionId);
    final String ownKey = keys.contribution(reductionId, context.rank());
    try {
      store.put(ownKey, encodeDouble(localValue));
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Error contributing to reduction " + reductionId, e);
      return Outcome.failure("Error in reduce operation: " + e.getMessage());
    }
    if (context.rank() != destRank) {
      return Outcome.success(OptionalDouble.empty());
    }

    final int expected = context.size() - 1;
    final var accumulator = new Accumulator(localValue);
    try {
      final Outcome<Integer> gathered = context
          .poll("reduction " + reductionId + " contributions", context.timing().reduceAttempts(),
              context.timing().pollInterval())
          .await(() -> {
            for (String key : store.listPrefix(contextKey)) {
              if (key.equals(ownKey) || accumulator.consumed.contains(key)) {
                continue;
              }
              final Optional<byte[]> contribution = store.get(key);
              if (contribution.isPresent()) {
                accumulator.sum += decodeDouble(contribution.get());
                store.delete(key);
                accumulator.consumed.add(key);
              }
            }
            return accumulator.consumed.size() >= expected
                ? Optional.of(accumulator.consumed.size())
                : Optional.empty();
          });
      if (!gathered.isSuccess()) {
        LOGGER.warning(() -> "Timeout waiting for reduction contributions (got " + accumulator.consumed.size()
            + "/" + expected + " contributions)");
        return Outcome.failure(gathered.reason());
      }
      return Outcome.success(OptionalDouble.of(accumulator.sum));
    } catch (StoreException | NumberFormatException e) {
      LOGGER.log(Level.WARNING, "Error in reduce operation " + reductionId, e);
      return Outcome.failure("Error in reduce operation: " + e.getMessage());
    } finally {
      try {
        store.deleteRecursive(contextKey);
      } catch (StoreException e) {
        LOGGER.log(Level.WARNING, "Failed to clean up reduction " + reductionId, e);
      }
    }
  }

  private static final class Accumulator {
    double sum;
    final Set<String> consumed = new HashSet<>();

    Accumulator(double seed) {
      this.sum = seed;
    }
  }
}
