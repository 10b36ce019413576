// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.KeyValueStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/// Runs one task per rank on its own thread against a shared store, the way separate processes would.
final class Ranks {

  static final Timing FAST = new Timing(
      Duration.ofMillis(5),
      Duration.ofMillis(5),
      Duration.ofMillis(10),
      Duration.ofMillis(200),
      400,
      400,
      400,
      400,
      400);

  static final KeyNamespace KEYS = new KeyNamespace("test/");

  private Ranks() {
  }

  static GroupContext context(KeyValueStore store, int rank, int size) {
    return new GroupContext(store, KEYS, rank, size, FAST, Sleeper.SYSTEM);
  }

  /// @return each rank's result in rank order.
  static <T> List<T> runAll(KeyValueStore store, int size, Function<GroupContext, T> task) throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(size);
    try {
      final List<Future<T>> futures = new ArrayList<>();
      for (int rank = 0; rank < size; rank++) {
        final var context = context(store, rank, size);
        futures.add(executor.submit(() -> task.apply(context)));
      }
      final List<T> results = new ArrayList<>();
      for (Future<T> future : futures) {
        results.add(future.get(60, TimeUnit.SECONDS));
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }
}
