// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.KeyValueStore;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/// Everything a primitive needs to know about this participant: the store connection, the key namespace, our rank,
/// the group size and the timing. It is owned by one [RendezvousRuntime] and handed to each component. The only
/// mutable state is the per-process sequence numbers that keep repeated barriers and reductions apart, so an
/// instance must only be used from one thread.
public final class GroupContext {
  private final KeyValueStore store;
  private final KeyNamespace keys;
  private final int rank;
  private final int size;
  private final Timing timing;
  private final Sleeper sleeper;

  private final Map<String, Integer> barrierUses = new HashMap<>();
  private final Set<String> countedInstances = new HashSet<>();
  private long reductionSequence = 0;

  public GroupContext(KeyValueStore store, KeyNamespace keys, int rank, int size, Timing timing, Sleeper sleeper) {
    if (size < 1) throw new IllegalArgumentException("Group size must be at least 1 but was " + size);
    if (rank < 0) throw new IllegalArgumentException("Rank must be non-negative but was " + rank);
    this.store = store;
    this.keys = keys;
    this.rank = rank;
    this.size = size;
    this.timing = timing;
    this.sleeper = sleeper;
  }

  public KeyValueStore store() {
    return store;
  }

  public KeyNamespace keys() {
    return keys;
  }

  public int rank() {
    return rank;
  }

  public int size() {
    return size;
  }

  public Timing timing() {
    return timing;
  }

  /// Rank 0 owns the shared keys and cleans them up.
  public boolean isOwner() {
    return rank == 0;
  }

  public BoundedPoll poll(String description, int maxAttempts, Duration delay) {
    return new BoundedPoll("rank " + rank + " " + description, maxAttempts, delay, sleeper);
  }

  public void pause(Duration duration) throws InterruptedException {
    sleeper.sleep(duration);
  }

  /// The store id to use for this entry into the barrier called `barrierId`. The first use is the id itself and the
  /// n-th reuse is `<id>.<n>`. Only a passed barrier moves on to the next use, so a retry after a failure meets the
  /// peers that are still on the same use. Every participant passes barriers in the same program order so all agree on
  /// the id.
  String barrierInstance(String barrierId) {
    final int use = barrierUses.getOrDefault(barrierId, 0);
    return use == 0 ? barrierId : barrierId + "." + use;
  }

  void barrierPassed(String barrierId, String instance) {
    barrierUses.merge(barrierId, 1, Integer::sum);
    countedInstances.remove(instance);
  }

  /// Records that our arrival is in the shared count of `instance` so that a retry does not count us twice.
  void arrivalCounted(String instance) {
    countedInstances.add(instance);
  }

  boolean isArrivalCounted(String instance) {
    return countedInstances.contains(instance);
  }

  /// The next reduction context id. Every participant runs reductions in the same program order so all agree. A
  /// failed reduction deletes its context, so it is retried by every rank calling again, which keeps the sequences in
  /// step.
  String nextReductionId() {
    return "seq-" + reductionSequence++;
  }
}
