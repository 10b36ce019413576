// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.KeyValueStore;
import com.github.rendezvous.store.StoreException;
import com.github.rendezvous.store.tcp.RemoteKeyValueStore;

import java.util.OptionalDouble;
import java.util.logging.Logger;

/// The coordination facade of one process. Construction registers with the group and assigns our rank; [#close()]
/// waits for everyone at a final barrier when configured, deregisters, and lets rank 0 purge the namespace.
///
/// ```java
/// try (var runtime = RendezvousRuntime.connect(RuntimeConfig.fromEnvironment(2))) {
///   if (runtime.rank() == 0) runtime.sendInt(42, 1);
///   else runtime.recvInt(0);
///   runtime.barrier("done");
/// }
/// ```
///
/// A runtime is used by one thread. Other processes of the same run each have their own runtime.
public class RendezvousRuntime implements AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(RendezvousRuntime.class.getName());

  static final String FINAL_BARRIER = "finalize";

  private final RuntimeConfig config;
  private final KeyValueStore store;
  private final boolean ownsStore;
  private final MembershipRegistrar registrar;
  private final GroupContext context;
  private final PointToPointChannel channel;
  private final Barrier barrier;
  private final Broadcast broadcast;
  private final Reduction reduction;
  private boolean closed = false;

  RendezvousRuntime(KeyValueStore store, boolean ownsStore, RuntimeConfig config, Sleeper sleeper) {
    this.config = config;
    this.store = store;
    this.ownsStore = ownsStore;
    final var keys = new KeyNamespace(config.namespace());
    this.registrar = new MembershipRegistrar(store, keys);
    final int rank = registrar.register();
    this.context = new GroupContext(store, keys, rank, config.groupSize(), config.timing(), sleeper);
    this.channel = new PointToPointChannel(context);
    this.barrier = new Barrier(context);
    this.broadcast = new Broadcast(context, barrier);
    this.reduction = new Reduction(context);
    if (rank >= config.groupSize()) {
      LOGGER.warning(() -> "Rank " + rank + " joined a group configured for " + config.groupSize() + " processes");
    }
    LOGGER.info(() -> "Registered as rank " + rank + " item " + (rank + 1) + " of " + config.groupSize());
  }

  /// Opens a connection to the store server named in the config and joins the group. The runtime closes the
  /// connection when it is closed.
  ///
  /// @throws RegistrationException if the server cannot be reached or registration fails.
  public static RendezvousRuntime connect(RuntimeConfig config) {
    final KeyValueStore store;
    try {
      store = RemoteKeyValueStore.connect(config.endpoint());
    } catch (StoreException e) {
      throw new RegistrationException("Failed to connect to store at " + config.endpoint(), e);
    }
    try {
      return new RendezvousRuntime(store, true, config, Sleeper.SYSTEM);
    } catch (RuntimeException e) {
      store.close();
      throw e;
    }
  }

  /// Joins the group through a store the caller owns and closes.
  public static RendezvousRuntime join(KeyValueStore store, RuntimeConfig config) {
    return join(store, config, Sleeper.SYSTEM);
  }

  public static RendezvousRuntime join(KeyValueStore store, RuntimeConfig config, Sleeper sleeper) {
    return new RendezvousRuntime(store, false, config, sleeper);
  }

  public int rank() {
    return context.rank();
  }

  public int size() {
    return context.size();
  }

  public RuntimeConfig config() {
    return config;
  }

  public Outcome<Void> sendInt(int value, int destRank) {
    return channel.sendInt(value, destRank);
  }

  public Outcome<Integer> recvInt(int srcRank) {
    return channel.recvInt(srcRank);
  }

  public Outcome<Void> sendBytes(byte[] buffer, int count, int destRank) {
    return channel.sendBytes(buffer, count, destRank);
  }

  /// @return how many bytes were copied into `buffer`.
  public Outcome<Integer> recvBytes(byte[] buffer, int count, int srcRank) {
    return channel.recvBytes(buffer, count, srcRank);
  }

  public Outcome<Void> barrier(String barrierId) {
    return barrier.enter(barrierId);
  }

  public Outcome<Void> broadcastInt(int[] buffer, int count, int rootRank) {
    return broadcast.broadcastInt(buffer, count, rootRank);
  }

  public Outcome<OptionalDouble> reduceSumDouble(double localValue, int destRank) {
    return reduction.reduceSum(localValue, destRank);
  }

  public Outcome<OptionalDouble> reduceSumDouble(String reductionId, double localValue, int destRank) {
    return reduction.reduceSum(reductionId, localValue, destRank);
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (config.finalBarrier()) {
      final Outcome<Void> done = barrier.enter(FINAL_BARRIER);
      if (!done.isSuccess()) {
        LOGGER.warning(() -> "Rank " + rank() + " leaving without final barrier: " + done.reason());
      }
    }
    registrar.deregister(rank(), context.isOwner());
    if (ownsStore) {
      store.close();
    }
    LOGGER.fine(() -> "rank " + rank() + " closed");
  }
}
