// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.MVStoreKeyValueStore;
import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.rendezvous.PayloadCodec.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MembershipRegistrarTest {

  final KeyNamespace keys = new KeyNamespace("xferbench/");
  MVStoreKeyValueStore store;

  @BeforeEach
  void setup() {
    store = MVStoreKeyValueStore.inMemory();
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void firstJoinerIsRankZero() {
    final var registrar = new MembershipRegistrar(store, keys);

    assertThat(registrar.register()).isEqualTo(0);
    assertThat(registrar.register()).isEqualTo(1);
    assertThat(registrar.registeredCount()).isEqualTo(2);
    assertThat(store.get(keys.rank(1)).map(PayloadCodec::text)).contains("active");
  }

  @Test
  void concurrentJoinsGetDistinctDenseRanks() throws Exception {
    final int joiners = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(joiners);
    final var start = new CountDownLatch(1);
    try {
      final List<Future<Integer>> ranks = new ArrayList<>();
      for (int i = 0; i < joiners; i++) {
        ranks.add(executor.submit(() -> {
          start.await();
          return new MembershipRegistrar(store, keys).register();
        }));
      }
      start.countDown();
      final List<Integer> assigned = new ArrayList<>();
      for (Future<Integer> rank : ranks) {
        assigned.add(rank.get(30, TimeUnit.SECONDS));
      }
      assertThat(assigned).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7);
    } finally {
      executor.shutdownNow();
    }
    assertThat(store.listPrefix(keys.prefix() + "rank/")).hasSize(joiners);
  }

  @Test
  void nonOwnerRemovesOnlyItsOwnRecord() {
    final var registrar = new MembershipRegistrar(store, keys);
    registrar.register();
    final int rank = registrar.register();
    store.put(keys.barrierCount("b"), text("2"));

    registrar.deregister(rank, false);

    assertThat(store.get(keys.rank(rank))).isEmpty();
    assertThat(store.get(keys.rank(0))).isPresent();
    assertThat(store.get(keys.size())).isPresent();
    assertThat(store.get(keys.barrierCount("b"))).isPresent();
  }

  @Test
  void ownerPurgesTheNamespace() {
    final var registrar = new MembershipRegistrar(store, keys);
    registrar.register();
    store.put(keys.barrierCount("b"), text("2"));
    store.put(keys.contribution("seq-0", 1), text("1.0"));
    store.put("elsewhere/size", text("9"));

    registrar.deregister(0, true);

    assertThat(store.listPrefix(keys.prefix())).isEmpty();
    assertThat(store.get("elsewhere/size")).isPresent();
  }

  @Test
  void lockTimeoutIsFatal() {
    final var slow = new MVStoreKeyValueStore(new MVStore.Builder().open(), Duration.ofSeconds(60),
        Duration.ofMillis(50), Clock.systemUTC());
    try {
      slow.acquireLock(keys.lock());
      assertThatThrownBy(() -> new MembershipRegistrar(slow, keys).register())
          .isInstanceOf(RegistrationException.class)
          .hasMessageContaining("lock");
    } finally {
      slow.close();
    }
  }

  @Test
  void corruptSizeIsFatalAndReleasesLock() {
    store.put(keys.size(), text("many"));

    assertThatThrownBy(() -> new MembershipRegistrar(store, keys).register())
        .isInstanceOf(RegistrationException.class)
        .hasCauseInstanceOf(NumberFormatException.class);
    assertThat(store.acquireLock(keys.lock())).isNotNull();
  }
}
