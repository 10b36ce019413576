// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.MVStoreKeyValueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class BroadcastTest {

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
  void everyRankGetsTheRootBuffer() throws Exception {
    final List<int[]> buffers = Ranks.runAll(store, 3, context -> {
      final int[] buffer = context.rank() == 1 ? new int[]{1, 2, 3, 4} : new int[4];
      final var broadcast = new Broadcast(context, new Barrier(context));
      return broadcast.broadcastInt(buffer, 4, 1).isSuccess() ? buffer : null;
    });

    assertThat(buffers).allSatisfy(buffer -> assertThat(buffer).containsExactly(1, 2, 3, 4));
    assertThat(store.listPrefix(Ranks.KEYS.prefix())).isEmpty();
  }

  @Test
  void onlyCountIntsAreOverwritten() throws Exception {
    final List<int[]> buffers = Ranks.runAll(store, 2, context -> {
      final int[] buffer = context.rank() == 0 ? new int[]{7, 8, 9} : new int[]{-1, -1, -1};
      final var broadcast = new Broadcast(context, new Barrier(context));
      return broadcast.broadcastInt(buffer, 2, 0).isSuccess() ? buffer : null;
    });

    assertThat(buffers.get(1)).containsExactly(7, 8, -1);
  }

  @Test
  void shortSlotTimesOut() {
    final var timing = new Timing(Duration.ofMillis(1), Duration.ofMillis(1), Duration.ZERO, Duration.ZERO,
        3, 3, 3, 3, 3);
    // the root has written too few ints and already arrived at the write barrier
    final var reader = new GroupContext(store, Ranks.KEYS, 1, 2, timing, Sleeper.SYSTEM);
    store.put(Ranks.KEYS.broadcastSlot(0), PayloadCodec.encodeInts(new int[]{5}, 1));
    store.put(Ranks.KEYS.barrierCount("bcast_int_0_write"), PayloadCodec.encodeInt(1));

    final Outcome<Void> outcome = new Broadcast(reader, new Barrier(reader)).broadcastInt(new int[2], 2, 0);

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.reason()).contains("broadcast data from rank 0");
  }

  @Test
  void rootOutsideGroupIsRejected() {
    final var context = Ranks.context(store, 0, 2);
    assertThat(new Broadcast(context, new Barrier(context)).broadcastInt(new int[1], 1, 5).isSuccess()).isFalse();
  }

  @Test
  void rootRemovesSlotWhenReadBarrierFails() {
    final var timing = new Timing(Duration.ofMillis(1), Duration.ofMillis(1), Duration.ZERO, Duration.ZERO,
        3, 3, 3, 3, 3);
    final var root = new GroupContext(store, Ranks.KEYS, 0, 2, timing, Sleeper.SYSTEM);
    // the other rank has already passed the write barrier and then went away
    store.put(Ranks.KEYS.barrierCount("bcast_int_0_write"), PayloadCodec.encodeInt(1));

    final Outcome<Void> outcome = new Broadcast(root, new Barrier(root)).broadcastInt(new int[]{1, 2}, 2, 0);

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.reason()).contains("bcast_int_0_read");
    assertThat(store.get(Ranks.KEYS.broadcastSlot(0))).isEmpty();
  }
}
