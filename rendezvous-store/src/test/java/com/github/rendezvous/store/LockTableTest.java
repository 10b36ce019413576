// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store;

import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

public class LockTableTest {

  /// A clock the test moves by hand so lease expiry needs no sleeping.
  static class ManualClock extends Clock {
    Instant now = Instant.parse("2025-01-01T00:00:00Z");

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  ManualClock clock;
  LockTable table;

  @BeforeEach
  void setup() {
    clock = new ManualClock();
    table = new LockTable(MVStore.open(null), clock);
  }

  @Test
  void shouldRefuseLiveLockHeldByAnotherStamp() {
    assertThat(table.tryAcquireLock("lock", Duration.ofSeconds(30), 1L)).isPresent();
    assertThat(table.tryAcquireLock("lock", Duration.ofSeconds(30), 2L)).isEmpty();
  }

  @Test
  void sameStampExtendsTheLease() {
    final var first = table.tryAcquireLock("lock", Duration.ofSeconds(30), 1L).orElseThrow();
    clock.now = clock.now.plusSeconds(10);
    final var second = table.tryAcquireLock("lock", Duration.ofSeconds(30), 1L).orElseThrow();

    assertThat(second.expiryTime()).isAfter(first.expiryTime());
  }

  @Test
  void expiredLeaseCanBeTakenOver() {
    table.tryAcquireLock("lock", Duration.ofSeconds(30), 1L);
    clock.now = clock.now.plusSeconds(31);

    final var taken = table.tryAcquireLock("lock", Duration.ofSeconds(30), 2L);

    assertThat(taken).hasValueSatisfying(entry -> assertThat(entry.stamp()).isEqualTo(2L));
    // the old holder can no longer release it
    assertThat(table.releaseLock("lock", 1L)).isFalse();
    assertThat(table.releaseLock("lock", 2L)).isTrue();
  }
}
