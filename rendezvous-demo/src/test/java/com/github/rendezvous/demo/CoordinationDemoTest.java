// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.demo;

import com.github.rendezvous.Outcome;
import com.github.rendezvous.RendezvousRuntime;
import com.github.rendezvous.RuntimeConfig;
import com.github.rendezvous.Timing;
import com.github.rendezvous.store.MVStoreKeyValueStore;
import com.github.rendezvous.store.StoreEndpoint;
import com.github.rendezvous.store.tcp.StoreServer;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class CoordinationDemoTest {

  static final Timing QUICK = new Timing(
      Duration.ofMillis(5), Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(200),
      400, 400, 400, 400, 400);

  @Test
  void initiatorAndTargetCompleteARunThroughTheServer() throws Exception {
    final int size = 3;
    try (var store = MVStoreKeyValueStore.inMemory();
         var server = new StoreServer(store, InetAddress.getLoopbackAddress(), 0)) {
      final var endpoint = new StoreEndpoint(InetAddress.getLoopbackAddress().getHostAddress(), server.port());
      final var config = new RuntimeConfig(endpoint, size, "demo/", QUICK, true);

      final ExecutorService executor = Executors.newFixedThreadPool(size);
      try {
        final List<Future<Outcome<CoordinationDemo.Report>>> futures = new ArrayList<>();
        for (int i = 0; i < size; i++) {
          futures.add(executor.submit(() -> {
            try (var runtime = RendezvousRuntime.connect(config)) {
              final var outcome = new CoordinationDemo(runtime, 1024, 4).run();
              return runtime.rank() == 0 ? outcome : Outcome.<CoordinationDemo.Report>failure("not rank 0");
            }
          }));
        }
        final List<CoordinationDemo.Report> initiatorReports = new ArrayList<>();
        for (var future : futures) {
          final var outcome = future.get(60, TimeUnit.SECONDS);
          if (outcome.isSuccess()) {
            initiatorReports.add(outcome.value());
          }
        }

        assertThat(initiatorReports).singleElement().satisfies(report -> {
          assertThat(report.blockSize()).isEqualTo(1024);
          assertThat(report.targetDescriptor()).isEqualTo("target-1 block=1024");
          assertThat(report.totalMillis()).isPresent();
        });
      } finally {
        executor.shutdownNow();
      }
      assertThat(store.listPrefix("demo/")).isEmpty();
    }
  }

  @Test
  void singleProcessSkipsTheExchange() {
    try (var store = MVStoreKeyValueStore.inMemory();
         var runtime = RendezvousRuntime.join(store, new RuntimeConfig(StoreEndpoint.DEFAULT, 1, "solo/", QUICK, true))) {
      final var outcome = new CoordinationDemo(runtime, 64, 1).run();

      assertThat(outcome.value().targetDescriptor()).isEmpty();
      assertThat(outcome.value().blockSize()).isEqualTo(64);
    }
  }
}
