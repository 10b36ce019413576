// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.StoreEndpoint;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/// Construction time configuration of a [RendezvousRuntime].
///
/// @param endpoint     where the store server listens
/// @param groupSize    how many processes take part in this run
/// @param namespace    prefix of every key of this run, normalised to end with a slash
/// @param timing       poll delays and bounds
/// @param finalBarrier whether [RendezvousRuntime#close()] waits for every rank before rank 0 purges the namespace
public record RuntimeConfig(
    StoreEndpoint endpoint,
    int groupSize,
    String namespace,
    Timing timing,
    boolean finalBarrier
) {
  public static final String DEFAULT_NAMESPACE = "xferbench/";

  public RuntimeConfig {
    if (groupSize < 1) throw new IllegalArgumentException("Group size must be at least 1 but was " + groupSize);
    if (namespace == null || namespace.isBlank()) throw new IllegalArgumentException("Namespace must not be blank");
    namespace = namespace.endsWith("/") ? namespace : namespace + "/";
  }

  public static RuntimeConfig defaults(int groupSize) {
    return new RuntimeConfig(StoreEndpoint.DEFAULT, groupSize, DEFAULT_NAMESPACE, Timing.DEFAULT, true);
  }

  /// Reads overrides from system properties and then environment variables:
  ///
  /// | property | environment | default |
  /// |---|---|---|
  /// | `rendezvous.endpoint` | `RENDEZVOUS_ENDPOINT` | `localhost:2379` |
  /// | `rendezvous.namespace` | `RENDEZVOUS_NAMESPACE` | `xferbench/` |
  /// | `rendezvous.poll.millis` | `RENDEZVOUS_POLL_MILLIS` | `1000` |
  /// | `rendezvous.barrier.grace.millis` | `RENDEZVOUS_BARRIER_GRACE_MILLIS` | `5000` |
  /// | `rendezvous.final.barrier` | `RENDEZVOUS_FINAL_BARRIER` | `true` |
  public static RuntimeConfig fromEnvironment(int groupSize) {
    return fromLookup(groupSize, name -> Optional.ofNullable(System.getProperty(name))
        .orElseGet(() -> System.getenv(name.toUpperCase(Locale.ROOT).replace('.', '_'))));
  }

  static RuntimeConfig fromLookup(int groupSize, Function<String, String> lookup) {
    final var endpoint = StoreEndpoint.parse(lookup.apply("rendezvous.endpoint"));
    final var namespace = Optional.ofNullable(lookup.apply("rendezvous.namespace"))
        .filter(s -> !s.isBlank())
        .orElse(DEFAULT_NAMESPACE);
    var timing = Timing.DEFAULT;
    final var poll = lookup.apply("rendezvous.poll.millis");
    if (poll != null && !poll.isBlank()) {
      timing = timing.withPollInterval(Duration.ofMillis(Long.parseLong(poll.trim())));
    }
    final var grace = lookup.apply("rendezvous.barrier.grace.millis");
    if (grace != null && !grace.isBlank()) {
      timing = timing.withBarrierGrace(Duration.ofMillis(Long.parseLong(grace.trim())));
    }
    final boolean finalBarrier = Optional.ofNullable(lookup.apply("rendezvous.final.barrier"))
        .map(s -> Boolean.parseBoolean(s.trim()))
        .orElse(true);
    return new RuntimeConfig(endpoint, groupSize, namespace, timing, finalBarrier);
  }
}
