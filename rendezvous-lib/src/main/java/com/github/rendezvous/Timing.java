// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import java.time.Duration;

/// Delays and retry bounds of every poll loop. [#DEFAULT] gives one minute for a message or a barrier ready flag,
/// thirty seconds for barrier arrivals and reduction contributions, and one second for a broadcast read.
///
/// @param pollInterval          delay between attempts of the slow polls
/// @param fastPollInterval      delay between attempts of the broadcast read poll
/// @param ackGrace              how long a receiver waits after writing an ack before deleting the payload
/// @param barrierGrace          how long rank 0 waits after a barrier before deleting its keys
/// @param messageAttempts       bound for waiting on a payload or an ack
/// @param barrierCountAttempts  bound for waiting on all arrivals at a barrier
/// @param barrierReadyAttempts  bound for waiting on the barrier ready flag
/// @param broadcastAttempts     bound for reading the broadcast slot
/// @param reduceAttempts        bound on listing rounds while gathering reduction contributions
public record Timing(
    Duration pollInterval,
    Duration fastPollInterval,
    Duration ackGrace,
    Duration barrierGrace,
    int messageAttempts,
    int barrierCountAttempts,
    int barrierReadyAttempts,
    int broadcastAttempts,
    int reduceAttempts
) {
  public static final Timing DEFAULT = new Timing(
      Duration.ofSeconds(1),
      Duration.ofMillis(100),
      Duration.ofMillis(100),
      Duration.ofSeconds(5),
      60,
      30,
      60,
      10,
      30);

  public Timing {
    if (messageAttempts < 1 || barrierCountAttempts < 1 || barrierReadyAttempts < 1
        || broadcastAttempts < 1 || reduceAttempts < 1) {
      throw new IllegalArgumentException("Every attempt bound must be at least 1");
    }
  }

  public Timing withPollInterval(Duration pollInterval) {
    return new Timing(pollInterval, fastPollInterval, ackGrace, barrierGrace, messageAttempts,
        barrierCountAttempts, barrierReadyAttempts, broadcastAttempts, reduceAttempts);
  }

  public Timing withBarrierGrace(Duration barrierGrace) {
    return new Timing(pollInterval, fastPollInterval, ackGrace, barrierGrace, messageAttempts,
        barrierCountAttempts, barrierReadyAttempts, broadcastAttempts, reduceAttempts);
  }
}
