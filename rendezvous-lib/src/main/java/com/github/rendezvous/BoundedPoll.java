// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// A fixed-count retry loop with a fixed delay between attempts. There is no backoff and no way to cancel it from
/// outside other than interrupting the thread. A probe that throws ends the poll and the exception propagates to the
/// primitive that started it.
///
/// One instance is used for one wait:
/// ```
/// POLLING --probe present--> SATISFIED
/// POLLING --attempts used up--> TIMED_OUT
/// POLLING --interrupted--> INTERRUPTED
/// ```
public final class BoundedPoll {
  private static final Logger LOGGER = Logger.getLogger(BoundedPoll.class.getName());

  public enum State {
    POLLING,
    SATISFIED,
    TIMED_OUT,
    INTERRUPTED
  }

  private final String description;
  private final int maxAttempts;
  private final Duration delay;
  private final Sleeper sleeper;

  private State state = State.POLLING;
  private int attempts = 0;

  public BoundedPoll(String description, int maxAttempts, Duration delay, Sleeper sleeper) {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
    this.description = description;
    this.maxAttempts = maxAttempts;
    this.delay = delay;
    this.sleeper = sleeper;
  }

  /// Probe until it yields a value or the attempts are used up. The poll sleeps after every empty probe except the
  /// last.
  public <T> Outcome<T> await(Supplier<Optional<T>> probe) {
    if (state != State.POLLING) {
      throw new IllegalStateException("Poll for " + description + " already finished as " + state);
    }
    while (true) {
      attempts++;
      final Optional<T> result = probe.get();
      if (result.isPresent()) {
        state = State.SATISFIED;
        return Outcome.success(result.get());
      }
      if (attempts >= maxAttempts) {
        state = State.TIMED_OUT;
        LOGGER.fine(() -> "timed out " + description + " after " + attempts + " attempts");
        return Outcome.failure("Timeout waiting for " + description + " after " + attempts + " attempts");
      }
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        state = State.INTERRUPTED;
        return Outcome.failure("Interrupted waiting for " + description);
      }
    }
  }

  public State state() {
    return state;
  }

  public int attempts() {
    return attempts;
  }
}
