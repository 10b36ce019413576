// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import java.util.function.Function;

/// The result of a coordination primitive. A primitive never throws for a timeout, a malformed payload or a store
/// fault. It returns a [Failure] carrying a reason for the log and callers only need to ask [#isSuccess()].
public sealed interface Outcome<T> {

  record Success<T>(T value) implements Outcome<T> {
  }

  record Failure<T>(String reason) implements Outcome<T> {
  }

  static <T> Outcome<T> success(T value) {
    return new Success<>(value);
  }

  static Outcome<Void> ok() {
    return new Success<>(null);
  }

  static <T> Outcome<T> failure(String reason) {
    return new Failure<>(reason);
  }

  default boolean isSuccess() {
    return this instanceof Success;
  }

  /// @throws IllegalStateException if this is a failure.
  default T value() {
    if (this instanceof Success<T> success) {
      return success.value();
    }
    throw new IllegalStateException("No value: " + ((Failure<T>) this).reason());
  }

  /// @return the failure reason or an empty string for a success.
  default String reason() {
    return this instanceof Failure<T> failure ? failure.reason() : "";
  }

  /// Continue with `next` only if this succeeded. A failure is passed through unchanged.
  default <R> Outcome<R> then(Function<T, Outcome<R>> next) {
    if (this instanceof Success<T> success) {
      return next.apply(success.value());
    }
    return new Failure<>(reason());
  }
}
