// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store;

import java.time.Instant;

/// A handle to an advisory lock held in the store. It is not the lock itself. The lock lives in the store and you
/// cannot synchronize on this object.
public record LockToken(
    /// The key that the lock guards.
    String key,
    /// Unique per acquisition. Only the holder of the matching stamp can release the lock.
    long stamp,
    /// After this time the store will let someone else take the lock even if it was never released.
    Instant expiryTime
) {
}
