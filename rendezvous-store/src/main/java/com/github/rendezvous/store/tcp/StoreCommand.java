// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store.tcp;

import com.github.rendezvous.store.LockToken;

import java.util.Optional;

/// The requests a [RemoteKeyValueStore] sends to a [StoreServer]. There is one record per
/// [com.github.rendezvous.store.KeyValueStore] method.
public sealed interface StoreCommand {

  record Put(String key, byte[] value) implements StoreCommand {
  }

  record Get(String key) implements StoreCommand {
  }

  record Delete(String key) implements StoreCommand {
  }

  record ListPrefix(String prefix) implements StoreCommand {
  }

  record DeleteRecursive(String prefix) implements StoreCommand {
  }

  @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
  record CompareAndPut(String key, Optional<byte[]> expected, byte[] value) implements StoreCommand {
  }

  record AcquireLock(String key) implements StoreCommand {
  }

  record ReleaseLock(LockToken token) implements StoreCommand {
  }
}
