// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store.tcp;

import com.github.rendezvous.store.LockToken;

import java.util.List;
import java.util.Optional;

public sealed interface StoreReply {

  /// Put and delete have nothing to return.
  record Done() implements StoreReply {
  }

  @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
  record Value(Optional<byte[]> value) implements StoreReply {
  }

  record Keys(List<String> keys) implements StoreReply {
    public Keys {
      keys = List.copyOf(keys);
    }
  }

  record Count(int count) implements StoreReply {
  }

  record Flag(boolean flag) implements StoreReply {
  }

  record Lock(LockToken token) implements StoreReply {
  }

  /// The server caught a failure applying the command. The client rethrows it as a
  /// [com.github.rendezvous.store.StoreException].
  record Error(String message) implements StoreReply {
  }
}
