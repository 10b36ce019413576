// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import java.util.Optional;
import java.util.regex.Pattern;

/// Builds every store key of one run. All keys live under the one prefix so runs never collide and rank 0 can purge a
/// run with a single recursive delete.
///
/// ```
/// lock
/// size
/// rank/<r>
/// <op>+<int_data|char_data>/src=<s>/dst=<d>[/data][/ack]
/// barrier/<id>/count
/// barrier/<id>/ready
/// barrier/<id>/proc-<r>
/// bcast/int/<root>
/// reduce/<id>/rank-<r>
/// ```
///
/// Methods that return a "directory" end with a slash so that a prefix listing of `reduce/1/` never picks up
/// `reduce/10/`.
public record KeyNamespace(String prefix) {
  private static final Pattern REUSE_SUFFIX = Pattern.compile(".*\\.[0-9]+");

  public KeyNamespace {
    if (prefix == null || prefix.isEmpty()) throw new IllegalArgumentException("Namespace prefix must not be empty");
    prefix = prefix.endsWith("/") ? prefix : prefix + "/";
  }

  public String lock() {
    return prefix + "lock";
  }

  public String size() {
    return prefix + "size";
  }

  public String rank(int rank) {
    return prefix + "rank/" + rank;
  }

  public String message(String operation, int src, int dst, PayloadKind kind) {
    return prefix + operation + "+" + kind.segment() + "/src=" + src + "/dst=" + dst;
  }

  public static String data(String messageKey) {
    return messageKey + "/data";
  }

  public static String ack(String messageKey) {
    return messageKey + "/ack";
  }

  public String barriers() {
    return prefix + "barrier/";
  }

  public String barrier(String barrierId) {
    return barriers() + barrierId + "/";
  }

  public String barrierCount(String barrierId) {
    return barrier(barrierId) + "count";
  }

  public String barrierReady(String barrierId) {
    return barrier(barrierId) + "ready";
  }

  public String barrierArrival(String barrierId, int rank) {
    return barrier(barrierId) + "proc-" + rank;
  }

  public String broadcastSlot(int root) {
    return prefix + "bcast/int/" + root;
  }

  public String reduction(String reductionId) {
    return prefix + "reduce/" + reductionId + "/";
  }

  public String contribution(String reductionId, int rank) {
    return reduction(reductionId) + "rank-" + rank;
  }

  /// An id is one key segment. Barrier ids also may not end in `.<digits>` as that suffix marks re-use of an id.
  ///
  /// @return why the id can not be used, or empty if it can.
  public static Optional<String> checkBarrierId(String barrierId) {
    return checkSegment("Barrier", barrierId)
        .or(() -> REUSE_SUFFIX.matcher(barrierId).matches()
            ? Optional.of("Barrier id '" + barrierId + "' must not end in a reserved .<number> suffix")
            : Optional.empty());
  }

  public static Optional<String> checkReductionId(String reductionId) {
    return checkSegment("Reduction", reductionId);
  }

  private static Optional<String> checkSegment(String what, String id) {
    if (id == null || id.isEmpty()) {
      return Optional.of(what + " id must not be empty");
    }
    if (id.indexOf('/') >= 0) {
      return Optional.of(what + " id '" + id + "' must not contain '/'");
    }
    return Optional.empty();
  }
}
