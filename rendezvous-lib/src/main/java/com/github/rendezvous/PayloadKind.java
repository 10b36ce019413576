// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

/// What a point-to-point message carries. The segment is part of the message key.
public enum PayloadKind {
  INT("int_data"),
  BYTES("char_data");

  private final String segment;

  PayloadKind(String segment) {
    this.segment = segment;
  }

  public String segment() {
    return segment;
  }
}
