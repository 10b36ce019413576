// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

/// Joining the group failed. No coordination is possible without a rank so this is fatal for the whole run: entry
/// points log it and exit rather than retry.
public class RegistrationException extends RuntimeException {
  public RegistrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
