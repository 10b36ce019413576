// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import java.util.Optional;
import java.util.logging.*;

/// Sends `java.util.logging` output to stdout as `[LEVEL] message`. The level comes from the `LOG_LEVEL` environment
/// variable and defaults to `INFO`. Call [#initialize()] once from a `main` or a test class static block.
public final class LoggerConfig {

  static {
    try {
      final Logger rootLogger = Logger.getLogger("");
      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      final ConsoleHandler consoleHandler = new ConsoleHandler() {{
        setOutputStream(System.out);
      }};

      final Level level = Level.parse(Optional.ofNullable(System.getenv("LOG_LEVEL")).orElse("INFO"));
      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          final String base = String.format("[%s] %s%n", record.getLevel().getName(), formatMessage(record));
          return record.getThrown() == null ? base : base + "  caused by " + record.getThrown() + System.lineSeparator();
        }
      });
    } catch (IllegalArgumentException | SecurityException e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  private LoggerConfig() {
  }

  public static void initialize() {
    // loading the class runs the static block
  }
}
