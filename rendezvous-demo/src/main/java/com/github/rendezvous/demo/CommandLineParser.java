// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.demo;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/// Reads `--name=value`, `--name value` and bare `--flag` options. Short `-h` is accepted as a flag.
final class CommandLineParser {
  private final Map<String, String> options = new HashMap<>();

  static CommandLineParser parse(String[] args) {
    final var parser = new CommandLineParser();
    for (int i = 0; i < args.length; i++) {
      final String arg = args[i];
      if (arg.startsWith("--")) {
        final String option = arg.substring(2);
        if (option.contains("=")) {
          final String[] parts = option.split("=", 2);
          parser.options.put(parts[0], parts[1]);
        } else if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
          parser.options.put(option, args[++i]);
        } else {
          parser.options.put(option, "true");
        }
      } else if (arg.startsWith("-")) {
        parser.options.put(arg.substring(1), "true");
      } else {
        throw new IllegalArgumentException("Unexpected argument: " + arg);
      }
    }
    return parser;
  }

  boolean hasOption(String name) {
    return options.containsKey(name);
  }

  Optional<String> option(String name) {
    return Optional.ofNullable(options.get(name));
  }

  int intOption(String name, int defaultValue) {
    return option(name).map(String::trim).map(Integer::parseInt).orElse(defaultValue);
  }
}
