// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.demo;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CommandLineParserTest {

  @Test
  void readsBothOptionSpellings() {
    final var parser = CommandLineParser.parse(new String[]{"--size=3", "--block-size", "512", "--verbose", "-h"});

    assertThat(parser.intOption("size", 1)).isEqualTo(3);
    assertThat(parser.intOption("block-size", 1)).isEqualTo(512);
    assertThat(parser.option("verbose")).contains("true");
    assertThat(parser.hasOption("h")).isTrue();
    assertThat(parser.intOption("iterations", 16)).isEqualTo(16);
  }

  @Test
  void rejectsStrayArguments() {
    assertThatThrownBy(() -> CommandLineParser.parse(new String[]{"size"}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
