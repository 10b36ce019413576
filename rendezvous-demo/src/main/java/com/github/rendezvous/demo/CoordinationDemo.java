// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.demo;

import com.github.rendezvous.LoggerConfig;
import com.github.rendezvous.Outcome;
import com.github.rendezvous.RegistrationException;
import com.github.rendezvous.RendezvousRuntime;
import com.github.rendezvous.RuntimeConfig;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/// The coordination a transfer benchmark does around its workload. Rank 0 is the initiator and rank 1 the target;
/// further ranks only take part in the collectives.
///
/// 1. everyone meets at `start`;
/// 2. the initiator tells the target the block size and the target answers with its descriptor bytes;
/// 3. rank 0 broadcasts the run parameters `[blockSize, iterations, ranks]`;
/// 4. everyone does a stand-in workload and the elapsed times are summed onto rank 0;
/// 5. everyone meets at `end`.
///
/// ```
/// java com.github.rendezvous.demo.CoordinationDemo --size 2 --block-size 4096 --iterations 16
/// ```
/// The store endpoint and namespace come from `rendezvous.*` system properties or `RENDEZVOUS_*` environment
/// variables, see [RuntimeConfig#fromEnvironment(int)].
public class CoordinationDemo {
  private static final Logger LOGGER = Logger.getLogger(CoordinationDemo.class.getName());

  static final String HELP = "help";
  static final String SIZE = "size";
  static final String BLOCK_SIZE = "block-size";
  static final String ITERATIONS = "iterations";

  static final int INITIATOR = 0;
  static final int TARGET = 1;

  /// What rank 0 learns from a run.
  ///
  /// @param blockSize        the block size every rank agreed on
  /// @param targetDescriptor what the target sent back, empty on other ranks
  /// @param totalMillis      sum of every rank's workload time, only present on rank 0
  public record Report(int blockSize, String targetDescriptor, OptionalDouble totalMillis) {
  }

  private final RendezvousRuntime runtime;
  private final int blockSize;
  private final int iterations;

  public CoordinationDemo(RendezvousRuntime runtime, int blockSize, int iterations) {
    this.runtime = runtime;
    this.blockSize = blockSize;
    this.iterations = iterations;
  }

  public Outcome<Report> run() {
    final int rank = runtime.rank();
    return runtime.barrier("start")
        .then(ignored -> exchangeDescriptors(rank))
        .then(descriptor -> {
          final int[] parameters = rank == 0 ? new int[]{blockSize, iterations, runtime.size()} : new int[3];
          return runtime.broadcastInt(parameters, parameters.length, 0)
              .then(ignored -> {
                LOGGER.fine(() -> "rank " + rank + " parameters " + Arrays.toString(parameters));
                final double elapsed = workload(parameters[0], parameters[1]);
                return runtime.reduceSumDouble(elapsed, 0);
              })
              .then(total -> runtime.barrier("end")
                  .then(ignored -> Outcome.success(new Report(parameters[0], descriptor, total))));
        });
  }

  private Outcome<String> exchangeDescriptors(int rank) {
    if (runtime.size() < 2) {
      return Outcome.success("");
    }
    if (rank == INITIATOR) {
      final byte[] buffer = new byte[256];
      return runtime.sendInt(blockSize, TARGET)
          .then(ignored -> runtime.recvBytes(buffer, buffer.length, TARGET))
          .then(copied -> Outcome.success(new String(buffer, 0, copied, StandardCharsets.UTF_8)));
    }
    if (rank == TARGET) {
      return runtime.recvInt(INITIATOR)
          .then(size -> {
            final byte[] descriptor = ("target-" + rank + " block=" + size).getBytes(StandardCharsets.UTF_8);
            return runtime.sendBytes(descriptor, descriptor.length, INITIATOR);
          })
          .then(ignored -> Outcome.success(""));
    }
    return Outcome.success("");
  }

  /// Stands in for the transfer: touches every byte of a block `iterations` times.
  static double workload(int blockSize, int iterations) {
    final long start = System.nanoTime();
    final byte[] block = new byte[Math.max(blockSize, 0)];
    for (int i = 0; i < iterations; i++) {
      Arrays.fill(block, (byte) i);
    }
    return (System.nanoTime() - start) / 1_000_000.0;
  }

  public static void main(String[] args) {
    final CommandLineParser parser;
    try {
      parser = CommandLineParser.parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printHelp();
      System.exit(2);
      return;
    }
    if (parser.hasOption(HELP) || parser.hasOption("h")) {
      printHelp();
      return;
    } else if (!parser.hasOption(SIZE)) {
      System.err.println("Missing required option: --" + SIZE);
      printHelp();
      System.exit(2);
      return;
    }

    LoggerConfig.initialize();
    final var config = RuntimeConfig.fromEnvironment(parser.intOption(SIZE, 1));
    final Outcome<Report> outcome;
    try (var runtime = RendezvousRuntime.connect(config)) {
      outcome = new CoordinationDemo(runtime, parser.intOption(BLOCK_SIZE, 4096), parser.intOption(ITERATIONS, 16))
          .run();
      if (outcome.isSuccess()) {
        final Report report = outcome.value();
        report.totalMillis().ifPresent(total -> LOGGER.info(() -> String.format(
            "block size %d, average workload %.3f ms over %d ranks, target said '%s'",
            report.blockSize(), total / runtime.size(), runtime.size(), report.targetDescriptor())));
      } else {
        LOGGER.severe(() -> "Rank " + runtime.rank() + " failed: " + outcome.reason());
      }
    } catch (RegistrationException e) {
      LOGGER.severe(() -> "Could not join the group: " + e.getMessage());
      System.exit(1);
      return;
    }
    if (!outcome.isSuccess()) {
      System.exit(1);
    }
  }

  private static void printHelp() {
    System.out.println("Usage: java " + CoordinationDemo.class.getName() + " [options]");
    System.out.println("  --" + SIZE + "=2             number of processes in the run (required)");
    System.out.println("  --" + BLOCK_SIZE + "=4096      block size the initiator announces");
    System.out.println("  --" + ITERATIONS + "=16        workload iterations");
    System.out.println("  -h, --help          Show this help message");
  }
}
