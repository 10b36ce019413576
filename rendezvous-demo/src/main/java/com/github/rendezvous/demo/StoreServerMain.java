// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.demo;

import com.github.rendezvous.LoggerConfig;
import com.github.rendezvous.store.MVStoreKeyValueStore;
import com.github.rendezvous.store.StoreEndpoint;
import com.github.rendezvous.store.tcp.StoreServer;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs the shared store that every participant of a run connects to.
///
/// ```
/// java com.github.rendezvous.demo.StoreServerMain --port 2379 --file /tmp/rendezvous.mv
/// ```
/// Without `--file` the store lives in memory and is lost when the server stops.
public class StoreServerMain {
  private static final Logger LOGGER = Logger.getLogger(StoreServerMain.class.getName());

  static final String HELP = "help";
  static final String PORT = "port";
  static final String BIND = "bind";
  static final String FILE = "file";

  public static void main(String[] args) throws InterruptedException {
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
    }

    LoggerConfig.initialize();
    final var store = parser.option(FILE)
        .map(file -> MVStoreKeyValueStore.open(Path.of(file)))
        .orElseGet(MVStoreKeyValueStore::inMemory);
    final var stopped = new CountDownLatch(1);
    try {
      final InetAddress bindAddress = InetAddress.getByName(parser.option(BIND).orElse("0.0.0.0"));
      final var server = new StoreServer(store, bindAddress, parser.intOption(PORT, StoreEndpoint.DEFAULT.port()));
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        server.close();
        store.close();
        stopped.countDown();
      }, "store-shutdown"));
      stopped.await();
    } catch (IOException e) {
      LOGGER.log(Level.SEVERE, "Could not start store server: " + e.getMessage(), e);
      store.close();
      System.exit(1);
    }
  }

  private static void printHelp() {
    System.out.println("Usage: java " + StoreServerMain.class.getName() + " [options]");
    System.out.println("  --" + PORT + "=2379         TCP port to listen on");
    System.out.println("  --" + BIND + "=0.0.0.0      address to bind");
    System.out.println("  --" + FILE + "=store.mv     persist the store to this file");
    System.out.println("  -h, --help          Show this help message");
  }
}
