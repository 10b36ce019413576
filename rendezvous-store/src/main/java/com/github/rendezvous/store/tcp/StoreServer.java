// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store.tcp;

import com.github.rendezvous.store.KeyValueStore;
import com.github.rendezvous.store.StoreException;

import java.io.*;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Exposes a [KeyValueStore] to other processes over TCP. Each client connection gets its own thread that reads a
/// request frame, applies it to the store and writes the reply frame. A frame is an int length followed by a
/// [StorePickle] body.
///
/// A lock request blocks its connection thread until the lock is granted or the store gives up, which is why
/// connections are not multiplexed.
public class StoreServer implements AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(StoreServer.class.getName());
  static final int BUFFER_SIZE = 8192;
  static final int MAX_FRAME = 64 * 1024 * 1024;

  private final KeyValueStore store;
  private final ServerSocket serverSocket;
  private final ExecutorService connectionExecutor;
  private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
  private final Thread acceptThread;
  private volatile boolean running = true;

  /// @param port zero picks an ephemeral port, see [#port()].
  public StoreServer(KeyValueStore store, InetAddress bindAddress, int port) throws IOException {
    this.store = store;
    this.serverSocket = new ServerSocket(port, 50, bindAddress);
    final var counter = new AtomicInteger();
    this.connectionExecutor = Executors.newCachedThreadPool(r -> {
      final var thread = new Thread(r, "store-connection-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    this.acceptThread = new Thread(this::acceptLoop, "store-accept-" + serverSocket.getLocalPort());
    this.acceptThread.setDaemon(true);
    this.acceptThread.start();
    LOGGER.info(() -> "Store server listening on " + serverSocket.getLocalSocketAddress());
  }

  public int port() {
    return serverSocket.getLocalPort();
  }

  private void acceptLoop() {
    while (running) {
      try {
        final Socket clientSocket = serverSocket.accept();
        clients.add(clientSocket);
        connectionExecutor.submit(() -> handleClient(clientSocket));
      } catch (IOException e) {
        if (!running) {
          break;
        }
        LOGGER.log(Level.SEVERE, "Error accepting client connection", e);
      }
    }
    LOGGER.fine(() -> "accept thread exiting");
  }

  private void handleClient(Socket clientSocket) {
    LOGGER.fine(() -> "client connected " + clientSocket.getRemoteSocketAddress());
    try (clientSocket) {
      clientSocket.setTcpNoDelay(true);
      clientSocket.setKeepAlive(true);
      final var in = new DataInputStream(new BufferedInputStream(clientSocket.getInputStream(), BUFFER_SIZE));
      final var out = new DataOutputStream(new BufferedOutputStream(clientSocket.getOutputStream(), BUFFER_SIZE));
      while (running && !clientSocket.isClosed()) {
        final byte[] request;
        try {
          request = readFrame(in);
        } catch (EOFException e) {
          // client closed the connection normally
          break;
        }
        final byte[] reply = StorePickle.pickle(apply(StorePickle.unpickleCommand(request)));
        writeFrame(out, reply);
      }
    } catch (SocketException e) {
      if (running) {
        LOGGER.fine(() -> "client connection dropped: " + e.getMessage());
      }
    } catch (IOException | UncheckedIOException e) {
      LOGGER.log(Level.WARNING, "Error serving client " + clientSocket.getRemoteSocketAddress(), e);
    } finally {
      clients.remove(clientSocket);
    }
  }

  /// Runs one command against the store. Store failures become an error reply rather than dropping the connection.
  StoreReply apply(StoreCommand command) {
    LOGGER.finer(() -> "apply " + command.getClass().getSimpleName());
    try {
      if (command instanceof StoreCommand.Put cmd) {
        store.put(cmd.key(), cmd.value());
        return new StoreReply.Done();
      } else if (command instanceof StoreCommand.Get cmd) {
        return new StoreReply.Value(store.get(cmd.key()));
      } else if (command instanceof StoreCommand.Delete cmd) {
        store.delete(cmd.key());
        return new StoreReply.Done();
      } else if (command instanceof StoreCommand.ListPrefix cmd) {
        return new StoreReply.Keys(store.listPrefix(cmd.prefix()));
      } else if (command instanceof StoreCommand.DeleteRecursive cmd) {
        return new StoreReply.Count(store.deleteRecursive(cmd.prefix()));
      } else if (command instanceof StoreCommand.CompareAndPut cmd) {
        return new StoreReply.Flag(store.compareAndPut(cmd.key(), cmd.expected(), cmd.value()));
      } else if (command instanceof StoreCommand.AcquireLock cmd) {
        return new StoreReply.Lock(store.acquireLock(cmd.key()));
      } else if (command instanceof StoreCommand.ReleaseLock cmd) {
        return new StoreReply.Flag(store.releaseLock(cmd.token()));
      }
      return new StoreReply.Error("Unknown command: " + command);
    } catch (StoreException e) {
      LOGGER.log(Level.WARNING, "Store failure applying " + command.getClass().getSimpleName(), e);
      return new StoreReply.Error(e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Unexpected failure applying " + command.getClass().getSimpleName(), e);
      return new StoreReply.Error(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  static byte[] readFrame(DataInputStream in) throws IOException {
    final int length = in.readInt();
    if (length < 0 || length > MAX_FRAME) {
      throw new IOException("Invalid frame length: " + length);
    }
    final byte[] data = new byte[length];
    in.readFully(data);
    return data;
  }

  static void writeFrame(DataOutputStream out, byte[] data) throws IOException {
    out.writeInt(data.length);
    out.write(data);
    out.flush();
  }

  @Override
  public void close() {
    running = false;
    try {
      serverSocket.close();
    } catch (IOException e) {
      LOGGER.log(Level.WARNING, "Error closing server socket", e);
    }
    for (Socket client : clients) {
      try {
        client.close();
      } catch (IOException e) {
        LOGGER.log(Level.FINE, "Error closing client socket", e);
      }
    }
    connectionExecutor.shutdownNow();
    acceptThread.interrupt();
    LOGGER.info(() -> "Store server on port " + serverSocket.getLocalPort() + " closed");
  }
}
