// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store.tcp;

import com.github.rendezvous.store.KeyValueStore;
import com.github.rendezvous.store.LockToken;
import com.github.rendezvous.store.StoreEndpoint;
import com.github.rendezvous.store.StoreException;
import org.jetbrains.annotations.NotNull;

import java.io.*;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The client side of [StoreServer]. Calls are synchronous round-trips over one connection and are serialised by
/// the instance monitor. Any I/O failure or error reply is thrown as a [StoreException]. After an I/O failure the
/// connection is closed and every later call fails as the stream position can no longer be trusted.
public class RemoteKeyValueStore implements KeyValueStore {
  private static final Logger LOGGER = Logger.getLogger(RemoteKeyValueStore.class.getName());

  /// The server may hold a lock request for its lock wait so reads must be allowed to take longer than that.
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(90);
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

  private final StoreEndpoint endpoint;
  private final Socket socket;
  private final DataInputStream in;
  private final DataOutputStream out;
  private boolean broken = false;

  private RemoteKeyValueStore(StoreEndpoint endpoint, Socket socket) throws IOException {
    this.endpoint = endpoint;
    this.socket = socket;
    this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream(), StoreServer.BUFFER_SIZE));
    this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream(), StoreServer.BUFFER_SIZE));
  }

  public static RemoteKeyValueStore connect(StoreEndpoint endpoint) {
    return connect(endpoint, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
  }

  /// @throws StoreException if the endpoint is not reachable.
  public static RemoteKeyValueStore connect(StoreEndpoint endpoint, Duration connectTimeout, Duration readTimeout) {
    final var socket = new Socket();
    try {
      socket.connect(endpoint.socketAddress(), (int) connectTimeout.toMillis());
      socket.setSoTimeout((int) readTimeout.toMillis());
      socket.setTcpNoDelay(true);
      LOGGER.fine(() -> "connected to store at " + endpoint);
      return new RemoteKeyValueStore(endpoint, socket);
    } catch (IOException e) {
      try {
        socket.close();
      } catch (IOException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw new StoreException("Failed to connect to store at " + endpoint, e);
    }
  }

  private synchronized StoreReply call(StoreCommand command) {
    if (broken) {
      throw new StoreException("Connection to " + endpoint + " is broken");
    }
    final StoreReply reply;
    try {
      StoreServer.writeFrame(out, StorePickle.pickle(command));
      reply = StorePickle.unpickleReply(StoreServer.readFrame(in));
    } catch (IOException | UncheckedIOException e) {
      broken = true;
      closeQuietly();
      throw new StoreException("Store call " + command.getClass().getSimpleName() + " to " + endpoint + " failed", e);
    }
    if (reply instanceof StoreReply.Error error) {
      throw new StoreException(error.message());
    }
    return reply;
  }

  private <T extends StoreReply> T call(StoreCommand command, Class<T> expected) {
    final StoreReply reply = call(command);
    if (!expected.isInstance(reply)) {
      throw new StoreException("Unexpected reply " + reply.getClass().getSimpleName() + " to "
          + command.getClass().getSimpleName());
    }
    return expected.cast(reply);
  }

  @Override
  public void put(@NotNull String key, byte[] value) {
    call(new StoreCommand.Put(key, value), StoreReply.Done.class);
  }

  @Override
  public Optional<byte[]> get(@NotNull String key) {
    return call(new StoreCommand.Get(key), StoreReply.Value.class).value();
  }

  @Override
  public void delete(@NotNull String key) {
    call(new StoreCommand.Delete(key), StoreReply.Done.class);
  }

  @Override
  public List<String> listPrefix(@NotNull String prefix) {
    return call(new StoreCommand.ListPrefix(prefix), StoreReply.Keys.class).keys();
  }

  @Override
  public int deleteRecursive(@NotNull String prefix) {
    return call(new StoreCommand.DeleteRecursive(prefix), StoreReply.Count.class).count();
  }

  @Override
  public boolean compareAndPut(@NotNull String key, @NotNull Optional<byte[]> expected, byte[] value) {
    return call(new StoreCommand.CompareAndPut(key, expected, value), StoreReply.Flag.class).flag();
  }

  @Override
  public LockToken acquireLock(@NotNull String key) {
    return call(new StoreCommand.AcquireLock(key), StoreReply.Lock.class).token();
  }

  @Override
  public boolean releaseLock(@NotNull LockToken token) {
    return call(new StoreCommand.ReleaseLock(token), StoreReply.Flag.class).flag();
  }

  private void closeQuietly() {
    try {
      socket.close();
    } catch (IOException e) {
      LOGGER.log(Level.FINE, "Error closing connection to " + endpoint, e);
    }
  }

  @Override
  public synchronized void close() {
    broken = true;
    closeQuietly();
  }
}
