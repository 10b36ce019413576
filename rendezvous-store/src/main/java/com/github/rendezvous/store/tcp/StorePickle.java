// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store.tcp;

import com.github.rendezvous.store.LockToken;

import java.io.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Serializes the store wire protocol the boilerplate way with data streams. Strings are modified UTF-8 and blobs are
/// an int length followed by the bytes.
public class StorePickle {

  private static final Logger LOGGER = Logger.getLogger(StorePickle.class.getName());

  static final byte PUT = 0;
  static final byte GET = 1;
  static final byte DELETE = 2;
  static final byte LIST_PREFIX = 3;
  static final byte DELETE_RECURSIVE = 4;
  static final byte COMPARE_AND_PUT = 5;
  static final byte ACQUIRE_LOCK = 6;
  static final byte RELEASE_LOCK = 7;

  static final byte DONE = 0;
  static final byte VALUE = 1;
  static final byte KEYS = 2;
  static final byte COUNT = 3;
  static final byte FLAG = 4;
  static final byte LOCK = 5;
  static final byte ERROR = 6;

  public static byte[] pickle(StoreCommand command) {
    try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(baos)) {
      if (command instanceof StoreCommand.Put cmd) {
        dos.writeByte(PUT);
        dos.writeUTF(cmd.key());
        writeBytes(dos, cmd.value());
      } else if (command instanceof StoreCommand.Get cmd) {
        dos.writeByte(GET);
        dos.writeUTF(cmd.key());
      } else if (command instanceof StoreCommand.Delete cmd) {
        dos.writeByte(DELETE);
        dos.writeUTF(cmd.key());
      } else if (command instanceof StoreCommand.ListPrefix cmd) {
        dos.writeByte(LIST_PREFIX);
        dos.writeUTF(cmd.prefix());
      } else if (command instanceof StoreCommand.DeleteRecursive cmd) {
        dos.writeByte(DELETE_RECURSIVE);
        dos.writeUTF(cmd.prefix());
      } else if (command instanceof StoreCommand.CompareAndPut cmd) {
        dos.writeByte(COMPARE_AND_PUT);
        dos.writeUTF(cmd.key());
        writeOptionalBytes(dos, cmd.expected());
        writeBytes(dos, cmd.value());
      } else if (command instanceof StoreCommand.AcquireLock cmd) {
        dos.writeByte(ACQUIRE_LOCK);
        dos.writeUTF(cmd.key());
      } else if (command instanceof StoreCommand.ReleaseLock cmd) {
        dos.writeByte(RELEASE_LOCK);
        writeToken(dos, cmd.token());
      } else {
        throw new IllegalArgumentException("Unknown command: " + command);
      }
      dos.flush();
      return baos.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static StoreCommand unpickleCommand(byte[] bytes) {
    LOGGER.finer(() -> "Unpickling command: " + bytes.length);
    try (ByteArrayInputStream bais = new ByteArrayInputStream(bytes);
         DataInputStream dis = new DataInputStream(bais)) {
      final byte opcode = dis.readByte();
      switch (opcode) {
        case PUT:
          return new StoreCommand.Put(dis.readUTF(), readBytes(dis));
        case GET:
          return new StoreCommand.Get(dis.readUTF());
        case DELETE:
          return new StoreCommand.Delete(dis.readUTF());
        case LIST_PREFIX:
          return new StoreCommand.ListPrefix(dis.readUTF());
        case DELETE_RECURSIVE:
          return new StoreCommand.DeleteRecursive(dis.readUTF());
        case COMPARE_AND_PUT:
          return new StoreCommand.CompareAndPut(dis.readUTF(), readOptionalBytes(dis), readBytes(dis));
        case ACQUIRE_LOCK:
          return new StoreCommand.AcquireLock(dis.readUTF());
        case RELEASE_LOCK:
          return new StoreCommand.ReleaseLock(readToken(dis));
        default:
          throw new IOException("Unknown command type " + opcode);
      }
    } catch (IOException e) {
      LOGGER.log(Level.SEVERE, "Exception unpickling command: " + e.getMessage(), e);
      throw new UncheckedIOException(e);
    }
  }

  public static byte[] pickle(StoreReply reply) {
    try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(baos)) {
      if (reply instanceof StoreReply.Done) {
        dos.writeByte(DONE);
      } else if (reply instanceof StoreReply.Value ret) {
        dos.writeByte(VALUE);
        writeOptionalBytes(dos, ret.value());
      } else if (reply instanceof StoreReply.Keys ret) {
        dos.writeByte(KEYS);
        dos.writeInt(ret.keys().size());
        for (String key : ret.keys()) {
          dos.writeUTF(key);
        }
      } else if (reply instanceof StoreReply.Count ret) {
        dos.writeByte(COUNT);
        dos.writeInt(ret.count());
      } else if (reply instanceof StoreReply.Flag ret) {
        dos.writeByte(FLAG);
        dos.writeBoolean(ret.flag());
      } else if (reply instanceof StoreReply.Lock ret) {
        dos.writeByte(LOCK);
        writeToken(dos, ret.token());
      } else if (reply instanceof StoreReply.Error ret) {
        dos.writeByte(ERROR);
        dos.writeUTF(String.valueOf(ret.message()));
      } else {
        throw new IllegalArgumentException("Unknown reply: " + reply);
      }
      dos.flush();
      return baos.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static StoreReply unpickleReply(byte[] bytes) {
    try (ByteArrayInputStream bais = new ByteArrayInputStream(bytes);
         DataInputStream dis = new DataInputStream(bais)) {
      final byte type = dis.readByte();
      switch (type) {
        case DONE:
          return new StoreReply.Done();
        case VALUE:
          return new StoreReply.Value(readOptionalBytes(dis));
        case KEYS: {
          final int size = dis.readInt();
          final var keys = new ArrayList<String>(size);
          for (int i = 0; i < size; i++) {
            keys.add(dis.readUTF());
          }
          return new StoreReply.Keys(keys);
        }
        case COUNT:
          return new StoreReply.Count(dis.readInt());
        case FLAG:
          return new StoreReply.Flag(dis.readBoolean());
        case LOCK:
          return new StoreReply.Lock(readToken(dis));
        case ERROR:
          return new StoreReply.Error(dis.readUTF());
        default:
          throw new IOException("Unknown reply type " + type);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void writeBytes(DataOutputStream dos, byte[] bytes) throws IOException {
    dos.writeInt(bytes.length);
    dos.write(bytes);
  }

  private static byte[] readBytes(DataInputStream dis) throws IOException {
    final int length = dis.readInt();
    if (length < 0) {
      throw new IOException("Negative blob length " + length);
    }
    final byte[] bytes = new byte[length];
    dis.readFully(bytes);
    return bytes;
  }

  @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
  private static void writeOptionalBytes(DataOutputStream dos, Optional<byte[]> bytes) throws IOException {
    dos.writeBoolean(bytes.isPresent());
    if (bytes.isPresent()) {
      writeBytes(dos, bytes.get());
    }
  }

  private static Optional<byte[]> readOptionalBytes(DataInputStream dis) throws IOException {
    return dis.readBoolean() ? Optional.of(readBytes(dis)) : Optional.empty();
  }

  private static void writeToken(DataOutputStream dos, LockToken token) throws IOException {
    dos.writeUTF(token.key());
    dos.writeLong(token.stamp());
    // seconds and nanos separately for Instant
    dos.writeLong(token.expiryTime().getEpochSecond());
    dos.writeInt(token.expiryTime().getNano());
  }

  private static LockToken readToken(DataInputStream dis) throws IOException {
    final String key = dis.readUTF();
    final long stamp = dis.readLong();
    final long seconds = dis.readLong();
    final int nanos = dis.readInt();
    return new LockToken(key, stamp, Instant.ofEpochSecond(seconds, nanos));
  }
}
