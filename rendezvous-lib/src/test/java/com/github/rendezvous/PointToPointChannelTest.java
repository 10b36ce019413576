// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import com.github.rendezvous.store.MVStoreKeyValueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.github.rendezvous.PayloadCodec.text;
import static org.assertj.core.api.Assertions.assertThat;

public class PointToPointChannelTest {

  MVStoreKeyValueStore store;

  @BeforeEach
  void setup() {
    store = MVStoreKeyValueStore.inMemory();
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void intArrivesAndLeavesNothingBehind() throws Exception {
    final var sender = new PointToPointChannel(Ranks.context(store, 0, 2));
    final var receiver = new PointToPointChannel(Ranks.context(store, 1, 2));

    final var sent = CompletableFuture.supplyAsync(() -> sender.sendInt(42, 1));
    final Outcome<Integer> received = receiver.recvInt(0);

    assertThat(received.value()).isEqualTo(42);
    assertThat(sent.get(30, TimeUnit.SECONDS).isSuccess()).isTrue();
    assertThat(store.listPrefix(Ranks.KEYS.prefix())).isEmpty();
  }

  @Test
  void bytesArriveAndLeaveNothingBehind() throws Exception {
    final var sender = new PointToPointChannel(Ranks.context(store, 2, 3));
    final var receiver = new PointToPointChannel(Ranks.context(store, 0, 3));

    final var sent = CompletableFuture.supplyAsync(() -> sender.sendBytes(text("hello"), 5, 0));
    final byte[] buffer = new byte[16];

    assertThat(receiver.recvBytes(buffer, buffer.length, 2).value()).isEqualTo(5);
    assertThat(new String(buffer, 0, 5)).isEqualTo("hello");
    assertThat(sent.get(30, TimeUnit.SECONDS).isSuccess()).isTrue();
    assertThat(store.listPrefix(Ranks.KEYS.prefix())).isEmpty();
  }

  @Test
  void longerMessageIsTruncatedToReceiverCount() throws Exception {
    final var sender = new PointToPointChannel(Ranks.context(store, 0, 2));
    final var receiver = new PointToPointChannel(Ranks.context(store, 1, 2));

    final var sent = CompletableFuture.supplyAsync(() -> sender.sendBytes(text("abcdefgh"), 8, 1));
    final byte[] buffer = {'.', '.', '.', '.', '.', '.'};
    final Outcome<Integer> copied = receiver.recvBytes(buffer, 4, 0);

    assertThat(copied.value()).isEqualTo(4);
    assertThat(new String(buffer)).isEqualTo("abcd..");
    assertThat(sent.get(30, TimeUnit.SECONDS).isSuccess()).isTrue();
  }

  @Test
  void malformedIntFailsWithoutWaiting() {
    final List<Duration> sleeps = new ArrayList<>();
    final var context = new GroupContext(store, Ranks.KEYS, 1, 2, Timing.DEFAULT, sleeps::add);
    store.put(Ranks.KEYS.message(PointToPointChannel.OPERATION, 0, 1, PayloadKind.INT), text("forty-two"));

    final Outcome<Integer> received = new PointToPointChannel(context).recvInt(0);

    assertThat(received.isSuccess()).isFalse();
    assertThat(received.reason()).contains("Malformed");
    assertThat(sleeps).isEmpty();
  }

  @Test
  void missingAckTimesOutAndKeepsPayload() {
    final List<Duration> sleeps = new ArrayList<>();
    final var context = new GroupContext(store, Ranks.KEYS, 0, 2, Timing.DEFAULT, sleeps::add);

    final Outcome<Void> sent = new PointToPointChannel(context).sendInt(7, 1);

    assertThat(sent.isSuccess()).isFalse();
    assertThat(sent.reason()).contains("acknowledgment from rank 1");
    assertThat(sleeps).hasSize(Timing.DEFAULT.messageAttempts() - 1);
    assertThat(store.get(Ranks.KEYS.message(PointToPointChannel.OPERATION, 0, 1, PayloadKind.INT))).isPresent();
  }

  @Test
  void peerOutsideGroupIsRejected() {
    final var channel = new PointToPointChannel(Ranks.context(store, 0, 2));

    assertThat(channel.sendInt(1, 2).isSuccess()).isFalse();
    assertThat(channel.recvInt(-1).isSuccess()).isFalse();
    assertThat(store.listPrefix(Ranks.KEYS.prefix())).isEmpty();
  }

  @Test
  void negativeReceiveCountFailsBeforeTouchingTheMessage() {
    final String messageKey = Ranks.KEYS.message(PointToPointChannel.OPERATION, 0, 1, PayloadKind.BYTES);
    store.put(KeyNamespace.data(messageKey), text("abcd"));
    store.put(messageKey, PayloadCodec.encodeMetadata(0, 1, 4));

    final Outcome<Integer> received = new PointToPointChannel(Ranks.context(store, 1, 2))
        .recvBytes(new byte[4], -1, 0);

    assertThat(received.isSuccess()).isFalse();
    assertThat(received.reason()).contains("must not be negative");
    assertThat(store.get(KeyNamespace.ack(messageKey))).isEmpty();
    assertThat(store.get(messageKey)).isPresent();
  }
}
