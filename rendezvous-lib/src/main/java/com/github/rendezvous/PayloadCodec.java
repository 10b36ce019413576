// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/// The value encodings written to the store. Text values are UTF-8.
///
/// - ints are decimal text;
/// - doubles are fixed point text with sixteen fractional digits;
/// - broadcast buffers are four little endian bytes per int;
/// - byte message metadata is `src:dst:length`.
public final class PayloadCodec {

  public static final int INT_BYTES = Integer.BYTES;
  static final int DOUBLE_FRACTION_DIGITS = 16;

  private PayloadCodec() {
  }

  public static byte[] text(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  public static String text(byte[] value) {
    return new String(value, StandardCharsets.UTF_8);
  }

  public static byte[] encodeInt(int value) {
    return text(Integer.toString(value));
  }

  /// @throws NumberFormatException if the value is not a decimal int.
  public static int decodeInt(byte[] value) {
    return Integer.parseInt(text(value).trim());
  }

  public static byte[] encodeDouble(double value) {
    if (!Double.isFinite(value)) {
      // fixed point has no spelling for these
      return text(Double.toString(value));
    }
    return text(new BigDecimal(value)
        .setScale(DOUBLE_FRACTION_DIGITS, RoundingMode.HALF_EVEN)
        .toPlainString());
  }

  /// @throws NumberFormatException if the value is not a decimal number.
  public static double decodeDouble(byte[] value) {
    return Double.parseDouble(text(value).trim());
  }

  public static byte[] encodeInts(int[] buffer, int count) {
    if (count < 0 || count > buffer.length) {
      throw new IllegalArgumentException("count " + count + " outside buffer of length " + buffer.length);
    }
    final var bytes = ByteBuffer.allocate(count * INT_BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (int i = 0; i < count; i++) {
      bytes.putInt(buffer[i]);
    }
    return bytes.array();
  }

  /// Copies the first `count` ints out of `encoded` into `buffer`.
  ///
  /// @return false without touching `buffer` if `encoded` holds fewer than `count` ints.
  public static boolean decodeInts(byte[] encoded, int[] buffer, int count) {
    if (encoded.length < count * INT_BYTES) {
      return false;
    }
    final var bytes = ByteBuffer.wrap(encoded).order(ByteOrder.LITTLE_ENDIAN);
    for (int i = 0; i < count; i++) {
      buffer[i] = bytes.getInt();
    }
    return true;
  }

  public static byte[] encodeMetadata(int src, int dst, int length) {
    return text(String.format(Locale.ROOT, "%d:%d:%d", src, dst, length));
  }
}
