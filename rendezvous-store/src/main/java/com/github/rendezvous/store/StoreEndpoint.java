// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rendezvous.store;

import java.net.InetSocketAddress;

/// Where a store server listens. Written as `host:port` with an optional `tcp://` or `http://` scheme so that
/// endpoint strings in the style of `http://localhost:2379` can be used unchanged.
public record StoreEndpoint(String host, int port) {

  public static final StoreEndpoint DEFAULT = new StoreEndpoint("localhost", 2379);

  public StoreEndpoint {
    if (host == null || host.isBlank()) throw new IllegalArgumentException("Store host must not be blank");
    if (port < 0 || port > 65535) throw new IllegalArgumentException("Store port out of range: " + port);
  }

  /// @param endpoint `host:port`, `host` or `scheme://host:port`. Blank means [#DEFAULT].
  public static StoreEndpoint parse(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) {
      return DEFAULT;
    }
    var rest = endpoint.trim();
    final int scheme = rest.indexOf("://");
    if (scheme >= 0) {
      rest = rest.substring(scheme + 3);
    }
    if (rest.endsWith("/")) {
      rest = rest.substring(0, rest.length() - 1);
    }
    final int colon = rest.lastIndexOf(':');
    if (colon < 0) {
      return new StoreEndpoint(rest, DEFAULT.port());
    }
    try {
      return new StoreEndpoint(rest.substring(0, colon), Integer.parseInt(rest.substring(colon + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid store endpoint: " + endpoint, e);
    }
  }

  public InetSocketAddress socketAddress() {
    return new InetSocketAddress(host, port);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
