// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// The subset of front end session settings the dumper needs to control.
public record SessionFlags(Backend backend, LinkMode linkMode) {
  public SessionFlags {
    Objects.requireNonNull(backend, "backend must not be null");
    Objects.requireNonNull(linkMode, "linkMode must not be null");
  }

  public SessionFlags withBackend(Backend backend) {
    return new SessionFlags(backend, linkMode);
  }

  public SessionFlags withLinkMode(LinkMode linkMode) {
    return new SessionFlags(backend, linkMode);
  }

  /// What code the session generates once modules type check
  public enum Backend {
    NATIVE,
    BYTECODE,
    /// Stop after type checking
    NONE
  }

  public enum LinkMode {
    LINK_BINARY,
    LINK_IN_MEMORY,
    NO_LINK
  }
}
