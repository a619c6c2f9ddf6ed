// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import java.io.Serial;

/// Raised when a tree breaks an assumption the dumper relies on.
/// Unlike an ordinary fault inside a node, this is never contained: it aborts the whole dump.
public class TreeInvariantException extends IllegalStateException {
  @Serial
  private static final long serialVersionUID = 1L;

  public TreeInvariantException(String message) {
    super(message);
  }
}
