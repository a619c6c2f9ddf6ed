// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// A syntax tree node paired with the span it was parsed from.
/// Dumped under the short constructor name `L` so that JSON output can fold the span into the wrapped node.
@DumpAs("L")
public record Located<T>(SrcSpan location, T value) {
  public Located {
    Objects.requireNonNull(location, "location must not be null");
  }

  public static <T> Located<T> at(SrcSpan location, T value) {
    return new Located<>(location, value);
  }
}
