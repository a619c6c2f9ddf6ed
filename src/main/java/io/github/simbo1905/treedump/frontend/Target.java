// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.nio.file.Path;
import java.util.Objects;

/// A source file the session is asked to load.
public record Target(Path file, boolean allowObjectCode) {
  public Target {
    Objects.requireNonNull(file, "file must not be null");
  }

  /// A target that is always compiled from source
  public static Target file(Path file) {
    return new Target(file, false);
  }
}
