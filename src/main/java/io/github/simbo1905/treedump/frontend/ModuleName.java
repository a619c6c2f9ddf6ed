// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// A dotted module name such as `Data.List`
public record ModuleName(String string) implements Outputable {
  public ModuleName {
    Objects.requireNonNull(string, "string must not be null");
    if (string.isEmpty()) {
      throw new IllegalArgumentException("Module name must not be empty");
    }
  }

  @Override
  public String ppr() {
    return string;
  }
}
