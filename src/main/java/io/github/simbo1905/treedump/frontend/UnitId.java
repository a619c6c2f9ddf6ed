// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// Identifies the package or compilation unit a module belongs to
public record UnitId(String string) implements Outputable {
  public static final UnitId MAIN = new UnitId("main");

  public UnitId {
    Objects.requireNonNull(string, "string must not be null");
  }

  @Override
  public String ppr() {
    return string;
  }
}
