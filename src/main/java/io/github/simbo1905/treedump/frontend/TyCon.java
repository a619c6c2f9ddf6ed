// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// A type constructor such as `Int` or `Maybe`
public record TyCon(Name name) implements Outputable {
  public TyCon {
    Objects.requireNonNull(name, "name must not be null");
  }

  @Override
  public String ppr() {
    return name.ppr();
  }
}
