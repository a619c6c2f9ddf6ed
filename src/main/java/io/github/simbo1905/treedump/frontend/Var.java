// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// A typed variable produced by the type checker.
public record Var(Name varName, Type varType) implements Outputable {
  public Var {
    Objects.requireNonNull(varName, "varName must not be null");
    Objects.requireNonNull(varType, "varType must not be null");
  }

  @Override
  public String ppr() {
    return varName.ppr();
  }
}
