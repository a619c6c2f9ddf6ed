// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// A reference to evidence bindings the type checker is still solving for.
public record EvBindsVar(Unique unique) implements Outputable {
  public EvBindsVar {
    Objects.requireNonNull(unique, "unique must not be null");
  }

  @Override
  public String ppr() {
    return "EvBindsVar<" + unique.ppr() + ">";
  }
}
