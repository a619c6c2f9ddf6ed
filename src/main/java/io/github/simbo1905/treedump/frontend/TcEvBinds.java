// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// Evidence bindings attached to type checked code.
public sealed interface TcEvBinds permits TcEvBinds.Mutable, TcEvBinds.Binds {

  /// Bindings still behind a reference the type checker writes to
  record Mutable(EvBindsVar var) implements TcEvBinds {
    public Mutable {
      Objects.requireNonNull(var, "var must not be null");
    }
  }

  /// Bindings the type checker has finished with
  record Binds(Bag<EvBind> binds) implements TcEvBinds {
    public Binds {
      Objects.requireNonNull(binds, "binds must not be null");
    }
  }
}
