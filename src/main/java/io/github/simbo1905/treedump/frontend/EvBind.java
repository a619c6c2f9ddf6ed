// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// Binds an evidence variable to the term that witnesses it.
public record EvBind(Var var, EvTerm term, boolean isGiven) {
  public EvBind {
    Objects.requireNonNull(var, "var must not be null");
    Objects.requireNonNull(term, "term must not be null");
  }
}
