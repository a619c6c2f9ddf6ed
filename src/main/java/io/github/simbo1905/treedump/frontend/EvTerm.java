// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// The term that witnesses an evidence binding. Only ever shown in pretty-printed form.
public interface EvTerm extends Outputable {

  /// Evidence given by an expression in the front end's core language, kept as its printed text
  record EvExpr(String text) implements EvTerm {
    public EvExpr {
      Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String ppr() {
      return text;
    }
  }
}
