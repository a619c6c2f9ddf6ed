// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// A resolved identifier.
public record Name(OccName occName, NameSort sort, SrcSpan srcSpan, Unique unique) implements Outputable {
  public Name {
    Objects.requireNonNull(occName, "occName must not be null");
    Objects.requireNonNull(sort, "sort must not be null");
    Objects.requireNonNull(srcSpan, "srcSpan must not be null");
    Objects.requireNonNull(unique, "unique must not be null");
  }

  @Override
  public String ppr() {
    return occName.ppr();
  }
}
