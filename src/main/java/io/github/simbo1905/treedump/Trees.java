// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import java.util.Objects;

/// The dump of one compilation unit: its module name and one cleaned tree per compiler phase.
/// When type checking failed, the last three trees are leaves holding the diagnostics.
public record Trees(String module, Value parsed, Value renamed, Value typechecked, Value exports) {
  public Trees {
    Objects.requireNonNull(module, "module must not be null");
    Objects.requireNonNull(parsed, "parsed must not be null");
    Objects.requireNonNull(renamed, "renamed must not be null");
    Objects.requireNonNull(typechecked, "typechecked must not be null");
    Objects.requireNonNull(exports, "exports must not be null");
  }
}
