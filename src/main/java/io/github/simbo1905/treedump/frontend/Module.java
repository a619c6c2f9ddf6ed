// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// A module name qualified by the unit that defines it
public record Module(UnitId unitId, ModuleName moduleName) implements Outputable {
  public Module {
    Objects.requireNonNull(unitId, "unitId must not be null");
    Objects.requireNonNull(moduleName, "moduleName must not be null");
  }

  public static Module of(String unitId, String moduleName) {
    return new Module(new UnitId(unitId), new ModuleName(moduleName));
  }

  @Override
  public String ppr() {
    return unitId.string() + ":" + moduleName.string();
  }
}
