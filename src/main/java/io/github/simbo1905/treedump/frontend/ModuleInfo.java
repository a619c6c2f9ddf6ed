// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.List;

/// Interface information of a type checked module.
public record ModuleInfo(List<Name> exports) {
  public ModuleInfo {
    exports = List.copyOf(exports);
  }
}
