// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.nio.file.Path;
import java.util.Objects;

/// One entry of a loaded session's module graph.
public record ModSummary(Module module, Path file) {
  public ModSummary {
    Objects.requireNonNull(module, "module must not be null");
    Objects.requireNonNull(file, "file must not be null");
  }

  public ModuleName moduleName() {
    return module.moduleName();
  }
}
