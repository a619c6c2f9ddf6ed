// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;
import java.util.Optional;

/// The result of type checking one module.
///
/// @param renamedSource the renamed syntax tree, empty when the session was not asked to keep it
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public record TypecheckedModule(ParsedModule parsed, Optional<Object> renamedSource,
                                Object typecheckedSource, ModuleInfo moduleInfo) {
  public TypecheckedModule {
    Objects.requireNonNull(parsed, "parsed must not be null");
    Objects.requireNonNull(renamedSource, "renamedSource must not be null");
    Objects.requireNonNull(moduleInfo, "moduleInfo must not be null");
  }
}
