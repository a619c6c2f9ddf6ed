// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// The result of parsing one module: its summary and the front end's parsed syntax tree.
public record ParsedModule(ModSummary summary, Object parsedSource) {
  public ParsedModule {
    Objects.requireNonNull(summary, "summary must not be null");
  }
}
