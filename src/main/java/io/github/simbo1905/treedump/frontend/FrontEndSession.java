// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.io.IOException;
import java.util.List;

/// A compiler session owned by exactly one caller. Not thread safe.
public interface FrontEndSession extends AutoCloseable {

  SessionFlags flags();

  void setFlags(SessionFlags flags);

  void setTargets(List<Target> targets);

  /// Loads all targets and whatever they import.
  ///
  /// @return false if some module failed to load; the module graph still lists every module found
  /// @throws IOException if a target cannot be read
  boolean load() throws IOException;

  /// @return summaries of the loaded modules, in dependency order
  List<ModSummary> moduleGraph();

  ParsedModule parseModule(ModSummary summary) throws SourceErrorException;

  TypecheckedModule typecheckModule(ParsedModule parsed) throws SourceErrorException;

  @Override
  void close() throws IOException;
}
