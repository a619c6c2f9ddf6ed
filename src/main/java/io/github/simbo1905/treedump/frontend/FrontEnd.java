// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/// A compiler front end that can open sessions. Implementations are found with {@link ServiceLoader}.
public interface FrontEnd {

  /// The name used to pick this front end on the command line
  String name();

  FrontEndSession openSession() throws IOException;

  /// Finds a registered front end.
  ///
  /// @param name the front end to pick, or null to take the only one registered
  /// @throws IllegalStateException if nothing matches or the choice is ambiguous
  static @NotNull FrontEnd lookup(@Nullable String name) {
    final List<FrontEnd> available = ServiceLoader.load(FrontEnd.class).stream()
        .map(ServiceLoader.Provider::get)
        .toList();
    if (name != null) {
      return available.stream()
          .filter(frontEnd -> frontEnd.name().equals(name))
          .findFirst()
          .orElseThrow(() -> new IllegalStateException("No front end named '" + name + "'; available: "
              + names(available)));
    }
    if (available.size() != 1) {
      throw new IllegalStateException("Expected exactly one front end but found " + available.size()
          + ": " + names(available) + "; choose one by name");
    }
    return available.get(0);
  }

  private static String names(List<FrontEnd> frontEnds) {
    return frontEnds.stream().map(FrontEnd::name).collect(Collectors.joining(", ", "[", "]"));
  }
}
