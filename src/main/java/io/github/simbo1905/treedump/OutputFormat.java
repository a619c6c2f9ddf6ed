// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import java.util.Arrays;

/// How dumps are written. Set via system property `dump.tree.format`. The default is TEXT.
public enum OutputFormat {
  /// Indented text for people, one section per compiler phase
  TEXT,
  /// A single JSON array for tools
  JSON;

  public static final String PROPERTY = "dump.tree.format";

  public static OutputFormat current() {
    return parse(System.getProperty(PROPERTY, TEXT.name()));
  }

  static OutputFormat parse(String text) {
    final String format = text.trim().toUpperCase();
    try {
      return OutputFormat.valueOf(format);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid output format: " + format + ". Must be one of: "
          + Arrays.toString(OutputFormat.values()));
    }
  }
}
