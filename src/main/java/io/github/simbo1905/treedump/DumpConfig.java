// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import java.util.Objects;
import java.util.Optional;

/// Settings for a dump run, read from system properties and overridden by command line flags.
///
/// - `dump.tree.format`: `TEXT` or `JSON`, see {@link OutputFormat}
/// - `dump.tree.frontend`: the name of the front end to use when more than one is installed
/// - `dump.tree.width`: the text width the printer aims for, default {@value ValuePrinter#DEFAULT_WIDTH}
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public record DumpConfig(OutputFormat format, Optional<String> frontEnd, int width) {
  public static final String FRONTEND_PROPERTY = "dump.tree.frontend";
  public static final String WIDTH_PROPERTY = "dump.tree.width";

  public DumpConfig {
    Objects.requireNonNull(format, "format must not be null");
    Objects.requireNonNull(frontEnd, "frontEnd must not be null");
    if (width < 1) {
      throw new IllegalArgumentException("Width must be positive: " + width);
    }
  }

  public static DumpConfig current() {
    final var frontEnd = Optional.ofNullable(System.getProperty(FRONTEND_PROPERTY)).filter(name -> !name.isBlank());
    final var width = System.getProperty(WIDTH_PROPERTY, String.valueOf(ValuePrinter.DEFAULT_WIDTH));
    return new DumpConfig(OutputFormat.current(), frontEnd, parseWidth(width));
  }

  public DumpConfig withFormat(OutputFormat format) {
    return new DumpConfig(format, frontEnd, width);
  }

  public DumpConfig withFrontEnd(String frontEnd) {
    return new DumpConfig(format, Optional.of(frontEnd), width);
  }

  public DumpConfig withWidth(int width) {
    return new DumpConfig(format, frontEnd, width);
  }

  static int parseWidth(String text) {
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid width: " + text + ". Must be a positive integer");
    }
  }
}
