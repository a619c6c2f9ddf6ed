// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import io.github.simbo1905.treedump.frontend.FrontEnd;
import io.github.simbo1905.treedump.frontend.SourceErrorException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import static io.github.simbo1905.treedump.TreeDump.LOGGER;

/// Command line entry point:
///
/// ```
/// dump-tree [--json|--text] [--frontend=<name>] [--width=<n>] <file>...
/// ```
///
/// Exits with 0 on success, 1 when the dump fails and 2 on bad usage.
public final class DumpTreeMain {

  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private DumpTreeMain() {
  }

  public static void main(String[] args) {
    final int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    DumpConfig config;
    final List<Path> files = new ArrayList<>();
    try {
      config = DumpConfig.current();
      for (String arg : args) {
        if ("--json".equals(arg)) {
          config = config.withFormat(OutputFormat.JSON);
        } else if ("--text".equals(arg)) {
          config = config.withFormat(OutputFormat.TEXT);
        } else if (arg.startsWith("--frontend=")) {
          config = config.withFrontEnd(arg.substring("--frontend=".length()));
        } else if (arg.startsWith("--width=")) {
          config = config.withWidth(DumpConfig.parseWidth(arg.substring("--width=".length())));
        } else if (arg.startsWith("--")) {
          throw new IllegalArgumentException("Unknown option: " + arg);
        } else {
          files.add(Path.of(arg));
        }
      }
    } catch (IllegalArgumentException e) {
      err.println("dump-tree: " + e.getMessage());
      usage(err);
      return EXIT_USAGE;
    }
    if (files.isEmpty()) {
      usage(err);
      return EXIT_USAGE;
    }

    try {
      final var frontEnd = FrontEnd.lookup(config.frontEnd().orElse(null));
      final var trees = TreeDump.treesForTargets(frontEnd, files);
      switch (config.format()) {
        case JSON -> TreeDump.dumpJson(trees, out);
        case TEXT -> TreeDump.dumpText(trees, out, config.width());
      }
      out.flush();
      return 0;
    } catch (SourceErrorException e) {
      err.println(e.diagnosticText());
      return EXIT_FAILURE;
    } catch (IOException | RuntimeException | AssertionError e) {
      LOGGER.log(Level.FINE, "Dump failed", e);
      err.println("dump-tree: " + e);
      return EXIT_FAILURE;
    }
  }

  private static void usage(PrintStream err) {
    err.println("usage: dump-tree [--json|--text] [--frontend=<name>] [--width=<n>] <file>...");
  }
}
