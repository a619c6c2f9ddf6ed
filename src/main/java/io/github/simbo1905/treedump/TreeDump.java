// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import io.github.simbo1905.treedump.frontend.FrontEnd;
import io.github.simbo1905.treedump.frontend.FrontEndSession;
import io.github.simbo1905.treedump.frontend.ModSummary;
import io.github.simbo1905.treedump.frontend.SessionFlags;
import io.github.simbo1905.treedump.frontend.SourceErrorException;
import io.github.simbo1905.treedump.frontend.Target;
import io.github.simbo1905.treedump.frontend.TypecheckedModule;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Dumps the syntax trees a compiler front end builds for each module: parsed, renamed, type checked and
/// the exports, as text or JSON.
///
/// ```java
/// final var trees = TreeDump.treesForTargets(FrontEnd.lookup(null), List.of(Path.of("Main.hs")));
/// TreeDump.dumpText(trees, System.out, ValuePrinter.DEFAULT_WIDTH);
/// ```
public final class TreeDump {

  public static final Logger LOGGER = Logger.getLogger(TreeDump.class.getName());

  private TreeDump() {
  }

  /// Converts any front end value with the standard rules and cleans it up
  public static Value valueOf(Object tree) {
    return valueOf(tree, Overrides.standard());
  }

  public static Value valueOf(Object tree, @NotNull Overrides overrides) {
    return Cleanup.cleanup(new TreeConverter(overrides).convert(tree));
  }

  /// Switches off code generation and linking; dumping only needs the front end phases
  public static SessionFlags treeDumpFlags(SessionFlags flags) {
    return flags.withBackend(SessionFlags.Backend.NONE).withLinkMode(SessionFlags.LinkMode.NO_LINK);
  }

  /// Opens a session on the front end, dumps the files and closes the session again.
  public static List<Trees> treesForTargets(@NotNull FrontEnd frontEnd, List<Path> files)
      throws IOException, SourceErrorException {
    Objects.requireNonNull(frontEnd, "frontEnd must not be null");
    LOGGER.fine(() -> "Opening " + frontEnd.name() + " session for " + files.size() + " files");
    try (FrontEndSession session = frontEnd.openSession()) {
      return treesForTargets(session, files);
    }
  }

  /// Loads the files into the session and dumps every module of the resulting module graph.
  /// The session's flags are restored afterwards whether or not the dump succeeds.
  ///
  /// @throws SourceErrorException if a module does not parse
  public static List<Trees> treesForTargets(@NotNull FrontEndSession session, List<Path> files)
      throws IOException, SourceErrorException {
    Objects.requireNonNull(session, "session must not be null");
    final var original = session.flags();
    try {
      session.setFlags(treeDumpFlags(original));
      session.setTargets(files.stream().map(Target::file).toList());
      if (!session.load()) {
        LOGGER.warning(() -> "Some modules failed to load; dumping what the front end has");
      }
      return treesForSession(session);
    } finally {
      session.setFlags(original);
    }
  }

  /// Dumps every module of an already loaded session, in module graph order
  public static List<Trees> treesForSession(@NotNull FrontEndSession session) throws SourceErrorException {
    final List<Trees> units = new ArrayList<>();
    for (ModSummary summary : session.moduleGraph()) {
      units.add(treesForModSummary(session, summary));
    }
    return units;
  }

  /// Parses and type checks one module and dumps the trees of each phase.
  ///
  /// A type checking failure does not fail the dump: the renamed, type checked and export trees are replaced
  /// by the diagnostics.
  ///
  /// @throws SourceErrorException if the module does not parse
  public static Trees treesForModSummary(@NotNull FrontEndSession session, @NotNull ModSummary summary)
      throws SourceErrorException {
    final var module = Faults.prettyOrFault(summary.moduleName());
    LOGGER.info(() -> "Dumping module " + module);
    final var parsed = session.parseModule(summary);
    final var parsedTree = valueOf(parsed.parsedSource());
    final TypecheckedModule typechecked;
    try {
      typechecked = session.typecheckModule(parsed);
    } catch (SourceErrorException e) {
      LOGGER.info(() -> "Module " + module + " does not type check: " + e.messages().size() + " diagnostics");
      final var diagnostics = new Value.LeafNode(e.diagnosticText());
      return new Trees(module, parsedTree, diagnostics, diagnostics, diagnostics);
    }
    final Value renamed = typechecked.renamedSource()
        .map(TreeDump::valueOf)
        .orElseGet(() -> new Value.LeafNode(Tags.NOT_AVAILABLE));
    return new Trees(module, parsedTree, renamed,
        valueOf(typechecked.typecheckedSource()),
        valueOf(typechecked.moduleInfo().exports()));
  }

  public static String treesToText(Trees trees) {
    return treesToText(trees, ValuePrinter.DEFAULT_WIDTH);
  }

  /// The text document for one unit: a heading and one section per phase
  public static String treesToText(Trees trees, int width) {
    final var printer = new ValuePrinter(width);
    final var text = new StringBuilder();
    text.append("# ").append(trees.module()).append('\n').append('\n');
    section(text, "## Parsed", printer.render(trees.parsed()));
    section(text, "## Renamed", printer.render(trees.renamed()));
    section(text, "## Typechecked", printer.render(trees.typechecked()));
    section(text, "## Exports", printer.render(trees.exports()));
    return text.toString();
  }

  public static void dumpText(List<Trees> units, PrintStream out, int width) {
    units.forEach(trees -> out.println(treesToText(trees, width)));
  }

  public static void dumpJson(List<Trees> units, OutputStream out) throws IOException {
    TreeJson.write(units, out);
  }

  private static void section(StringBuilder text, String title, String body) {
    text.append(title).append('\n').append(body).append('\n').append('\n');
  }
}
