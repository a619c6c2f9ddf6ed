// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import io.github.simbo1905.treedump.frontend.Outputable;

import java.util.List;

import static io.github.simbo1905.treedump.TreeDump.LOGGER;

/// Per-node fault containment. A failure while building one node becomes a {@link Value.LeafNode} in its place
/// so the rest of the tree still renders.
final class Faults {

  /// Placeholders front ends leave in a tree until a later phase fills them in.
  /// Touching one is expected when dumping an early phase, so it gets a short marker instead of a stack of text.
  static final List<String> KNOWN_PLACEHOLDERS =
      List.of("PostTcExpr", "PostTcKind", "PostTcType", "fixity", "placeHolderNames");

  private Faults() {
  }

  /// A node level computation that may fail
  @FunctionalInterface
  interface Evaluation {
    Value evaluate() throws Exception;
  }

  /// Runs the evaluation, turning any failure other than a {@link TreeInvariantException} into a leaf.
  /// Broken internal invariants of a front end usually surface as an {@link AssertionError}, and runaway
  /// recursion inside one node as a {@link StackOverflowError}; both are contained too.
  static Value contain(Evaluation evaluation) {
    try {
      return evaluation.evaluate();
    } catch (TreeInvariantException fatal) {
      throw fatal;
    } catch (Exception | AssertionError | StackOverflowError | ExceptionInInitializerError fault) {
      final var description = describe(fault);
      LOGGER.fine(() -> "Contained fault " + description);
      return new Value.LeafNode(description);
    }
  }

  /// The placeholder marker if the fault is a known one, otherwise the fault's own description
  static String describe(Throwable fault) {
    final var text = fault.toString();
    for (String placeholder : KNOWN_PLACEHOLDERS) {
      if (text.contains(placeholder)) {
        return "<<" + placeholder + ">>";
      }
    }
    return text;
  }

  /// Pretty-prints a value, returning the fault description in place of the text if printing fails.
  static String prettyOrFault(Outputable outputable) {
    try {
      return outputable.ppr();
    } catch (TreeInvariantException fatal) {
      throw fatal;
    } catch (RuntimeException | AssertionError | StackOverflowError | ExceptionInInitializerError fault) {
      LOGGER.fine(() -> "Pretty printing " + outputable.getClass().getSimpleName() + " failed: " + fault);
      return describe(fault);
    }
  }
}
