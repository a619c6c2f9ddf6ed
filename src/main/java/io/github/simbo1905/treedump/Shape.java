// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import java.util.List;
import java.util.Objects;

/// The generic decomposition of one value: a constructor tag and its immediate children.
/// Children are thunks so that a failure to produce one child only affects that child.
sealed interface Shape permits Shape.Atom, Shape.Constructor, Shape.Sequence {

  /// The shape of any value, computed by the decomposer cached for its class.
  static Shape of(Object value) {
    if (value == null) {
      return new Atom(Tags.NULL);
    }
    return Decomposers.forClass(value.getClass()).decompose(value);
  }

  /// A value with no children such as a literal or an enum constant
  record Atom(String tag) implements Shape {
    public Atom {
      Objects.requireNonNull(tag, "tag must not be null");
    }
  }

  record Constructor(String tag, List<Child> children) implements Shape {
    public Constructor {
      Objects.requireNonNull(tag, "tag must not be null");
      children = List.copyOf(children);
    }
  }

  /// An ordered sequence, dumped as a chain of cons cells
  record Sequence(List<Child> elements) implements Shape {
    public Sequence {
      elements = List.copyOf(elements);
    }
  }

  /// A deferred read of one child
  @FunctionalInterface
  interface Child {
    Object force() throws Exception;
  }
}
