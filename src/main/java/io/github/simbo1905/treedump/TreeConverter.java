// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import io.github.simbo1905.treedump.frontend.Outputable;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.treedump.TreeDump.LOGGER;

/// Converts an arbitrary front end value into a raw {@link Value} tree.
///
/// Each value is first offered to the {@link Overrides} table and otherwise split generically into its
/// constructor and children. Every node is built under its own fault boundary, see {@link Faults}.
public final class TreeConverter {

  private final Overrides overrides;

  public TreeConverter(@NotNull Overrides overrides) {
    this.overrides = Objects.requireNonNull(overrides, "overrides must not be null");
  }

  /// Converts a value with pretty-printed renderings enabled
  public Value convert(Object value) {
    return convert(value, false);
  }

  /// Converts a value.
  ///
  /// @param suppressDualRender true inside a subtree that already carries a pretty-printed rendering;
  ///                           dual rendering rules then fall back to generic decomposition for the whole subtree
  public Value convert(Object value, boolean suppressDualRender) {
    return Faults.contain(() -> dispatch(value, suppressDualRender));
  }

  private Value dispatch(Object value, boolean suppressDualRender) throws Exception {
    final var rule = overrides.ruleFor(value);
    if (rule == null) {
      return generic(value, suppressDualRender);
    }
    LOGGER.finer(() -> rule.kind() + " rule for " + rule.type().getSimpleName()
        + (suppressDualRender ? " with dual render suppressed" : ""));
    return switch (rule.kind()) {
      case DUAL_RENDER -> suppressDualRender ? generic(value, true) : dualRender((Outputable) value);
      case PRETTY_ONLY -> new Value.LeafNode(((Outputable) value).ppr());
      case BESPOKE -> rule.renderer().render(value, this);
    };
  }

  private Value dualRender(Outputable value) throws Exception {
    final var pretty = value.ppr();
    final var tree = Faults.contain(() -> generic(value, true));
    return Value.rec(Value.field(pretty, tree));
  }

  private Value generic(Object value, boolean suppressDualRender) throws Exception {
    final var shape = Shape.of(value);
    if (shape instanceof Shape.Atom atom) {
      return new Value.ConNode(atom.tag(), List.of());
    }
    if (shape instanceof Shape.Constructor constructor) {
      final List<Value> children = new ArrayList<>(constructor.children().size());
      for (Shape.Child child : constructor.children()) {
        children.add(convertChild(child, suppressDualRender));
      }
      return new Value.ConNode(constructor.tag(), children);
    }
    // cons cells are built from the end so long sequences do not recurse once per element
    final var elements = ((Shape.Sequence) shape).elements();
    final var heads = new Value[elements.size()];
    for (int i = 0; i < heads.length; i++) {
      heads[i] = convertChild(elements.get(i), suppressDualRender);
    }
    Value list = new Value.ConNode(Tags.NIL, List.of());
    for (int i = heads.length - 1; i >= 0; i--) {
      list = new Value.ConNode(Tags.CONS, List.of(heads[i], list));
    }
    return list;
  }

  private Value convertChild(Shape.Child child, boolean suppressDualRender) {
    return Faults.contain(() -> dispatch(child.force(), suppressDualRender));
  }
}
