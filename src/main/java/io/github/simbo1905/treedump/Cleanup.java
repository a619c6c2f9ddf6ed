// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import java.util.ArrayList;
import java.util.List;

/// Rewrites a raw tree into its canonical form: cons chains become lists, tuple constructors become tuples
/// and bag wrappers get a uniform name. Applying it twice gives the same result as applying it once.
public final class Cleanup {

  private Cleanup() {
  }

  /// @throws TreeInvariantException if a list, cons or bag node has the wrong number of children
  public static Value cleanup(Value value) {
    if (value instanceof Value.LeafNode) {
      return value;
    }
    if (value instanceof Value.RecNode record) {
      return new Value.RecNode(record.label(), record.fields().stream()
          .map(field -> Value.field(field.name(), cleanup(field.value())))
          .toList());
    }
    if (value instanceof Value.TupleNode tuple) {
      return new Value.TupleNode(cleanAll(tuple.items()));
    }
    if (value instanceof Value.ListNode list) {
      return new Value.ListNode(cleanAll(list.items()));
    }
    final var con = (Value.ConNode) value;
    final var tag = con.tag();
    if (Tags.NIL.equals(tag)) {
      if (!con.children().isEmpty()) {
        throw new TreeInvariantException("Empty list constructor with " + con.children().size() + " children");
      }
      return new Value.ListNode(List.of());
    }
    if (Tags.CONS.equals(tag)) {
      return consList(con);
    }
    if (Tags.isTuple(tag)) {
      return new Value.TupleNode(cleanAll(con.children()));
    }
    if (tag.startsWith(Tags.BAG_PREFIX)) {
      if (con.children().size() != 1) {
        throw new TreeInvariantException("Bag " + tag + " with " + con.children().size()
            + " children, expected its element list");
      }
      return new Value.ConNode(Tags.BAG_FROM_LIST, List.of(cleanup(con.children().get(0))));
    }
    return new Value.ConNode(tag, cleanAll(con.children()));
  }

  private static List<Value> cleanAll(List<Value> values) {
    return values.stream().map(Cleanup::cleanup).toList();
  }

  /// Walks the spine iteratively so that long lists do not recurse once per element
  private static Value consList(Value.ConNode cons) {
    final List<Value> items = new ArrayList<>();
    Value cell = cons;
    while (cell instanceof Value.ConNode node && Tags.CONS.equals(node.tag())) {
      if (node.children().size() != 2) {
        throw new TreeInvariantException("Cons cell with " + node.children().size() + " children, expected 2");
      }
      items.add(cleanup(node.children().get(0)));
      cell = node.children().get(1);
    }
    final var tail = cleanup(cell);
    if (!(tail instanceof Value.ListNode rest)) {
      throw new TreeInvariantException("Cons cell whose tail is not a list: " + tail.toTreeString());
    }
    items.addAll(rest.items());
    return new Value.ListNode(items);
  }
}
