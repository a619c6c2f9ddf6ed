// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// The generic tree every compiler artefact is converted into before it is cleaned up and rendered.
///
/// Raw trees straight out of {@link TreeConverter} only use {@link LeafNode}, {@link ConNode} and
/// {@link RecNode}. {@link Cleanup} introduces {@link TupleNode} and {@link ListNode}.
public sealed interface Value permits Value.LeafNode, Value.ConNode, Value.RecNode, Value.TupleNode, Value.ListNode {

  /// Opaque text such as a literal, a pretty-printed rendering or a fault description
  record LeafNode(String text) implements Value {
    public LeafNode {
      Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String toTreeString() {
      return '"' + text + '"';
    }
  }

  /// A constructor with positional children
  record ConNode(String tag, List<Value> children) implements Value {
    public ConNode {
      Objects.requireNonNull(tag, "tag must not be null");
      if (tag.isEmpty()) {
        throw new IllegalArgumentException("Constructor tag must not be empty");
      }
      children = List.copyOf(children);
    }

    @Override
    public String toTreeString() {
      if (children.isEmpty()) {
        return tag;
      }
      return "(" + tag + " " + children.stream().map(Value::toTreeString).collect(Collectors.joining(" ")) + ")";
    }
  }

  /// A record; the label may be empty
  record RecNode(String label, List<Field> fields) implements Value {
    public RecNode {
      Objects.requireNonNull(label, "label must not be null");
      fields = List.copyOf(fields);
    }

    @Override
    public String toTreeString() {
      return label + fields.stream()
          .map(field -> field.name() + "=" + field.value().toTreeString())
          .collect(Collectors.joining(", ", "{", "}"));
    }
  }

  record TupleNode(List<Value> items) implements Value {
    public TupleNode {
      items = List.copyOf(items);
    }

    @Override
    public String toTreeString() {
      return items.stream().map(Value::toTreeString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  record ListNode(List<Value> items) implements Value {
    public ListNode {
      items = List.copyOf(items);
    }

    @Override
    public String toTreeString() {
      return items.stream().map(Value::toTreeString).collect(Collectors.joining(", ", "[", "]"));
    }
  }

  /// A named field of a {@link RecNode}
  record Field(String name, Value value) {
    public Field {
      Objects.requireNonNull(name, "name must not be null");
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  /// A compact single line rendering for logs and assertion messages
  String toTreeString();

  static LeafNode leaf(String text) {
    return new LeafNode(text);
  }

  static ConNode con(String tag, Value... children) {
    return new ConNode(tag, Arrays.asList(children));
  }

  static RecNode rec(Field... fields) {
    return new RecNode("", Arrays.asList(fields));
  }

  static Field field(String name, Value value) {
    return new Field(name, value);
  }

  static TupleNode tuple(Value... items) {
    return new TupleNode(Arrays.asList(items));
  }

  static ListNode list(Value... items) {
    return new ListNode(Arrays.asList(items));
  }
}
