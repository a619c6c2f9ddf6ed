// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import java.util.ArrayList;
import java.util.List;

/// Lays out a cleaned tree as human readable text.
///
/// A value that fits in the remaining width stays on one line. Anything longer is broken with a two space
/// hanging indent:
///
/// ```
/// { n_loc = Main.hs:3:1-4
/// , n_sort = { External = Module main Main }
/// , n_uniq = r1
/// , VarName = main
/// }
/// ```
public final class ValuePrinter {

  public static final int DEFAULT_WIDTH = 100;

  private final int width;

  public ValuePrinter(int width) {
    if (width < 1) {
      throw new IllegalArgumentException("Width must be positive: " + width);
    }
    this.width = width;
  }

  public ValuePrinter() {
    this(DEFAULT_WIDTH);
  }

  public String render(Value value) {
    return String.join("\n", lines(value));
  }

  public List<String> lines(Value value) {
    return layout(value, 0);
  }

  private List<String> layout(Value value, int column) {
    final var flat = flat(value, width - column);
    if (flat != null) {
      return List.of(flat);
    }
    if (value instanceof Value.LeafNode leaf) {
      return List.of(leaf.text().split("\n", -1));
    }
    if (value instanceof Value.ConNode con) {
      final List<String> lines = new ArrayList<>();
      lines.add(con.tag());
      for (Value child : con.children()) {
        indent(lines, argument(child, column + 2), "  ", "  ");
      }
      return lines;
    }
    if (value instanceof Value.RecNode record) {
      final List<List<String>> items = new ArrayList<>();
      final int inner = record.label().isEmpty() ? column + 2 : column + 4;
      for (Value.Field field : record.fields()) {
        items.add(field(field, inner));
      }
      final var block = block('{', '}', items);
      if (record.label().isEmpty()) {
        return block;
      }
      final List<String> lines = new ArrayList<>();
      lines.add(record.label());
      indent(lines, block, "  ", "  ");
      return lines;
    }
    final List<Value> items = value instanceof Value.ListNode list ? list.items() : ((Value.TupleNode) value).items();
    final List<List<String>> laidOut = new ArrayList<>();
    for (Value item : items) {
      laidOut.add(layout(item, column + 2));
    }
    return value instanceof Value.ListNode ? block('[', ']', laidOut) : block('(', ')', laidOut);
  }

  /// A constructor argument, parenthesised when it is itself an applied constructor
  private List<String> argument(Value value, int column) {
    if (!isApplication(value)) {
      return layout(value, column);
    }
    final var inner = layout(value, column + 1);
    final List<String> lines = new ArrayList<>();
    indent(lines, inner, "(", " ");
    final int last = lines.size() - 1;
    lines.set(last, lines.get(last) + ")");
    return lines;
  }

  private List<String> field(Value.Field field, int column) {
    final var head = field.name() + " =";
    final var flat = flat(field.value(), width - column - head.length() - 1);
    if (flat != null) {
      return List.of(head + " " + flat);
    }
    final List<String> lines = new ArrayList<>();
    lines.add(head);
    indent(lines, layout(field.value(), column + 4), "    ", "    ");
    return lines;
  }

  private static List<String> block(char open, char close, List<List<String>> items) {
    if (items.isEmpty()) {
      return List.of(String.valueOf(open) + close);
    }
    final List<String> lines = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      indent(lines, items.get(i), i == 0 ? open + " " : ", ", "  ");
    }
    lines.add(String.valueOf(close));
    return lines;
  }

  private static void indent(List<String> into, List<String> lines, String first, String rest) {
    for (int i = 0; i < lines.size(); i++) {
      into.add((i == 0 ? first : rest) + lines.get(i));
    }
  }

  private static boolean isApplication(Value value) {
    return value instanceof Value.ConNode con && !con.children().isEmpty();
  }

  /// The single line form of the value, or null if it does not fit in the budget
  private static String flat(Value value, int budget) {
    if (budget <= 0) {
      return null;
    }
    final var out = new StringBuilder();
    return appendFlat(out, value, budget) ? out.toString() : null;
  }

  private static boolean appendFlat(StringBuilder out, Value value, int budget) {
    if (value instanceof Value.LeafNode leaf) {
      if (leaf.text().indexOf('\n') >= 0) {
        return false;
      }
      out.append(leaf.text());
    } else if (value instanceof Value.ConNode con) {
      out.append(con.tag());
      for (Value child : con.children()) {
        out.append(' ');
        if (isApplication(child)) {
          out.append('(');
          if (!appendFlat(out, child, budget)) {
            return false;
          }
          out.append(')');
        } else if (!appendFlat(out, child, budget)) {
          return false;
        }
      }
    } else if (value instanceof Value.RecNode record) {
      if (!record.label().isEmpty()) {
        out.append(record.label()).append(' ');
      }
      if (record.fields().isEmpty()) {
        out.append("{}");
      } else {
        for (int i = 0; i < record.fields().size(); i++) {
          final var field = record.fields().get(i);
          out.append(i == 0 ? "{ " : " , ").append(field.name()).append(" = ");
          if (!appendFlat(out, field.value(), budget)) {
            return false;
          }
        }
        out.append(" }");
      }
    } else {
      final boolean isList = value instanceof Value.ListNode;
      final List<Value> items = isList ? ((Value.ListNode) value).items() : ((Value.TupleNode) value).items();
      if (items.isEmpty()) {
        out.append(isList ? "[]" : "()");
      } else {
        for (int i = 0; i < items.size(); i++) {
          out.append(i == 0 ? (isList ? "[ " : "( ") : " , ");
          if (!appendFlat(out, items.get(i), budget)) {
            return false;
          }
        }
        out.append(isList ? " ]" : " )");
      }
    }
    return out.length() <= budget;
  }
}
