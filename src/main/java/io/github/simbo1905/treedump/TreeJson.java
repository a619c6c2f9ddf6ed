// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/// Renders cleaned trees as JSON for machine consumption.
///
/// Constructors become single key objects `{"Tag": [children]}` or plain strings when they have no children,
/// booleans become JSON booleans, bags disappear into their element list and a located node carries its span
/// under a `location` key. A location wrapped around anything but an object is dropped.
public final class TreeJson {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

  private TreeJson() {
  }

  /// @throws TreeInvariantException for a record with a non-empty label
  public static JsonNode toJson(Value value) {
    if (value instanceof Value.LeafNode leaf) {
      return NODES.textNode(leaf.text());
    }
    if (value instanceof Value.TupleNode tuple) {
      return array(tuple.items());
    }
    if (value instanceof Value.ListNode list) {
      return array(list.items());
    }
    if (value instanceof Value.RecNode record) {
      if (!record.label().isEmpty()) {
        throw new TreeInvariantException("Cannot render record labelled '" + record.label() + "' as JSON");
      }
      final ObjectNode object = NODES.objectNode();
      for (Value.Field field : record.fields()) {
        object.set(field.name(), toJson(field.value()));
      }
      return object;
    }
    final var con = (Value.ConNode) value;
    final var children = con.children();
    if (children.isEmpty() && Tags.FALSE.equals(con.tag())) {
      return NODES.booleanNode(false);
    }
    if (children.isEmpty() && Tags.TRUE.equals(con.tag())) {
      return NODES.booleanNode(true);
    }
    if (children.size() == 1 && Tags.BAG_FROM_LIST.equals(con.tag())) {
      return toJson(children.get(0));
    }
    if (children.size() == 2 && Tags.LOCATED.equals(con.tag())) {
      final var located = toJson(children.get(1));
      if (located instanceof ObjectNode object) {
        object.set(Tags.LOCATION_KEY, toJson(children.get(0)));
      }
      return located;
    }
    if (children.isEmpty()) {
      return NODES.textNode(con.tag());
    }
    final ObjectNode object = NODES.objectNode();
    object.set(con.tag(), array(children));
    return object;
  }

  /// One object with the keys `module`, `parsed`, `renamed`, `typechecked` and `exports`
  public static ObjectNode toJson(Trees trees) {
    final ObjectNode object = NODES.objectNode();
    object.put("module", trees.module());
    object.set("parsed", toJson(trees.parsed()));
    object.set("renamed", toJson(trees.renamed()));
    object.set("typechecked", toJson(trees.typechecked()));
    object.set("exports", toJson(trees.exports()));
    return object;
  }

  public static ArrayNode toJson(List<Trees> units) {
    final ArrayNode array = NODES.arrayNode();
    units.forEach(trees -> array.add(toJson(trees)));
    return array;
  }

  /// Writes the units as one compact JSON array. The stream is flushed but left open.
  public static void write(List<Trees> units, OutputStream out) throws IOException {
    MAPPER.writeValue(out, toJson(units));
  }

  private static ArrayNode array(List<Value> values) {
    final ArrayNode array = NODES.arrayNode();
    values.forEach(value -> array.add(toJson(value)));
    return array;
  }
}
