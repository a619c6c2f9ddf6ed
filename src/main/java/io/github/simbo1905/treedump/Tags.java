// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

/// Constructor tags with a meaning shared between the converter, the cleanup pass and the JSON sink.
final class Tags {
  static final String NIL = "[]";
  static final String CONS = "(:)";
  static final String PAIR = "(,)";
  static final String TRUE = "True";
  static final String FALSE = "False";
  static final String NULL = "null";
  static final String MAP = "fromList";
  static final String BAG_PREFIX = "{abstract:Bag";
  static final String BAG_FROM_LIST = "Bag.listToBag";
  static final String LOCATED = "L";
  static final String LOCATION_KEY = "location";
  static final String NOT_AVAILABLE = "<<NOT AVAILABLE>>";

  private Tags() {
  }

  /// True for `()`, `(,)`, `(,,)` and so on
  static boolean isTuple(String tag) {
    if (tag.length() < 2 || tag.charAt(0) != '(' || tag.charAt(tag.length() - 1) != ')') {
      return false;
    }
    for (int i = 1; i < tag.length() - 1; i++) {
      if (tag.charAt(i) != ',') {
        return false;
      }
    }
    return true;
  }
}
