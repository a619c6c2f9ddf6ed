// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.AbstractCollection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/// An unordered collection of syntax tree nodes. Iteration order is insertion order but carries no meaning.
public final class Bag<T> extends AbstractCollection<T> {
  private static final Bag<?> EMPTY = new Bag<>(List.of());

  private final List<T> elements;

  private Bag(List<T> elements) {
    this.elements = elements;
  }

  @SuppressWarnings("unchecked")
  public static <T> Bag<T> emptyBag() {
    return (Bag<T>) EMPTY;
  }

  public static <T> Bag<T> unitBag(T element) {
    final var elements = new ArrayList<T>(1);
    elements.add(element);
    return new Bag<>(elements);
  }

  public static <T> Bag<T> listToBag(Collection<? extends T> elements) {
    return new Bag<>(new ArrayList<>(elements));
  }

  @Override
  public Iterator<T> iterator() {
    return Collections.unmodifiableList(elements).iterator();
  }

  @Override
  public int size() {
    return elements.size();
  }
}
