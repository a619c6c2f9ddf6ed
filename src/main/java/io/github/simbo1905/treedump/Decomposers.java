// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import io.github.simbo1905.treedump.frontend.DumpAs;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.simbo1905.treedump.TreeDump.LOGGER;

/// Builds and caches, per runtime class, the function that splits a value into its {@link Shape}.
final class Decomposers {

  /// Splits one value of a known class
  @FunctionalInterface
  interface Decomposer {
    Shape decompose(Object value);
  }

  private static final ClassValue<Decomposer> CACHE = new ClassValue<>() {
    @Override
    protected Decomposer computeValue(Class<?> type) {
      LOGGER.finer(() -> "Computing decomposer for " + type.getName());
      return decomposerFor(type);
    }
  };

  private Decomposers() {
  }

  static Decomposer forClass(Class<?> type) {
    return CACHE.get(type);
  }

  static Decomposer decomposerFor(Class<?> type) {
    if (type == Boolean.class) {
      return value -> new Shape.Atom((Boolean) value ? Tags.TRUE : Tags.FALSE);
    }
    if (Number.class.isAssignableFrom(type)) {
      return value -> new Shape.Atom(value.toString());
    }
    if (type == Character.class) {
      return value -> new Shape.Atom("'" + escape(value.toString(), '\'') + "'");
    }
    if (CharSequence.class.isAssignableFrom(type)) {
      return value -> new Shape.Atom(quote(value.toString()));
    }
    if (Enum.class.isAssignableFrom(type)) {
      return value -> new Shape.Atom(((Enum<?>) value).name());
    }
    if (type.isRecord()) {
      return recordDecomposer(type);
    }
    if (type.isArray()) {
      return value -> {
        final int length = Array.getLength(value);
        final List<Shape.Child> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
          final int index = i;
          elements.add(() -> Array.get(value, index));
        }
        return new Shape.Sequence(elements);
      };
    }
    if (List.class.isAssignableFrom(type)) {
      return value -> sequence(((List<?>) value).toArray());
    }
    if (Collection.class.isAssignableFrom(type)) {
      final var tag = Tags.BAG_PREFIX + "(" + tagOf(type) + ")}";
      return value -> new Shape.Constructor(tag, List.of(() -> new ArrayList<>((Collection<?>) value)));
    }
    if (Map.class.isAssignableFrom(type)) {
      return value -> new Shape.Constructor(Tags.MAP, List.of(() -> new ArrayList<>(((Map<?, ?>) value).entrySet())));
    }
    if (Map.Entry.class.isAssignableFrom(type)) {
      return value -> {
        final var entry = (Map.Entry<?, ?>) value;
        return new Shape.Constructor(Tags.PAIR, List.of(entry::getKey, entry::getValue));
      };
    }
    if (type == Optional.class) {
      return value -> {
        final var optional = (Optional<?>) value;
        return optional.isPresent()
            ? new Shape.Constructor("Optional.of", List.of(optional::get))
            : new Shape.Atom("Optional.empty");
      };
    }
    if (isPlatformClass(type)) {
      return value -> new Shape.Atom(quote(value.toString()));
    }
    return fieldDecomposer(type);
  }

  static Decomposer recordDecomposer(Class<?> type) {
    final var tag = tagOf(type);
    final RecordComponent[] components = type.getRecordComponents();
    final MethodHandle[] accessors = Arrays.stream(components)
        .map(component -> accessor(type, component))
        .toArray(MethodHandle[]::new);
    return value -> {
      final List<Shape.Child> children = new ArrayList<>(accessors.length);
      for (MethodHandle accessor : accessors) {
        children.add(() -> invoke(accessor, value));
      }
      return new Shape.Constructor(tag, children);
    };
  }

  static Decomposer fieldDecomposer(Class<?> type) {
    final var tag = tagOf(type);
    final Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      hierarchy.push(c);
    }
    final List<Field> fields = new ArrayList<>();
    for (Class<?> c : hierarchy) {
      for (Field field : c.getDeclaredFields()) {
        final int modifiers = field.getModifiers();
        if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
          continue;
        }
        field.setAccessible(true);
        fields.add(field);
      }
    }
    LOGGER.finer(() -> "Decomposing " + type.getName() + " by its " + fields.size() + " fields");
    return value -> {
      final List<Shape.Child> children = new ArrayList<>(fields.size());
      for (Field field : fields) {
        children.add(() -> field.get(value));
      }
      return new Shape.Constructor(tag, children);
    };
  }

  /// The constructor tag of a class: its {@link DumpAs} name, otherwise its simple name
  static String tagOf(Class<?> type) {
    final DumpAs dumpAs = type.getAnnotation(DumpAs.class);
    if (dumpAs != null) {
      return dumpAs.value();
    }
    final var simpleName = type.getSimpleName();
    if (!simpleName.isEmpty()) {
      return simpleName;
    }
    final var name = type.getName();
    return name.substring(name.lastIndexOf('.') + 1);
  }

  /// A Java string literal for the text
  static String quote(String text) {
    return '"' + escape(text, '"') + '"';
  }

  private static String escape(String text, char delimiter) {
    final var escaped = new StringBuilder(text.length() + 2);
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      switch (c) {
        case '\\' -> escaped.append("\\\\");
        case '\n' -> escaped.append("\\n");
        case '\r' -> escaped.append("\\r");
        case '\t' -> escaped.append("\\t");
        default -> {
          if (c == delimiter) {
            escaped.append('\\').append(c);
          } else if (c < 0x20 || c == 0x7f) {
            escaped.append(String.format("\\u%04x", (int) c));
          } else {
            escaped.append(c);
          }
        }
      }
    }
    return escaped.toString();
  }

  private static Shape sequence(Object[] items) {
    final List<Shape.Child> elements = new ArrayList<>(items.length);
    for (Object item : items) {
      elements.add(() -> item);
    }
    return new Shape.Sequence(elements);
  }

  /// Classes of the JDK itself, whose fields are not ours to read
  private static boolean isPlatformClass(Class<?> type) {
    final var packageName = type.getPackageName();
    if (packageName.startsWith("java.") || packageName.startsWith("javax.")) {
      return true;
    }
    final var module = type.getModule();
    return module.isNamed() && (module.getName().startsWith("java.") || module.getName().startsWith("jdk."));
  }

  private static MethodHandle accessor(Class<?> type, RecordComponent component) {
    final var method = component.getAccessor();
    try {
      return MethodHandles.lookup().unreflect(method);
    } catch (IllegalAccessException notPublic) {
      try {
        method.setAccessible(true);
        return MethodHandles.lookup().unreflect(method);
      } catch (IllegalAccessException | RuntimeException e) {
        throw new IllegalStateException("Cannot access component " + component.getName() + " of " + type, e);
      }
    }
  }

  private static Object invoke(MethodHandle accessor, Object target) throws Exception {
    try {
      return accessor.invoke(target);
    } catch (Exception | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException(t);
    }
  }
}
