// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.*;

/// A value in the tree being rendered: either one of the five container kinds or an opaque leaf.
/// Nodes are created one level at a time as the renderer descends so that cyclic structures never
/// have to be materialised.
public sealed interface Node permits Node.Container, Node.Leaf {

  /// The underlying value. Its identity is what the cycle guard and the leaf cache key on.
  Object value();

  /// An opaque value rendered through the leaf formatter and never recursed into
  record Leaf(Object value) implements Node {
  }

  /// A value whose entries are laid out between the tokens of its kind
  record Container(ContainerKind kind, Object value) implements Node {
    public Container {
      Objects.requireNonNull(kind, "Container kind cannot be null");
      Objects.requireNonNull(value, "Container value cannot be null");
    }

    /// The entries in iteration order. Only this level is materialised; nested values are not classified.
    public List<Entry> entries() {
      if (value instanceof Object[] array) {
        final var entries = new ArrayList<Entry>(array.length);
        for (Object element : array) {
          entries.add(Entry.of(element));
        }
        return entries;
      }
      if (kind.isMapping()) {
        final Map<?, ?> map = (Map<?, ?>) value;
        final var entries = new ArrayList<Entry>(map.size());
        map.forEach((key, element) -> entries.add(Entry.of(key, element)));
        return entries;
      }
      final Collection<?> collection = (Collection<?>) value;
      final var entries = new ArrayList<Entry>(collection.size());
      for (Object element : collection) {
        entries.add(Entry.of(element));
      }
      return entries;
    }

    public boolean isEmpty() {
      if (value instanceof Object[] array) {
        return array.length == 0;
      }
      return kind.isMapping() ? ((Map<?, ?>) value).isEmpty() : ((Collection<?>) value).isEmpty();
    }
  }

  /// One entry of a container. Mapping entries carry a key, which is only ever leaf formatted.
  record Entry(boolean keyed, Object key, Object value) {
    static Entry of(Object value) {
      return new Entry(false, null, value);
    }

    static Entry of(Object key, Object value) {
      return new Entry(true, key, value);
    }
  }
}
