// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.*;

/// Exact-class lookup table deciding which runtime classes are containers.
/// Matching is on the exact class of a value: a subclass of `ArrayList` is not a `LIST`, it is a leaf
/// rendered through its own text representation. The only structural rule is that arrays of a reference
/// component type are `TUPLE`s; arrays of primitives are leaves.
public record ContainerKinds(Map<Class<?>, ContainerKind> exactClasses) {

  /// The built-in table assembled from the classes declared on each [ContainerKind]
  public static final ContainerKinds DEFAULT = new ContainerKinds(declaredClasses());

  /// @throws IllegalArgumentException if a class cannot supply the entries of the kind it is mapped to
  public ContainerKinds {
    Objects.requireNonNull(exactClasses, "exactClasses cannot be null");
    exactClasses = Map.copyOf(exactClasses);
    exactClasses.forEach(ContainerKinds::checkCompatible);
  }

  static void checkCompatible(Class<?> clazz, ContainerKind kind) {
    if (clazz.isPrimitive() || clazz.isInterface()) {
      throw new IllegalArgumentException("Only concrete classes can be registered as containers: " + clazz.getName());
    }
    final Class<?> required = kind.isMapping() ? Map.class : Collection.class;
    if (!required.isAssignableFrom(clazz)) {
      throw new IllegalArgumentException(kind + " entries can only be read from a " + required.getSimpleName()
          + " but got: " + clazz.getName());
    }
  }

  static Map<Class<?>, ContainerKind> declaredClasses() {
    final Map<Class<?>, ContainerKind> classes = new HashMap<>();
    for (ContainerKind kind : ContainerKind.values()) {
      for (Class<?> clazz : kind.supportedClasses) {
        classes.putIfAbsent(clazz, kind);
      }
    }
    return classes;
  }

  /// Returns a copy of this table that also recognises `clazz` (exactly) as `kind`
  public ContainerKinds with(Class<?> clazz, ContainerKind kind) {
    Objects.requireNonNull(clazz, "clazz cannot be null");
    Objects.requireNonNull(kind, "kind cannot be null");
    final var copy = new HashMap<>(exactClasses);
    copy.put(clazz, kind);
    return new ContainerKinds(copy);
  }

  /// Returns a copy of this table in which `clazz` is a leaf
  public ContainerKinds without(Class<?> clazz) {
    Objects.requireNonNull(clazz, "clazz cannot be null");
    final var copy = new HashMap<>(exactClasses);
    copy.remove(clazz);
    return new ContainerKinds(copy);
  }

  /// The kind of `clazz` or empty when values of that class are leaves
  public Optional<ContainerKind> kindOf(Class<?> clazz) {
    if (clazz.isArray()) {
      return clazz.getComponentType().isPrimitive() ? Optional.empty() : Optional.of(ContainerKind.TUPLE);
    }
    return Optional.ofNullable(exactClasses.get(clazz));
  }

  /// Classify a value into the closed leaf/container variant
  public Node classify(Object value) {
    if (value == null) {
      return new Node.Leaf(null);
    }
    final ContainerKind kind = exactClasses.get(value.getClass());
    if (kind != null) {
      return new Node.Container(kind, value);
    }
    if (value instanceof Object[]) {
      return new Node.Container(ContainerKind.TUPLE, value);
    }
    return new Node.Leaf(value);
  }
}
