// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/// The five container kinds that are laid out structurally. Anything else is a leaf.
/// Each kind carries its opening token, closing token and the token used when it is empty,
/// along with the exact classes that are recognised as that kind by default.
public enum ContainerKind {
  MAP("{", "}", "{}",
      HashMap.class, LinkedHashMap.class, TreeMap.class, ConcurrentHashMap.class,
      Map.of().getClass(), Map.of(0, 0).getClass(), Map.of(0, 0, 1, 1).getClass(),
      Collections.unmodifiableMap(new HashMap<>()).getClass(),
      Collections.unmodifiableMap(new TreeMap<>()).getClass(),
      Collections.emptyMap().getClass()),
  FROZEN_SET("frozenset({", "})", "frozenset()",
      Set.of().getClass(), Set.of(0).getClass(), Set.of(0, 1, 2).getClass(),
      Collections.unmodifiableSet(new HashSet<>()).getClass(),
      Collections.unmodifiableSortedSet(new TreeSet<>()).getClass(),
      Collections.emptySet().getClass()),
  LIST("[", "]", "[]",
      ArrayList.class, LinkedList.class),
  SET("{", "}", "set()",
      HashSet.class, LinkedHashSet.class, TreeSet.class),
  // reference arrays are matched by ContainerKinds before the class table is consulted
  TUPLE("(", ")", "tuple()",
      List.of().getClass(), List.of(0).getClass(), List.of(0, 1, 2).getClass(),
      Arrays.asList().getClass(),
      Collections.unmodifiableList(new ArrayList<>()).getClass(),
      Collections.unmodifiableList(new LinkedList<>()).getClass(),
      Collections.emptyList().getClass());

  final String open;
  final String close;
  final String empty;
  final Class<?>[] supportedClasses;

  ContainerKind(String open, String close, String empty, Class<?>... classes) {
    Objects.requireNonNull(open);
    Objects.requireNonNull(close);
    Objects.requireNonNull(empty);
    Objects.requireNonNull(classes);
    this.open = open;
    this.close = close;
    this.empty = empty;
    this.supportedClasses = classes;
  }

  public String open() {
    return open;
  }

  public String close() {
    return close;
  }

  public String empty() {
    return empty;
  }

  /// Whether entries of this kind are key/value pairs
  public boolean isMapping() {
    return this == MAP;
  }
}
