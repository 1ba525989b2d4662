// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import org.jetbrains.annotations.TestOnly;

import java.util.*;

import static io.github.simbo1905.simple_pretty.PrettyPrinter.LOGGER;

/// The layout engine for one top level call. The whole tree is rendered at expansion level zero, which puts
/// everything on one line. Whenever a line goes over the width budget the attempt is abandoned and the tree is
/// rendered again from scratch with one more level of containers broken out one entry per line.
///
/// Containers nested shallower than the expansion level are expanded. Once the level reaches the container depth
/// of the tree every container is expanded and going further cannot change anything, so that final attempt is
/// rendered without enforcing the budget and accepted as the best available layout. A tree of container depth
/// `D` is therefore rendered at most `D + 1` times.
///
/// The leaf cache lives as long as this object and is shared by every attempt. The visited path and the document
/// belong to a [RenderContext] that is thrown away with each abandoned attempt.
final class Renderer {

  static final String ELLIPSIS = "...";
  static final String COLON = ": ";
  static final String INLINE_SEPARATOR = ", ";
  static final String EXPANDED_SEPARATOR = ",";

  final Object root;
  final PrettyOptions options;
  final ContainerKinds kinds;
  final ReprCache reprCache;
  final List<String> indents = new ArrayList<>();

  int attempts = 0;

  Renderer(Object root, PrettyOptions options) {
    this.root = root;
    this.options = Objects.requireNonNull(options, "options cannot be null");
    this.kinds = options.kinds();
    this.reprCache = new ReprCache(options.leafFormatter());
  }

  /// Runs the expansion loop until an attempt fits. A tree nested too deeply for the thread stack is shown as
  /// a single leaf placeholder.
  Document render() {
    try {
      return expand();
    } catch (StackOverflowError error) {
      LOGGER.fine(() -> "Nesting of " + describe(root) + " exceeded the stack after " + attempts + " attempt(s)");
      final var document = new Document(options.cellWidth());
      document.current().append(ReprCache.placeholder(error));
      return document;
    }
  }

  Document expand() {
    final int maxWidth = options.maxWidth().orElse(-1);
    final int deepest = maxWidth < 0 ? 0 : containerDepth(root, Collections.newSetFromMap(new IdentityHashMap<>()));
    LOGGER.fine(() -> "Rendering " + describe(root) + " maxWidth=" + (maxWidth < 0 ? "NONE" : maxWidth)
        + " containerDepth=" + deepest);

    int level = 0;
    while (true) {
      final int budget = level < deepest ? maxWidth : -1;
      final Attempt attempt = attempt(level, budget);
      if (attempt instanceof Attempt.Fits fits) {
        final int acceptedLevel = level;
        LOGGER.fine(() -> "Accepted expansion level " + acceptedLevel + " after " + attempts + " attempt(s) with "
            + fits.document().lineCount() + " line(s)");
        return fits.document();
      }
      final Attempt.Overflow overflow = (Attempt.Overflow) attempt;
      final int failedLevel = level;
      LOGGER.fine(() -> "Expansion level " + failedLevel + " overflowed on line " + overflow.line()
          + " at depth " + overflow.depth());
      level++;
    }
  }

  /// One traversal at a fixed expansion level. A negative budget disables the width check.
  Attempt attempt(int expandLevel, int budget) {
    attempts++;
    final var context = new RenderContext(expandLevel, budget, options.cellWidth());
    final Attempt.Overflow overflow = traverse(context, root, 0);
    return overflow == null ? new Attempt.Fits(context.document) : overflow;
  }

  /// @return null when everything rendered so far is within budget
  Attempt.Overflow traverse(RenderContext context, Object value, int depth) {
    final Node node = kinds.classify(value);
    if (node instanceof Node.Leaf leaf) {
      return context.append(reprCache.repr(leaf.value()), depth);
    }
    final Node.Container container = (Node.Container) node;
    if (context.visited.contains(value)) {
      final ContainerKind kind = container.kind();
      return context.append(kind.open() + ELLIPSIS + kind.close(), depth);
    }
    if (container.isEmpty()) {
      return context.append(container.kind().empty(), depth);
    }
    context.visited.add(value);
    final Attempt.Overflow overflow = traverseEntries(context, container, depth);
    context.visited.remove(value);
    return overflow;
  }

  Attempt.Overflow traverseEntries(RenderContext context, Node.Container container, int depth) {
    final ContainerKind kind = container.kind();
    final boolean expanded = context.expanded(depth);

    Attempt.Overflow overflow = context.append(kind.open(), depth);
    if (overflow != null) {
      return overflow;
    }

    final List<Node.Entry> entries = container.entries();
    final int last = entries.size() - 1;
    for (int i = 0; i <= last; i++) {
      final Node.Entry entry = entries.get(i);
      if (expanded) {
        context.newLine();
        overflow = context.append(indent(depth + 1), depth);
        if (overflow != null) {
          return overflow;
        }
      }
      if (entry.keyed()) {
        // keys are never recursed into
        overflow = context.append(reprCache.repr(entry.key()), depth);
        if (overflow == null) {
          overflow = context.append(COLON, depth);
        }
        if (overflow != null) {
          return overflow;
        }
      }
      overflow = traverse(context, entry.value(), depth + 1);
      if (overflow != null) {
        return overflow;
      }
      final String separator = separator(expanded, i == last);
      if (separator != null) {
        overflow = context.append(separator, depth);
        if (overflow != null) {
          return overflow;
        }
      }
    }

    if (expanded) {
      context.newLine();
      return context.append(indent(depth) + kind.close(), depth);
    }
    return context.append(kind.close(), depth);
  }

  String separator(boolean expanded, boolean last) {
    if (!last) {
      return expanded ? EXPANDED_SEPARATOR : INLINE_SEPARATOR;
    }
    return expanded && options.trailingSeparator() ? EXPANDED_SEPARATOR : null;
  }

  String indent(int level) {
    while (indents.size() <= level) {
      indents.add(" ".repeat(options.indentSize() * indents.size()));
    }
    return indents.get(level);
  }

  /// Number of container levels that expanding can break apart. Leaves, empty containers and
  /// back references to a container already on the path contribute nothing.
  int containerDepth(Object value, Set<Object> path) {
    final Node node = kinds.classify(value);
    if (!(node instanceof Node.Container container) || container.isEmpty() || path.contains(value)) {
      return 0;
    }
    path.add(value);
    int deepest = 0;
    for (Node.Entry entry : container.entries()) {
      deepest = Math.max(deepest, containerDepth(entry.value(), path));
    }
    path.remove(value);
    return deepest + 1;
  }

  static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }

  @TestOnly
  int attempts() {
    return attempts;
  }
}
