// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/// Mutable state of a single traversal attempt. Created fresh for every expansion level so nothing
/// from an aborted attempt leaks into the next one; only the leaf cache outlives it.
final class RenderContext {

  final int expandLevel;
  /// Negative when the width budget is not being enforced
  final int budget;
  final Document document;
  final Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());

  RenderContext(int expandLevel, int budget, CellWidth cellWidth) {
    this.expandLevel = expandLevel;
    this.budget = budget;
    this.document = new Document(cellWidth);
  }

  boolean expanded(int depth) {
    return depth < expandLevel;
  }

  /// Appends to the current line.
  /// @return the overflow if the line is now over budget, otherwise null
  Attempt.Overflow append(String text, int depth) {
    final Line line = document.current();
    line.append(text);
    if (budget >= 0 && line.effectiveCells() > budget) {
      return new Attempt.Overflow(depth, document.lineCount());
    }
    return null;
  }

  void newLine() {
    document.newLine();
  }
}
