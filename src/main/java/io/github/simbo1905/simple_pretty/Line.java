// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// One output line built up from fragments. The cell width is kept up to date on every append so that
/// checking the line against the width budget never re-measures text already on the line.
/// This class is not thread safe.
final class Line {

  final List<String> parts = new ArrayList<>();
  final CellWidth cellWidth;
  int cells = 0;

  Line(CellWidth cellWidth) {
    this.cellWidth = Objects.requireNonNull(cellWidth, "cellWidth cannot be null");
  }

  void append(String text) {
    parts.add(text);
    cells += cellWidth.widthOf(text);
  }

  /// Total width of everything appended
  int cells() {
    return cells;
  }

  /// Width used for overflow checks: a single trailing space is not counted so that the space
  /// following a separator can never be what pushes a line over budget.
  int effectiveCells() {
    if (parts.isEmpty()) {
      return 0;
    }
    return parts.get(parts.size() - 1).endsWith(" ") ? cells - cellWidth.widthOf(" ") : cells;
  }

  String text() {
    return String.join("", parts);
  }

  @Override
  public String toString() {
    return "Line{cells=" + cells + ", text='" + text() + "'}";
  }
}
