// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// The lines of one traversal attempt. A fresh document is started for every attempt and only the
/// document of the accepted attempt is ever assembled into text.
final class Document {

  final List<Line> lines = new ArrayList<>();
  final CellWidth cellWidth;

  Document(CellWidth cellWidth) {
    this.cellWidth = Objects.requireNonNull(cellWidth, "cellWidth cannot be null");
    newLine();
  }

  Line current() {
    return lines.get(lines.size() - 1);
  }

  Line newLine() {
    final var line = new Line(cellWidth);
    lines.add(line);
    return line;
  }

  int lineCount() {
    return lines.size();
  }

  List<String> texts() {
    return lines.stream().map(Line::text).collect(Collectors.toList());
  }

  /// The widest line in cells. This is the size hint offered to a host display surface.
  int width() {
    return lines.stream().mapToInt(Line::cells).max().orElse(0);
  }

  String text() {
    return lines.stream().map(Line::text).collect(Collectors.joining("\n"));
  }
}
