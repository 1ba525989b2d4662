// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.List;
import java.util.Objects;

/// Styles rendered text. A highlighter only describes regions of the plain text; it never changes the text or its
/// line breaks. Null spans and spans reaching past the end of the text are dropped when the text is assembled.
@FunctionalInterface
public interface Highlighter {

  List<Span> highlight(String plain);

  /// No styling at all
  Highlighter NONE = plain -> List.of();

  /// A styled region `[start, end)` of the plain text
  record Span(int start, int end, String style) {
    public Span {
      Objects.requireNonNull(style, "style cannot be null");
      if (start < 0 || end < start) {
        throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
      }
    }
  }
}
