// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// The rendered result: plain text with explicit line breaks, the width of its widest line,
/// any highlight spans, and the display hints to pass on to whatever prints it.
public record PrettyText(String plain,
                         int width,
                         List<Highlighter.Span> spans,
                         Optional<OverflowMethod> overflow,
                         boolean noWrap) {

  public PrettyText {
    Objects.requireNonNull(plain, "plain text cannot be null");
    Objects.requireNonNull(spans, "spans cannot be null");
    Objects.requireNonNull(overflow, "overflow cannot be null");
    spans = List.copyOf(spans);
    for (Highlighter.Span span : spans) {
      if (span.end() > plain.length()) {
        throw new IllegalArgumentException("Span " + span + " is beyond the end of the text of length " + plain.length());
      }
    }
  }

  public List<String> lines() {
    return List.of(plain.split("\n", -1));
  }

  @Override
  public String toString() {
    return plain;
  }
}
