// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.simple_pretty.PrettyPrinter.LOGGER;

/// Runs a fresh [Renderer] per call and assembles its document into a [PrettyText]
record PrettyPrinterImpl(PrettyOptions options) implements PrettyPrinter {

  PrettyPrinterImpl {
    Objects.requireNonNull(options, "options cannot be null");
  }

  @Override
  public PrettyText render(Object value) {
    final Document document = new Renderer(value, options).render();
    return assemble(document);
  }

  PrettyText assemble(Document document) {
    final String plain = document.text();
    return new PrettyText(plain, document.width(), spans(plain), options.overflow(), options.noWrap());
  }

  /// Highlighter output restricted to spans that lie within `plain`
  List<Highlighter.Span> spans(String plain) {
    final List<Highlighter.Span> spans = options.highlighter().highlight(plain);
    if (spans == null) {
      return List.of();
    }
    final List<Highlighter.Span> valid = new ArrayList<>(spans.size());
    for (Highlighter.Span span : spans) {
      if (span != null && span.end() <= plain.length()) {
        valid.add(span);
      } else {
        LOGGER.fine(() -> "Dropping highlight span " + span + " for text of length " + plain.length());
      }
    }
    return valid;
  }
}
