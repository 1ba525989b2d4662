// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import static io.github.simbo1905.simple_pretty.PrettyPrinter.LOGGER;

/// Settings for a [PrettyPrinter]. Immutable; the `with` methods return modified copies.
///
/// [#DEFAULTS] can be adjusted with system properties:
/// - `simple.pretty.maxWidth` an integer or `NONE` for no limit (default `80`)
/// - `simple.pretty.indentSize` spaces per nesting level (default `4`)
/// - `simple.pretty.trailingSeparator` put a separator after the last entry of an expanded container (default `false`)
///
/// @param maxWidth          the width budget in cells; empty means everything goes on one line
/// @param indentSize        spaces per level of nesting in expanded containers
/// @param highlighter       styles the final text
/// @param overflow          display hint for lines that still do not fit; empty leaves it to the display
/// @param noWrap            display hint that lines must not be word wrapped (on in the defaults)
/// @param trailingSeparator whether the last entry of an expanded container is also followed by a separator
/// @param cellWidth         measures text in terminal cells
/// @param leafFormatter     produces the text of values that are not containers
/// @param kinds             decides which classes are containers
public record PrettyOptions(OptionalInt maxWidth,
                            int indentSize,
                            Highlighter highlighter,
                            Optional<OverflowMethod> overflow,
                            boolean noWrap,
                            boolean trailingSeparator,
                            CellWidth cellWidth,
                            LeafFormatter leafFormatter,
                            ContainerKinds kinds) {

  public static final String MAX_WIDTH_PROPERTY = "simple.pretty.maxWidth";
  public static final String INDENT_SIZE_PROPERTY = "simple.pretty.indentSize";
  public static final String TRAILING_SEPARATOR_PROPERTY = "simple.pretty.trailingSeparator";

  public static final int DEFAULT_MAX_WIDTH = 80;
  public static final int DEFAULT_INDENT_SIZE = 4;

  public static final PrettyOptions DEFAULTS = fromSystemProperties();

  public PrettyOptions {
    Objects.requireNonNull(maxWidth, "maxWidth cannot be null, use OptionalInt.empty() for no limit");
    Objects.requireNonNull(highlighter, "highlighter cannot be null");
    Objects.requireNonNull(overflow, "overflow cannot be null");
    Objects.requireNonNull(cellWidth, "cellWidth cannot be null");
    Objects.requireNonNull(leafFormatter, "leafFormatter cannot be null");
    Objects.requireNonNull(kinds, "kinds cannot be null");
    if (maxWidth.isPresent() && maxWidth.getAsInt() < 0) {
      throw new IllegalArgumentException("maxWidth must not be negative: " + maxWidth.getAsInt());
    }
    if (indentSize <= 0) {
      throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
    }
  }

  static PrettyOptions fromSystemProperties() {
    final String maxWidthValue = System.getProperty(MAX_WIDTH_PROPERTY, String.valueOf(DEFAULT_MAX_WIDTH));
    final OptionalInt maxWidth = "NONE".equalsIgnoreCase(maxWidthValue.trim())
        ? OptionalInt.empty()
        : OptionalInt.of(Integer.parseInt(maxWidthValue.trim()));
    final int indentSize = Integer.parseInt(
        System.getProperty(INDENT_SIZE_PROPERTY, String.valueOf(DEFAULT_INDENT_SIZE)).trim());
    final boolean trailingSeparator = Boolean.parseBoolean(System.getProperty(TRAILING_SEPARATOR_PROPERTY, "false"));
    final var options = new PrettyOptions(maxWidth, indentSize, Highlighter.NONE, Optional.empty(), true,
        trailingSeparator, CellWidth.DEFAULT, Repr.INSTANCE, ContainerKinds.DEFAULT);
    LOGGER.fine(() -> "Default options maxWidth=" + (maxWidth.isPresent() ? maxWidth.getAsInt() : "NONE")
        + " indentSize=" + indentSize + " trailingSeparator=" + trailingSeparator);
    return options;
  }

  public PrettyOptions withMaxWidth(int maxWidth) {
    return new PrettyOptions(OptionalInt.of(maxWidth), indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  /// No width budget: everything is rendered on one line
  public PrettyOptions unconstrained() {
    return new PrettyOptions(OptionalInt.empty(), indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  public PrettyOptions withIndentSize(int indentSize) {
    return new PrettyOptions(maxWidth, indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  public PrettyOptions withHighlighter(Highlighter highlighter) {
    return new PrettyOptions(maxWidth, indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  public PrettyOptions withOverflow(OverflowMethod overflow) {
    return new PrettyOptions(maxWidth, indentSize, highlighter, Optional.ofNullable(overflow), noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  public PrettyOptions withNoWrap(boolean noWrap) {
    return new PrettyOptions(maxWidth, indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  public PrettyOptions withTrailingSeparator(boolean trailingSeparator) {
    return new PrettyOptions(maxWidth, indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  public PrettyOptions withCellWidth(CellWidth cellWidth) {
    return new PrettyOptions(maxWidth, indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  public PrettyOptions withLeafFormatter(LeafFormatter leafFormatter) {
    return new PrettyOptions(maxWidth, indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }

  public PrettyOptions withKinds(ContainerKinds kinds) {
    return new PrettyOptions(maxWidth, indentSize, highlighter, overflow, noWrap,
        trailingSeparator, cellWidth, leafFormatter, kinds);
  }
}
