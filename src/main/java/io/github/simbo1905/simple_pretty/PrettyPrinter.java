// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import org.jetbrains.annotations.NotNull;

import java.io.PrintStream;
import java.util.Objects;
import java.util.logging.Logger;

/// Main interface of the Simple Pretty library.
/// Renders nested maps, lists, sets and arrays as text that fits a width budget, breaking containers out one
/// entry per line only as deep as it needs to. Self-referencing structures are shown with `...` where a
/// container would contain itself, and a value whose `toString` throws is shown as a placeholder.
///
/// Instances are immutable and can be shared between threads. Each call works on its own private state.
public sealed interface PrettyPrinter permits PrettyPrinterImpl {

  Logger LOGGER = Logger.getLogger(PrettyPrinter.class.getName());

  /// Render a value with this printer's options
  /// @param value any value, including null or a structure that contains itself
  /// @return the rendered text; never fails
  @NotNull PrettyText render(Object value);

  /// The options this printer was created with
  @NotNull PrettyOptions options();

  /// Render a value and write it followed by a line break
  default void print(Object value, @NotNull PrintStream out) {
    Objects.requireNonNull(out, "out cannot be null");
    out.println(render(value).plain());
    out.flush();
  }

  /// A printer for the given options
  static PrettyPrinter of(@NotNull PrettyOptions options) {
    Objects.requireNonNull(options, "options cannot be null");
    return new PrettyPrinterImpl(options);
  }

  /// A printer with [PrettyOptions#DEFAULTS]
  static PrettyPrinter create() {
    return of(PrettyOptions.DEFAULTS);
  }

  /// Render a value with the default options
  static PrettyText prettyRepr(Object value) {
    return create().render(value);
  }
}
