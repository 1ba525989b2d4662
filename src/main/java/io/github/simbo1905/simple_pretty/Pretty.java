// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.Objects;

/// A value paired with rendering options, for display surfaces that decide the width themselves.
/// The surface first asks for a [Measurement] and then renders at whatever width it settles on.
public record Pretty(Object value, PrettyOptions options) {

  public Pretty {
    Objects.requireNonNull(options, "options cannot be null");
  }

  public static Pretty of(Object value) {
    return new Pretty(value, PrettyOptions.DEFAULTS);
  }

  /// Render within the width offered by the display surface
  public PrettyText render(int maxWidth) {
    return PrettyPrinter.of(options.withMaxWidth(maxWidth)).render(value);
  }

  /// How wide this value wants to be when given at most `maxWidth` cells
  public Measurement measure(int maxWidth) {
    final int width = render(maxWidth).width();
    return new Measurement(width, width);
  }

  /// Minimum and maximum cell widths a renderable needs
  public record Measurement(int minimum, int maximum) {
    public Measurement {
      if (minimum < 0 || maximum < minimum) {
        throw new IllegalArgumentException("Invalid measurement: minimum=" + minimum + " maximum=" + maximum);
      }
    }
  }
}
