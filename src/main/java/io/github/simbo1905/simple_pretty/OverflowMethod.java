// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

/// How the display surface should treat a line that is still wider than it can show.
/// Rendering never applies this itself; it is carried on the [PrettyText] for whoever prints it.
public enum OverflowMethod {
  /// Wrap the excess onto following lines
  FOLD,
  /// Cut the line at the available width
  CROP,
  /// Cut the line and mark the cut with an ellipsis
  ELLIPSIS,
  /// Leave the line as it is
  IGNORE
}
