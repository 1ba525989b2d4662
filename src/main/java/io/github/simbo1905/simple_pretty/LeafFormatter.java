// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

/// Produces the text of a leaf value. Implementations may throw; the renderer turns any failure into a
/// placeholder so that one broken value never prevents the rest of the tree from being shown.
@FunctionalInterface
public interface LeafFormatter {

  String format(Object value);
}
