// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.Objects;

/// Outcome of one traversal at a fixed expansion level
sealed interface Attempt permits Attempt.Fits, Attempt.Overflow {

  /// Every line stayed within budget (or the budget was not being enforced)
  record Fits(Document document) implements Attempt {
    public Fits {
      Objects.requireNonNull(document, "document cannot be null");
    }
  }

  /// A line went over budget while rendering a node at `depth`. The partial document is discarded.
  record Overflow(int depth, int line) implements Attempt {
  }
}
