// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import org.jetbrains.annotations.TestOnly;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.simple_pretty.PrettyPrinter.LOGGER;

/// Leaf text memoised by object identity for the lifetime of one top level render call.
/// Retries at deeper expansion levels therefore show exactly the text produced the first time a
/// value was formatted, even if its `toString` would answer differently when asked again.
/// Two distinct values that are `equals` get separate entries. This class is not thread safe.
final class ReprCache {

  static final String ERROR_PREFIX = "<error in repr: ";

  final LeafFormatter formatter;
  final Map<Object, String> cache = new IdentityHashMap<>();

  ReprCache(LeafFormatter formatter) {
    this.formatter = Objects.requireNonNull(formatter, "formatter cannot be null");
  }

  /// The text of `value`. Never throws: a failing formatter yields a diagnostic placeholder.
  String repr(Object value) {
    final String cached = cache.get(value);
    if (cached != null) {
      return cached;
    }
    final String text = formatSafely(value);
    cache.put(value, text);
    return text;
  }

  String formatSafely(Object value) {
    try {
      final String text = formatter.format(value);
      LOGGER.finer(() -> "Formatted leaf of type " + (value == null ? "null" : value.getClass().getSimpleName())
          + " as: " + text);
      return text == null ? "null" : text;
    } catch (RuntimeException | StackOverflowError error) {
      LOGGER.fine(() -> "Leaf formatting failed for " + (value == null ? "null" : value.getClass().getName())
          + ": " + error);
      return placeholder(error);
    }
  }

  static String placeholder(Throwable error) {
    final String message = error.getMessage();
    return ERROR_PREFIX + (message == null ? error.getClass().getSimpleName() : message) + ">";
  }

  @TestOnly
  int size() {
    return cache.size();
  }
}
