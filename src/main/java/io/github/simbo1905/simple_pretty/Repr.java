// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import java.util.Arrays;

/// The default leaf formatter. Strings and characters are quoted so that `'1'` and `1` stay
/// distinguishable; everything else is shown through `String.valueOf`, including other `CharSequence`s
/// such as a `StringBuilder`.
public enum Repr implements LeafFormatter {
  INSTANCE;

  @Override
  public String format(Object value) {
    if (value instanceof String text) {
      return quote(text);
    }
    if (value instanceof Character ch) {
      return quote(String.valueOf(ch));
    }
    if (value != null && value.getClass().isArray()) {
      return primitiveArray(value);
    }
    return String.valueOf(value);
  }

  /// Single quotes unless the text has a single quote and no double quote in it
  static String quote(String text) {
    final char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
    final var sb = new StringBuilder(text.length() + 2);
    sb.append(quote);
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == quote || c == '\\') {
        sb.append('\\').append(c);
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c < 0x20 || c == 0x7f) {
        sb.append(String.format("\\x%02x", (int) c));
      } else {
        sb.append(c);
      }
    }
    return sb.append(quote).toString();
  }

  static String primitiveArray(Object array) {
    if (array instanceof int[] a) return Arrays.toString(a);
    if (array instanceof long[] a) return Arrays.toString(a);
    if (array instanceof double[] a) return Arrays.toString(a);
    if (array instanceof float[] a) return Arrays.toString(a);
    if (array instanceof short[] a) return Arrays.toString(a);
    if (array instanceof byte[] a) return Arrays.toString(a);
    if (array instanceof char[] a) return Arrays.toString(a);
    if (array instanceof boolean[] a) return Arrays.toString(a);
    return Arrays.deepToString((Object[]) array);
  }
}
