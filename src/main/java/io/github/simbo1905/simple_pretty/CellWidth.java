// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

/// Measures how many terminal cells a fragment of text occupies.
/// The layout only ever sums these values; how wide or zero-width glyphs are treated is up to the implementation.
@FunctionalInterface
public interface CellWidth {

  int widthOf(String text);

  /// One cell per code point, two for East Asian wide and fullwidth ranges and emoji,
  /// zero for combining marks, format characters and controls.
  CellWidth DEFAULT = text -> {
    int width = 0;
    for (int i = 0; i < text.length(); ) {
      final int codePoint = text.codePointAt(i);
      width += CellWidth.cells(codePoint);
      i += Character.charCount(codePoint);
    }
    return width;
  };

  /// Every code point counts as one cell
  CellWidth CODE_POINTS = text -> text.codePointCount(0, text.length());

  static int cells(int codePoint) {
    if (codePoint < 0x20 || (codePoint >= 0x7f && codePoint < 0xa0)) {
      return 0;
    }
    if (codePoint < 0x300) {
      return 1;
    }
    switch (Character.getType(codePoint)) {
      case Character.NON_SPACING_MARK:
      case Character.ENCLOSING_MARK:
      case Character.FORMAT:
        return 0;
      default:
        break;
    }
    return isWide(codePoint) ? 2 : 1;
  }

  static boolean isWide(int codePoint) {
    return (codePoint >= 0x1100 && codePoint <= 0x115f)    // Hangul Jamo initials
        || (codePoint >= 0x2e80 && codePoint <= 0x303e)    // CJK radicals, punctuation
        || (codePoint >= 0x3041 && codePoint <= 0x33ff)    // kana, CJK compatibility
        || (codePoint >= 0x3400 && codePoint <= 0x4dbf)    // CJK extension A
        || (codePoint >= 0x4e00 && codePoint <= 0x9fff)    // CJK unified ideographs
        || (codePoint >= 0xa000 && codePoint <= 0xa4cf)    // Yi
        || (codePoint >= 0xac00 && codePoint <= 0xd7a3)    // Hangul syllables
        || (codePoint >= 0xf900 && codePoint <= 0xfaff)    // CJK compatibility ideographs
        || (codePoint >= 0xfe30 && codePoint <= 0xfe4f)    // CJK compatibility forms
        || (codePoint >= 0xff00 && codePoint <= 0xff60)    // fullwidth forms
        || (codePoint >= 0xffe0 && codePoint <= 0xffe6)
        || (codePoint >= 0x1f300 && codePoint <= 0x1f64f) // pictographs and emoticons
        || (codePoint >= 0x1f900 && codePoint <= 0x1f9ff)
        || (codePoint >= 0x20000 && codePoint <= 0x3fffd);
  }
}
