// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CellWidthTest {

  @Test
  void asciiIsOneCellEach() {
    assertEquals(5, CellWidth.DEFAULT.widthOf("hello"));
    assertEquals(0, CellWidth.DEFAULT.widthOf(""));
  }

  @Test
  void wideCharactersTakeTwoCells() {
    assertEquals(4, CellWidth.DEFAULT.widthOf("漢字"));
    assertEquals(6, CellWidth.DEFAULT.widthOf("한국어"));
    assertEquals(2, CellWidth.DEFAULT.widthOf("😀"));
  }

  @Test
  void combiningMarksTakeNoCells() {
    assertEquals(1, CellWidth.DEFAULT.widthOf("e\u0301"));
  }

  @Test
  void controlCharactersTakeNoCells() {
    assertEquals(2, CellWidth.DEFAULT.widthOf("a\u0007b"));
  }

  @Test
  void codePointsCountsSurrogatePairsOnce() {
    assertEquals(2, CellWidth.CODE_POINTS.widthOf("漢字"));
    assertEquals(1, CellWidth.CODE_POINTS.widthOf("😀"));
  }
}
