// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LineTest {

  @Test
  void widthAccumulatesAcrossAppends() {
    final var line = new Line(CellWidth.DEFAULT);
    line.append("[");
    line.append("'abc'");
    line.append("]");
    assertEquals(7, line.cells());
    assertEquals(7, line.effectiveCells());
    assertEquals("['abc']", line.text());
  }

  @Test
  void singleTrailingSpaceIsNotCounted() {
    final var line = new Line(CellWidth.DEFAULT);
    line.append("[1");
    line.append(", ");
    assertEquals(4, line.cells());
    assertEquals(3, line.effectiveCells());
    line.append("2");
    assertEquals(5, line.effectiveCells());
  }

  @Test
  void emptyLineHasNoWidth() {
    final var line = new Line(CellWidth.DEFAULT);
    assertEquals(0, line.cells());
    assertEquals(0, line.effectiveCells());
    assertEquals("", line.text());
  }

  @Test
  void usesTheSuppliedWidthFunction() {
    final var line = new Line(text -> text.length() * 3);
    line.append("ab");
    assertEquals(6, line.cells());
  }

  @Test
  void trailingSpaceIsDiscountedByItsOwnWidth() {
    final var line = new Line(text -> text.replace(" ", "").length());
    line.append("[1");
    line.append(", ");
    assertEquals(3, line.cells());
    assertEquals(3, line.effectiveCells());
  }

  @Test
  void documentReportsWidestLine() {
    final var document = new Document(CellWidth.DEFAULT);
    document.current().append("{");
    document.newLine().append("    'key': 'value',");
    document.newLine().append("}");
    assertThat(document.texts()).containsExactly("{", "    'key': 'value',", "}");
    assertEquals(19, document.width());
    assertEquals("{\n    'key': 'value',\n}", document.text());
  }
}
