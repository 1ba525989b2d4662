// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.simple_pretty;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PrettyTest {

  static final PrettyOptions OPTIONS = PrettyOptions.DEFAULTS.withIndentSize(4).withTrailingSeparator(false);

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static Map<String, Object> sample() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("a", 1);
    map.put("b", 2);
    return map;
  }

  @Test
  void measureReportsWidestLineAtTheOfferedWidth() {
    final var pretty = new Pretty(sample(), OPTIONS);
    assertEquals(new Pretty.Measurement(16, 16), pretty.measure(80));
    assertEquals(new Pretty.Measurement(11, 11), pretty.measure(5));
  }

  @Test
  void renderUsesTheOfferedWidth() {
    final var pretty = new Pretty(sample(), OPTIONS);
    assertEquals("{'a': 1, 'b': 2}", pretty.render(80).plain());
    assertThat(pretty.render(5).lines()).containsExactly("{", "    'a': 1,", "    'b': 2", "}");
  }

  @Test
  void defaultOptionsAreUsedByOf() {
    assertThat(Pretty.of("x").options()).isSameAs(PrettyOptions.DEFAULTS);
    assertEquals("'x'", Pretty.of("x").render(80).plain());
  }

  @Test
  void measurementMustBeOrdered() {
    assertThatThrownBy(() -> new Pretty.Measurement(5, 4)).isInstanceOf(IllegalArgumentException.class);
  }
}
