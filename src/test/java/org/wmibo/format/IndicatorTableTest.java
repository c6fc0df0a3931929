// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.wmibo.format;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.wmibo.model.Literal;

public final class IndicatorTableTest {
  @Test
  public void testBind_sameLiteralIsIdempotent() {
    final IndicatorTable table = new IndicatorTable();
    assertThat(table.bind(Literal.of(1), "C1", 3)).isTrue();
    assertThat(table.bind(Literal.of(1), "C1", 5)).isFalse();
    assertThat(table.bind(Literal.of(2).not(), "C2", 6)).isTrue();
    assertThat(table.bind(Literal.of(2).not(), "C2", 7)).isFalse();
    assertThat(table.size()).isEqualTo(2);
    assertThat(table.get("C1").getLine()).isEqualTo(3);
  }

  @Test
  public void testBind_oppositeNegationConflicts() {
    final IndicatorTable table = new IndicatorTable();
    table.bind(Literal.of(1), "C1", 3);
    final WmiboFormatException.IndicatorConflict e =
        assertThrows(
            WmiboFormatException.IndicatorConflict.class,
            () -> table.bind(Literal.of(1).not(), "C1", 8));
    assertThat(e.getLine()).isEqualTo(8);
  }

  @Test
  public void testBind_otherVariableConflicts() {
    final IndicatorTable table = new IndicatorTable();
    table.bind(Literal.of(1), "C1", 3);
    assertThrows(
        WmiboFormatException.IndicatorConflict.class, () -> table.bind(Literal.of(2), "C1", 4));
  }

  @Test
  public void testBind_fromLine() {
    final IndicatorTable table = new IndicatorTable();
    table.bind(
        (Directive.IndicatorLine) DirectiveParser.parse(Tokenizer.tokenize("ind ~b4 => K"), 2));
    assertThat(table.get("K").getLiteral()).isEqualTo(Literal.of(4).not());
    assertThat(table.get("missing")).isNull();
  }
}
