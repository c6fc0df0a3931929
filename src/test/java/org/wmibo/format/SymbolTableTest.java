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
import org.wmibo.model.Domain;
import org.wmibo.model.Header;
import org.wmibo.model.VarRef;
import org.wmibo.model.Variable;

public final class SymbolTableTest {
  private final SymbolTable symbols =
      new SymbolTable(new Header(1, 2, 2, 2, Header.ABSENT, Header.ABSENT, Header.ABSENT, 1));

  private Variable declare(int line, String text) {
    return symbols.declare(
        (Directive.VarDecl) DirectiveParser.parse(Tokenizer.tokenize(text), line));
  }

  @Test
  public void testDeclare_domains() {
    assertThat(declare(2, "var i 1 [0,10] name=count").getDomain())
        .isEqualTo(Domain.bounded(0, 10));
    assertThat(declare(3, "var i 2 bin").getDomain()).isEqualTo(Domain.binary());
    assertThat(declare(4, "var r 1 free").getDomain()).isEqualTo(Domain.free());
    assertThat(declare(5, "var r 2 [-inf,2.5]").getDomain())
        .isEqualTo(Domain.bounded(Double.NEGATIVE_INFINITY, 2.5));
    assertThat(declare(6, "var b 1 bin").getDomain()).isEqualTo(Domain.binary());

    final Variable count = symbols.lookup(VarRef.integer(1), 9);
    assertThat(count.getName()).isEqualTo("count");
    assertThat(count.isDeclared()).isTrue();
    assertThat(count.getLine()).isEqualTo(2);
    assertThat(symbols.getDeclared()).hasSize(5);
  }

  @Test
  public void testLookup_implicitBooleanAndUndeclared() {
    final Variable b2 = symbols.lookup(VarRef.bool(2), 3);
    assertThat(b2.isDeclared()).isFalse();
    assertThat(b2.isIntegral()).isTrue();
    assertThat(symbols.lookup(VarRef.real(1), 3)).isNull();
    assertThrows(
        WmiboFormatException.IndexOutOfRange.class, () -> symbols.lookup(VarRef.bool(3), 3));
  }

  @Test
  public void testDeclare_duplicate() {
    declare(2, "var r 1 free");
    final WmiboFormatException.DuplicateVariable e =
        assertThrows(
            WmiboFormatException.DuplicateVariable.class, () -> declare(8, "var r 1 [0,1]"));
    assertThat(e.getLine()).isEqualTo(8);
    assertThat(e).hasMessageThat().contains("line 2");
  }

  @Test
  public void testDeclare_outOfRange() {
    assertThrows(WmiboFormatException.IndexOutOfRange.class, () -> declare(2, "var i 3 [0,1]"));
    assertThrows(WmiboFormatException.IndexOutOfRange.class, () -> declare(2, "var r 0 free"));
  }

  @Test
  public void testDeclare_invalidDomains() {
    assertThrows(WmiboFormatException.InvalidDomain.class, () -> declare(2, "var i 1 [5,1]"));
    assertThrows(WmiboFormatException.InvalidDomain.class, () -> declare(2, "var i 1 [0,1.5]"));
    assertThrows(WmiboFormatException.InvalidDomain.class, () -> declare(2, "var i 1 free"));
    assertThrows(WmiboFormatException.InvalidDomain.class, () -> declare(2, "var r 1 bin"));
    assertThrows(WmiboFormatException.InvalidDomain.class, () -> declare(2, "var b 1 free"));
    assertThrows(WmiboFormatException.InvalidDomain.class, () -> declare(2, "var b 1 [0,2]"));
    assertThrows(
        WmiboFormatException.InvalidDomain.class, () -> declare(2, "var r 1 free [0,1]"));
    assertThrows(WmiboFormatException.InvalidDomain.class, () -> declare(2, "var i 1 bin [0,1]"));
  }
}
