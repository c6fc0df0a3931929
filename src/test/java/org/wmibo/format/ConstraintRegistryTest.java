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

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.wmibo.model.LinearConstraint;
import org.wmibo.model.LinearTerm;
import org.wmibo.model.NormalizedConstraint;
import org.wmibo.model.Relation;
import org.wmibo.model.VarRef;

public final class ConstraintRegistryTest {
  private static Directive.LinearLine lc(int line, String text) {
    return (Directive.LinearLine) DirectiveParser.parse(Tokenizer.tokenize(text), line);
  }

  @Test
  public void testInsert_lessOrEqualIsStoredAsIs() {
    final ConstraintRegistry registry = new ConstraintRegistry();
    final LinearConstraint c = registry.insert(lc(3, "lc C1 <= 4 : 2 i1 -1 r1"));
    assertThat(c.getNormalized())
        .containsExactly(
            new NormalizedConstraint(
                "C1",
                0,
                Arrays.asList(
                    new LinearTerm(2, VarRef.integer(1)), new LinearTerm(-1, VarRef.real(1))),
                4));
    assertThat(registry.contains("C1")).isTrue();
    assertThat(registry.get("C1")).isSameInstanceAs(c);
  }

  @Test
  public void testInsert_greaterOrEqualMatchesNegatedLessOrEqual() {
    final ConstraintRegistry registry = new ConstraintRegistry();
    final LinearConstraint le = registry.insert(lc(1, "lc A <= 4 : 1 r1"));
    final LinearConstraint ge = registry.insert(lc(2, "lc B >= -4 : -1 r1"));
    assertThat(ge.getNormalized().get(0).getTerms())
        .isEqualTo(le.getNormalized().get(0).getTerms());
    assertThat(ge.getNormalized().get(0).getUpperBound())
        .isEqualTo(le.getNormalized().get(0).getUpperBound());
  }

  @Test
  public void testInsert_equalityYieldsTwoFactsWithSameId() {
    final ConstraintRegistry registry = new ConstraintRegistry();
    final LinearConstraint c = registry.insert(lc(1, "lc E = 3 : 1 i1 1 i2"));
    assertThat(c.getNormalized()).hasSize(2);
    final NormalizedConstraint first = c.getNormalized().get(0);
    final NormalizedConstraint second = c.getNormalized().get(1);
    assertThat(first.getId()).isEqualTo("E");
    assertThat(second.getId()).isEqualTo("E");
    assertThat(first.getPart()).isEqualTo(0);
    assertThat(second.getPart()).isEqualTo(1);
    assertThat(first.getUpperBound()).isEqualTo(3.0);
    assertThat(second.getUpperBound()).isEqualTo(-3.0);
    assertThat(second.getTerms())
        .containsExactly(
            new LinearTerm(-1, VarRef.integer(1)), new LinearTerm(-1, VarRef.integer(2)))
        .inOrder();
  }

  @Test
  public void testNormalize_zeroStaysPositive() {
    final NormalizedConstraint fact =
        ConstraintRegistry.normalize(
                "Z",
                Relation.GREATER_OR_EQUAL,
                0.0,
                Collections.singletonList(new LinearTerm(0.0, VarRef.real(1))))
            .get(0);
    assertThat(Double.compare(fact.getUpperBound(), 0.0)).isEqualTo(0);
    assertThat(Double.compare(fact.getTerms().get(0).getCoefficient(), 0.0)).isEqualTo(0);
  }

  @Test
  public void testInsert_duplicateId() {
    final ConstraintRegistry registry = new ConstraintRegistry();
    registry.insert(lc(4, "lc C1 <= 1 : 1 r1"));
    final WmiboFormatException.DuplicateConstraintId e =
        assertThrows(
            WmiboFormatException.DuplicateConstraintId.class,
            () -> registry.insert(lc(12, "lc C1 >= 0 : 1 r2")));
    assertThat(e.getLine()).isEqualTo(12);
    assertThat(e).hasMessageThat().contains("line 4");
    assertThat(registry.size()).isEqualTo(1);
  }
}
