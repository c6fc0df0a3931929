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
import org.wmibo.model.Clause;
import org.wmibo.model.Header;
import org.wmibo.model.LinearTerm;
import org.wmibo.model.Literal;
import org.wmibo.model.Objective;
import org.wmibo.model.QueryDirective;
import org.wmibo.model.Relation;
import org.wmibo.model.VarKind;
import org.wmibo.model.VarRef;

public final class DirectiveParserTest {
  private static Directive parse(String line) {
    return DirectiveParser.parse(Tokenizer.tokenize(line), 7);
  }

  @Test
  public void testParse_header() {
    final Directive d = parse("p wmibo 1 3 2 1");
    assertThat(d.getType()).isEqualTo(Directive.Type.HEADER);
    final Header header = ((Directive.HeaderLine) d).getHeader();
    assertThat(header.count(VarKind.BOOL)).isEqualTo(3);
    assertThat(header.count(VarKind.INT)).isEqualTo(2);
    assertThat(header.count(VarKind.REAL)).isEqualTo(1);
    assertThat(header.hasCounters()).isFalse();
    assertThat(header.getLine()).isEqualTo(7);
  }

  @Test
  public void testParse_headerWithCounters() {
    final Header header = ((Directive.HeaderLine) parse("p wmibo 1 3 0 0 4 1 2")).getHeader();
    assertThat(header.hasCounters()).isTrue();
    assertThat(header.getNumClauses()).isEqualTo(4);
    assertThat(header.getNumLinear()).isEqualTo(1);
    assertThat(header.getNumIndicators()).isEqualTo(2);
  }

  @Test
  public void testParse_headerErrors() {
    assertThrows(WmiboFormatException.UnsupportedVersion.class, () -> parse("p wmibo 2 3 0 0"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("p wmibo x 3 0 0"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("p cnf 1 3 0 0"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("p wmibo 1 3 0"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("p wmibo 1 3 0 0 1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("p wmibo 1 -3 0 0"));
  }

  @Test
  public void testParse_clause() {
    final Directive.ClauseLine cl = (Directive.ClauseLine) parse("cl hard b1 ~b2 0");
    assertThat(cl.getType()).isEqualTo(Directive.Type.CLAUSE);
    assertThat(cl.getKind()).isEqualTo(Clause.Kind.HARD);
    assertThat(cl.getLiterals()).containsExactly(Literal.of(1), Literal.of(2).not()).inOrder();
    assertThat(cl.getWeight()).isEqualTo(1L);
  }

  @Test
  public void testParse_emptyHardClause() {
    final Directive.ClauseLine cl = (Directive.ClauseLine) parse("cl hard 0");
    assertThat(cl.getLiterals()).isEmpty();
    assertThat(cl.toClause().isEmpty()).isTrue();
  }

  @Test
  public void testParse_weightedClause() {
    final Directive.ClauseLine wcl = (Directive.ClauseLine) parse("wcl 5 soft ~b3 0");
    assertThat(wcl.getType()).isEqualTo(Directive.Type.WEIGHTED_CLAUSE);
    assertThat(wcl.getKind()).isEqualTo(Clause.Kind.SOFT);
    assertThat(wcl.getWeight()).isEqualTo(5L);
    assertThat(wcl.toClause().isWeighted()).isTrue();
  }

  @Test
  public void testParse_clauseErrors() {
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("cl hard b1 b2"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("cl hard b1 0 b2"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("cl maybe b1 0"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("cl hard x1 0"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("cl hard -b1 0"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("wcl -1 soft b1 0"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("wcl 1.5 soft b1 0"));
  }

  @Test
  public void testParse_linear() {
    final Directive.LinearLine lc = (Directive.LinearLine) parse("lc C1 >= -2.5 : 1 i1 -3 r2");
    assertThat(lc.getId()).isEqualTo("C1");
    assertThat(lc.getRelation()).isEqualTo(Relation.GREATER_OR_EQUAL);
    assertThat(lc.getRhs()).isEqualTo(-2.5);
    assertThat(lc.getTerms())
        .containsExactly(new LinearTerm(1, VarRef.integer(1)), new LinearTerm(-3, VarRef.real(2)))
        .inOrder();
  }

  @Test
  public void testParse_linearWithGluedColon() {
    final Directive.LinearLine lc = (Directive.LinearLine) parse("lc C2 = 4: 2 b1");
    assertThat(lc.getRelation()).isEqualTo(Relation.EQUAL);
    assertThat(lc.getTerms()).containsExactly(new LinearTerm(2, VarRef.bool(1)));
  }

  @Test
  public void testParse_overflowingNumbers() {
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("lc C <= 1e999 : 1 r1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("lc C <= 1 : -1e400 r1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("obj min : lin 1e999 i1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("var r 1 [0,1e999]"));
    final Directive.LinearLine tiny = (Directive.LinearLine) parse("lc C <= 1e-999 : 1 r1");
    assertThat(tiny.getRhs()).isEqualTo(0.0);
  }

  @Test
  public void testParse_linearErrors() {
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("lc C1 < 4 : 1 r1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("lc C1 <= four : 1 r1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("lc C1 <= 4 : 1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("lc C1 <= 4 1 r1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("lc C-1 <= 4 : 1 r1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("lc C1 <= 4 : NaN r1"));
  }

  @Test
  public void testParse_indicator() {
    final Directive.IndicatorLine ind = (Directive.IndicatorLine) parse("ind ~b1 => C1");
    assertThat(ind.getLiteral()).isEqualTo(Literal.of(1).not());
    assertThat(ind.getConstraintId()).isEqualTo("C1");
    final Directive.IndicatorLine glued = (Directive.IndicatorLine) parse("ind b2=>C3");
    assertThat(glued.getLiteral()).isEqualTo(Literal.of(2));
    assertThat(glued.getConstraintId()).isEqualTo("C3");
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("ind b1 -> C1"));
  }

  @Test
  public void testParse_objective() {
    final Directive.ObjectiveLine obj =
        (Directive.ObjectiveLine) parse("obj max : lin 3 i1 1e-1 r1");
    assertThat(obj.getSense()).isEqualTo(Objective.Sense.MAXIMIZE);
    assertThat(obj.getTerms()).hasSize(2);
    assertThat(obj.getTerms().get(1).getCoefficient()).isEqualTo(0.1);
    final Directive.ObjectiveLine empty = (Directive.ObjectiveLine) parse("obj min : lin");
    assertThat(empty.getTerms()).isEmpty();
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("obj best : lin 1 i1"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("obj min : 1 i1"));
  }

  @Test
  public void testParse_var() {
    final Directive.VarDecl bounded = (Directive.VarDecl) parse("var i 2 [-5, 10] name=load");
    assertThat(bounded.getRef()).isEqualTo(VarRef.integer(2));
    assertThat(bounded.isBounded()).isTrue();
    assertThat(bounded.getLowerBound()).isEqualTo(-5.0);
    assertThat(bounded.getUpperBound()).isEqualTo(10.0);
    assertThat(bounded.getName()).isEqualTo("load");

    final Directive.VarDecl free = (Directive.VarDecl) parse("var r 1 free");
    assertThat(free.isFree()).isTrue();
    assertThat(free.getName()).isEmpty();

    final Directive.VarDecl infinite = (Directive.VarDecl) parse("var r 2 [0,inf]");
    assertThat(infinite.getUpperBound()).isEqualTo(Double.POSITIVE_INFINITY);

    final Directive.VarDecl bin = (Directive.VarDecl) parse("var i 3 bin [0,1]");
    assertThat(bin.isBinary()).isTrue();
    assertThat(bin.isBounded()).isTrue();
  }

  @Test
  public void testParse_varErrors() {
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("var x 1 bin"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("var i one bin"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("var i 1 (0,1)"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("var i 1 name=x"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("var i 1 bin name=a-b"));
  }

  @Test
  public void testParse_queries() {
    final Directive.QueryLine solve = (Directive.QueryLine) parse("solve opt");
    assertThat(solve.getType()).isEqualTo(Directive.Type.SOLVE);
    assertThat(solve.getQuery().getKind()).isEqualTo(QueryDirective.Kind.SOLVE_OPT);

    final Directive.QueryLine count = (Directive.QueryLine) parse("query count proj b1 b3");
    assertThat(count.getQuery().getKind()).isEqualTo(QueryDirective.Kind.COUNT_PROJ);
    assertThat(count.getQuery().getProjection())
        .containsExactly(VarRef.bool(1), VarRef.bool(3))
        .inOrder();

    final Directive.QueryLine mus = (Directive.QueryLine) parse("query explain mus");
    assertThat(mus.getQuery().getKind()).isEqualTo(QueryDirective.Kind.EXPLAIN_MUS);

    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("solve fast"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("query count proj"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("query explain core"));
  }

  @Test
  public void testParse_optionKeepsRawValue() {
    final Directive.OptionLine opt = (Directive.OptionLine) parse("opt log_prefix run 42");
    assertThat(opt.getKey()).isEqualTo("log_prefix");
    assertThat(opt.getValue()).isEqualTo("run 42");
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("opt time_limit"));
  }

  @Test
  public void testParse_blocks() {
    assertThat(((Directive.Begin) parse("begin wcnf")).getBlock()).isEqualTo(Block.WCNF);
    assertThat(parse("end").getType()).isEqualTo(Directive.Type.END);
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("begin pb"));
    assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("end lin"));
  }

  @Test
  public void testParse_unknownDirective() {
    final WmiboFormatException e =
        assertThrows(WmiboFormatException.InvalidSyntax.class, () -> parse("pb 1 b1 >= 1"));
    assertThat(e.getLine()).isEqualTo(7);
    assertThat(e.getMessage()).startsWith("line 7: ");
    assertThat(e.getReason()).contains("pb");
  }
}
