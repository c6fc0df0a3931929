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

import java.util.List;
import org.wmibo.format.WmiboFormatException.IndexOutOfRange;
import org.wmibo.format.WmiboFormatException.InvalidSyntax;
import org.wmibo.format.WmiboFormatException.MissingHeader;
import org.wmibo.format.WmiboFormatException.UndeclaredVariable;
import org.wmibo.format.WmiboFormatException.UnknownConstraintId;
import org.wmibo.format.WmiboFormatException.UnsupportedVersion;
import org.wmibo.model.Clause;
import org.wmibo.model.Header;
import org.wmibo.model.Indicator;
import org.wmibo.model.Instance;
import org.wmibo.model.LinearConstraint;
import org.wmibo.model.LinearTerm;
import org.wmibo.model.Literal;
import org.wmibo.model.Objective;
import org.wmibo.model.QueryDirective;
import org.wmibo.model.VarKind;
import org.wmibo.model.VarRef;

/**
 * Whole-instance checks run once every line has been read.
 *
 * <p>Checks run in a fixed order and the first failure wins: header, variable references (range
 * and kind), declarations of integer and real variables used in linear expressions, indicator
 * targets. Validating an instance returned by {@link WmiboLoader} never throws.
 */
public final class Validator {
  private Validator() {}

  public static void validate(Instance instance) {
    checkHeader(instance.getHeader());
    checkReferences(instance);
    checkDeclarations(instance);
    checkIndicatorTargets(instance);
  }

  private static void checkHeader(Header header) {
    if (header == null) {
      throw new MissingHeader(0);
    }
    if (header.getVersion() != 1) {
      throw new UnsupportedVersion(header.getLine(), Integer.toString(header.getVersion()));
    }
  }

  private static void checkReferences(Instance instance) {
    Header header = instance.getHeader();
    for (Clause clause : instance.getClauses()) {
      for (Literal literal : clause.getLiterals()) {
        checkLiteral(header, literal, clause.getLine());
      }
    }
    for (LinearConstraint constraint : instance.getLinearConstraints()) {
      checkTerms(header, constraint.getTerms(), constraint.getLine());
    }
    if (instance.hasObjective()) {
      checkTerms(header, instance.getObjective().getTerms(), instance.getObjective().getLine());
    }
    for (Indicator indicator : instance.getIndicators()) {
      checkLiteral(header, indicator.getLiteral(), indicator.getLine());
    }
    for (QueryDirective query : instance.getQueries()) {
      for (VarRef ref : query.getProjection()) {
        checkRange(header, ref, query.getLine());
        checkBoolean(ref, query.getLine(), "projection variable");
      }
    }
  }

  private static void checkDeclarations(Instance instance) {
    for (LinearConstraint constraint : instance.getLinearConstraints()) {
      checkDeclared(instance, constraint.getTerms(), constraint.getLine());
    }
    if (instance.hasObjective()) {
      Objective objective = instance.getObjective();
      checkDeclared(instance, objective.getTerms(), objective.getLine());
    }
  }

  private static void checkIndicatorTargets(Instance instance) {
    for (Indicator indicator : instance.getIndicators()) {
      if (instance.getLinearConstraint(indicator.getConstraintId()) == null) {
        throw new UnknownConstraintId(indicator.getLine(), indicator.getConstraintId());
      }
    }
  }

  private static void checkLiteral(Header header, Literal literal, int line) {
    checkRange(header, literal.getVar(), line);
    checkBoolean(literal.getVar(), line, "literal");
  }

  private static void checkTerms(Header header, List<LinearTerm> terms, int line) {
    for (LinearTerm term : terms) {
      checkRange(header, term.getVar(), line);
    }
  }

  private static void checkDeclared(Instance instance, List<LinearTerm> terms, int line) {
    for (LinearTerm term : terms) {
      VarRef ref = term.getVar();
      if (ref.getKind() != VarKind.BOOL && !instance.isDeclared(ref)) {
        throw new UndeclaredVariable(line, ref.toString());
      }
    }
  }

  private static void checkRange(Header header, VarRef ref, int line) {
    if (!header.inRange(ref)) {
      throw new IndexOutOfRange(line, ref.toString(), header.count(ref.getKind()));
    }
  }

  private static void checkBoolean(VarRef ref, int line, String what) {
    if (ref.getKind() != VarKind.BOOL) {
      throw new InvalidSyntax(line, what + " " + ref + " must refer to a boolean variable");
    }
  }
}
