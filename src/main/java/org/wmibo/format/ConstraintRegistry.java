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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.wmibo.format.WmiboFormatException.DuplicateConstraintId;
import org.wmibo.model.LinearConstraint;
import org.wmibo.model.LinearTerm;
import org.wmibo.model.NormalizedConstraint;
import org.wmibo.model.Relation;

/**
 * Owns the linear constraints, keyed by their file-wide unique id.
 *
 * <p>Every constraint is stored as {@code <=} facts: {@code >=} negates both sides, {@code =}
 * yields {@code expr <= rhs} and {@code -expr <= -rhs}.
 */
public final class ConstraintRegistry {
  public ConstraintRegistry() {
    this.constraints = new LinkedHashMap<>();
  }

  /** Normalizes and stores the constraint of an {@code lc} line. */
  public LinearConstraint insert(Directive.LinearLine lc) {
    LinearConstraint previous = constraints.get(lc.getId());
    if (previous != null) {
      throw new DuplicateConstraintId(lc.getLine(), lc.getId(), previous.getLine());
    }
    LinearConstraint constraint =
        new LinearConstraint(
            lc.getId(),
            lc.getRelation(),
            lc.getRhs(),
            lc.getTerms(),
            normalize(lc.getId(), lc.getRelation(), lc.getRhs(), lc.getTerms()),
            lc.getLine());
    constraints.put(lc.getId(), constraint);
    return constraint;
  }

  /** Rewrites {@code terms relation rhs} as one or two {@code <=} facts. */
  public static List<NormalizedConstraint> normalize(
      String id, Relation relation, double rhs, List<LinearTerm> terms) {
    List<NormalizedConstraint> facts = new ArrayList<>(2);
    switch (relation) {
      case LESS_OR_EQUAL:
        facts.add(new NormalizedConstraint(id, 0, terms, rhs));
        break;
      case GREATER_OR_EQUAL:
        facts.add(new NormalizedConstraint(id, 0, LinearTerm.negateAll(terms), negate(rhs)));
        break;
      case EQUAL:
        facts.add(new NormalizedConstraint(id, 0, terms, rhs));
        facts.add(new NormalizedConstraint(id, 1, LinearTerm.negateAll(terms), negate(rhs)));
        break;
    }
    return facts;
  }

  public boolean contains(String id) {
    return constraints.containsKey(id);
  }

  /** Returns the constraint with the given id, or null. */
  public LinearConstraint get(String id) {
    return constraints.get(id);
  }

  public int size() {
    return constraints.size();
  }

  /** Returns the constraints in insertion order. */
  public Map<String, LinearConstraint> getConstraints() {
    return Collections.unmodifiableMap(constraints);
  }

  private static double negate(double value) {
    return value == 0.0 ? 0.0 : -value;
  }

  private final Map<String, LinearConstraint> constraints;
}
