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

package org.wmibo.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named linear constraint, {@code lc <id> <rel> <rhs> : <coef> <var> ...}.
 *
 * <p>The original relation and right hand side are kept for diagnostics. Solvers should consume
 * {@link #getNormalized()}, which only contains {@code <=} facts.
 */
public final class LinearConstraint {
  public LinearConstraint(
      String id,
      Relation relation,
      double rhs,
      List<LinearTerm> terms,
      List<NormalizedConstraint> normalized,
      int line) {
    this.id = id;
    this.relation = relation;
    this.rhs = rhs;
    this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    this.normalized = Collections.unmodifiableList(new ArrayList<>(normalized));
    this.line = line;
  }

  public String getId() {
    return id;
  }

  public Relation getRelation() {
    return relation;
  }

  public double getRhs() {
    return rhs;
  }

  /** Returns the terms as written. */
  public List<LinearTerm> getTerms() {
    return terms;
  }

  /** Returns one fact for {@code <=} and {@code >=}, two for {@code =}. */
  public List<NormalizedConstraint> getNormalized() {
    return normalized;
  }

  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return String.format("%s: %s %s %s", id, terms, relation.getSymbol(), rhs);
  }

  private final String id;
  private final Relation relation;
  private final double rhs;
  private final List<LinearTerm> terms;
  private final List<NormalizedConstraint> normalized;
  private final int line;
}
