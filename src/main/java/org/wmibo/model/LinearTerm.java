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
import java.util.List;
import java.util.Objects;

/** coefficient * variable. The variable can be of any kind. */
public final class LinearTerm {
  public LinearTerm(double coefficient, VarRef var) {
    this.coefficient = coefficient;
    this.var = Objects.requireNonNull(var);
  }

  public double getCoefficient() {
    return coefficient;
  }

  public VarRef getVar() {
    return var;
  }

  /** Returns -coefficient * variable. A zero coefficient stays +0.0. */
  public LinearTerm negate() {
    return new LinearTerm(negate(coefficient), var);
  }

  /** Negates every term of the list. */
  public static List<LinearTerm> negateAll(List<LinearTerm> terms) {
    List<LinearTerm> negated = new ArrayList<>(terms.size());
    for (LinearTerm term : terms) {
      negated.add(term.negate());
    }
    return negated;
  }

  static double negate(double value) {
    return value == 0.0 ? 0.0 : -value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LinearTerm)) {
      return false;
    }
    LinearTerm other = (LinearTerm) o;
    return Double.compare(coefficient, other.coefficient) == 0 && var.equals(other.var);
  }

  @Override
  public int hashCode() {
    return Objects.hash(coefficient, var);
  }

  @Override
  public String toString() {
    return coefficient + " " + var;
  }

  private final double coefficient;
  private final VarRef var;
}
