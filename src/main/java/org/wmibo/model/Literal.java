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

import java.util.Objects;

/**
 * A variable reference with an optional negation, written {@code b3} or {@code ~b3}.
 *
 * <p>The parser accepts any variable prefix here; the validator rejects literals that do not refer
 * to a boolean variable.
 */
public final class Literal {
  public Literal(VarRef var, boolean negated) {
    this.var = Objects.requireNonNull(var);
    this.negated = negated;
  }

  public static Literal of(int boolIndex) {
    return new Literal(VarRef.bool(boolIndex), false);
  }

  public VarRef getVar() {
    return var;
  }

  public boolean negated() {
    return negated;
  }

  /** Returns the negation of this literal. */
  public Literal not() {
    return new Literal(var, !negated);
  }

  /** Evaluates the literal given the 0/1 value of its variable. */
  public boolean isTrue(boolean varValue) {
    return varValue != negated;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Literal)) {
      return false;
    }
    Literal other = (Literal) o;
    return negated == other.negated && var.equals(other.var);
  }

  @Override
  public int hashCode() {
    return Objects.hash(var, negated);
  }

  @Override
  public String toString() {
    return negated ? "~" + var : var.toString();
  }

  private final VarRef var;
  private final boolean negated;
}
