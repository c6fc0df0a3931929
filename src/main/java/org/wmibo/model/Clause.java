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
 * A disjunction of literals coming from a {@code cl} or {@code wcl} line.
 *
 * <p>Clauses are anonymous. A hard clause with no literal is unsatisfiable.
 */
public final class Clause {
  /** Hard clauses must hold; soft clauses add their weight to the objective when violated. */
  public enum Kind {
    HARD,
    SOFT
  }

  public Clause(Kind kind, long weight, List<Literal> literals, boolean weighted, int line) {
    this.kind = kind;
    this.weight = weight;
    this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
    this.weighted = weighted;
    this.line = line;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isHard() {
    return kind == Kind.HARD;
  }

  public boolean isSoft() {
    return kind == Kind.SOFT;
  }

  /** Returns the weight: 1 for {@code cl soft}, retained but unused for hard clauses. */
  public long getWeight() {
    return weight;
  }

  public List<Literal> getLiterals() {
    return literals;
  }

  /** Returns true if the clause was read from a {@code wcl} line. */
  public boolean isWeighted() {
    return weighted;
  }

  public int getLine() {
    return line;
  }

  public boolean isEmpty() {
    return literals.isEmpty();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind == Kind.HARD ? "hard" : "soft");
    if (weighted) {
      sb.append('(').append(weight).append(')');
    }
    sb.append(literals);
    return sb.toString();
  }

  private final Kind kind;
  private final long weight;
  private final List<Literal> literals;
  private final boolean weighted;
  private final int line;
}
