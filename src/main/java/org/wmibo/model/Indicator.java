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

/** {@code ind <literal> => <id>}: the constraint is only enforced when the literal is true. */
public final class Indicator {
  public Indicator(Literal literal, String constraintId, int line) {
    this.literal = literal;
    this.constraintId = constraintId;
    this.line = line;
  }

  public Literal getLiteral() {
    return literal;
  }

  public String getConstraintId() {
    return constraintId;
  }

  /** Returns the line of the first {@code ind} directive with this binding. */
  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return literal + " => " + constraintId;
  }

  private final Literal literal;
  private final String constraintId;
  private final int line;
}
