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
import java.util.Objects;

/**
 * One stored {@code sum(terms) <= upperBound} fact.
 *
 * <p>An equality constraint yields two facts with the same id and parts 0 and 1. Both are gated by
 * the indicator bound to that id.
 */
public final class NormalizedConstraint {
  public NormalizedConstraint(String id, int part, List<LinearTerm> terms, double upperBound) {
    this.id = Objects.requireNonNull(id);
    this.part = part;
    this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    this.upperBound = upperBound;
  }

  /** Returns the public constraint id shared with the source {@code lc} line. */
  public String getId() {
    return id;
  }

  /** Returns 0, or 1 for the second half of an equality. */
  public int getPart() {
    return part;
  }

  public List<LinearTerm> getTerms() {
    return terms;
  }

  public double getUpperBound() {
    return upperBound;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NormalizedConstraint)) {
      return false;
    }
    NormalizedConstraint other = (NormalizedConstraint) o;
    return part == other.part
        && Double.compare(upperBound, other.upperBound) == 0
        && id.equals(other.id)
        && terms.equals(other.terms);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, part, terms, upperBound);
  }

  @Override
  public String toString() {
    return id + "#" + part + ": " + terms + " <= " + upperBound;
  }

  private final String id;
  private final int part;
  private final List<LinearTerm> terms;
  private final double upperBound;
}
