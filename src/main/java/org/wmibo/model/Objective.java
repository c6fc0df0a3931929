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
 * The linear part of the objective, {@code obj min|max : lin <coef> <var> ...}.
 *
 * <p>The weighted soft clause penalty is not part of the terms. See {@link
 * Instance#totalObjective}.
 */
public final class Objective {
  /** Optimization direction. */
  public enum Sense {
    MINIMIZE("min"),
    MAXIMIZE("max");

    Sense(String keyword) {
      this.keyword = keyword;
    }

    public String getKeyword() {
      return keyword;
    }

    private final String keyword;
  }

  public Objective(Sense sense, List<LinearTerm> terms, int line) {
    this.sense = sense;
    this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    this.line = line;
  }

  public Sense getSense() {
    return sense;
  }

  public List<LinearTerm> getTerms() {
    return terms;
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return sense.getKeyword() + " " + terms;
  }

  private final Sense sense;
  private final List<LinearTerm> terms;
  private final int line;
}
