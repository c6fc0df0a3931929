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

/** One operation requested in the {@code query} block. */
public final class QueryDirective {
  /** Supported operations. */
  public enum Kind {
    SOLVE_FEAS,
    SOLVE_OPT,
    COUNT_PROJ,
    EXPLAIN_MUS;

    /** Returns true for the {@code solve} family. */
    public boolean isSolve() {
      return this == SOLVE_FEAS || this == SOLVE_OPT;
    }
  }

  public QueryDirective(Kind kind, List<VarRef> projection, int line) {
    this.kind = kind;
    this.projection = Collections.unmodifiableList(new ArrayList<>(projection));
    this.line = line;
  }

  /** Creates a directive that takes no argument. */
  public static QueryDirective of(Kind kind, int line) {
    return new QueryDirective(kind, Collections.emptyList(), line);
  }

  public Kind getKind() {
    return kind;
  }

  /** Returns the projection variables of {@code query count proj}, empty for other kinds. */
  public List<VarRef> getProjection() {
    return projection;
  }

  /** Returns the source line, or 0 for a defaulted directive. */
  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    switch (kind) {
      case SOLVE_FEAS:
        return "solve feas";
      case SOLVE_OPT:
        return "solve opt";
      case COUNT_PROJ:
        return "query count proj " + projection;
      case EXPLAIN_MUS:
        return "query explain mus";
    }
    throw new AssertionError(kind);
  }

  private final Kind kind;
  private final List<VarRef> projection;
  private final int line;
}
