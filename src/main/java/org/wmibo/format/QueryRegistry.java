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
import java.util.List;
import org.wmibo.model.QueryDirective;

/** The {@code query} block entries, in file order. */
public final class QueryRegistry {
  public QueryRegistry() {
    this.queries = new ArrayList<>();
  }

  public void add(QueryDirective query) {
    queries.add(query);
  }

  public List<QueryDirective> getQueries() {
    return Collections.unmodifiableList(queries);
  }

  /**
   * Returns the first {@code solve} entry. Without one, returns solve-opt if the objective has
   * terms or a soft clause exists, and solve-feas otherwise.
   */
  public QueryDirective effectiveDirective(boolean hasObjectiveTerms, boolean hasSoftClauses) {
    for (QueryDirective query : queries) {
      if (query.getKind().isSolve()) {
        return query;
      }
    }
    if (hasObjectiveTerms || hasSoftClauses) {
      return QueryDirective.of(QueryDirective.Kind.SOLVE_OPT, 0);
    }
    return QueryDirective.of(QueryDirective.Kind.SOLVE_FEAS, 0);
  }

  private final List<QueryDirective> queries;
}
