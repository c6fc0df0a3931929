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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.wmibo.format.WmiboFormatException.IndicatorConflict;
import org.wmibo.model.Indicator;
import org.wmibo.model.Literal;

/**
 * Maps constraint ids to the literal that activates them.
 *
 * <p>At most one literal per id. Repeating the same literal is accepted, any other literal,
 * including the negation of the bound one, is a conflict. Whether the target id exists is checked
 * by the {@link Validator}, once the whole file has been read.
 */
public final class IndicatorTable {
  public IndicatorTable() {
    this.bindings = new LinkedHashMap<>();
  }

  /** Binds literal to constraintId. Returns false if the same binding already existed. */
  public boolean bind(Literal literal, String constraintId, int line) {
    Indicator existing = bindings.get(constraintId);
    if (existing != null) {
      if (existing.getLiteral().equals(literal)) {
        return false;
      }
      throw new IndicatorConflict(
          line,
          constraintId,
          existing.getLiteral().toString(),
          literal.toString(),
          existing.getLine());
    }
    bindings.put(constraintId, new Indicator(literal, constraintId, line));
    return true;
  }

  /** Binds the literal of an {@code ind} line. */
  public boolean bind(Directive.IndicatorLine ind) {
    return bind(ind.getLiteral(), ind.getConstraintId(), ind.getLine());
  }

  /** Returns the indicator for constraintId, or null if the constraint is always active. */
  public Indicator get(String constraintId) {
    return bindings.get(constraintId);
  }

  public int size() {
    return bindings.size();
  }

  public Map<String, Indicator> getBindings() {
    return Collections.unmodifiableMap(bindings);
  }

  private final Map<String, Indicator> bindings;
}
