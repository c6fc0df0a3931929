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

import org.wmibo.format.WmiboFormatException.DuplicateObjective;
import org.wmibo.model.Objective;

/** Holds the single {@code obj} line of the file. */
public final class ObjectiveAssembler {
  public ObjectiveAssembler() {
    this.objective = null;
  }

  public Objective set(Directive.ObjectiveLine obj) {
    if (objective != null) {
      throw new DuplicateObjective(obj.getLine(), objective.getLine());
    }
    objective = new Objective(obj.getSense(), obj.getTerms(), obj.getLine());
    return objective;
  }

  public boolean hasObjective() {
    return objective != null;
  }

  /** Returns true if an objective with at least one term was given. */
  public boolean hasTerms() {
    return objective != null && !objective.isEmpty();
  }

  /** Returns the objective, or null. */
  public Objective get() {
    return objective;
  }

  private Objective objective;
}
