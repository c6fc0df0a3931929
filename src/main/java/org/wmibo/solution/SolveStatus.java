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

package org.wmibo.solution;

/** Outcome reported by a solver, printed on the {@code s} line. */
public enum SolveStatus {
  OPTIMUM_FOUND("OPTIMUM FOUND", true),
  SATISFIABLE("SATISFIABLE", true),
  INFEASIBLE("INFEASIBLE", false),
  UNSATISFIABLE("UNSATISFIABLE", false),
  UNBOUNDED("UNBOUNDED", false),
  UNKNOWN("UNKNOWN", false);

  SolveStatus(String label, boolean hasModel) {
    this.label = label;
    this.hasModel = hasModel;
  }

  /** Returns the text following {@code s }. */
  public String getLabel() {
    return label;
  }

  /** Returns true if a solution with this status comes with a full assignment. */
  public boolean hasModel() {
    return hasModel;
  }

  /** Returns the status printed as label, or null. */
  public static SolveStatus fromLabel(String label) {
    for (SolveStatus status : values()) {
      if (status.label.equals(label)) {
        return status;
      }
    }
    return null;
  }

  private final String label;
  private final boolean hasModel;
}
