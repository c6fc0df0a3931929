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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import org.wmibo.model.VarRef;

/** Result handed back by a solving backend: status, optional objective value, assignment. */
public final class Solution {
  private Solution(SolveStatus status, Double objectiveValue, Map<VarRef, Double> assignment) {
    this.status = status;
    this.objectiveValue = objectiveValue;
    this.assignment = Collections.unmodifiableMap(new TreeMap<>(assignment));
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public SolveStatus getStatus() {
    return status;
  }

  public boolean hasObjectiveValue() {
    return objectiveValue != null;
  }

  /** Checks that an objective value was reported, and returns it. */
  public double getObjectiveValue() {
    if (objectiveValue == null) {
      throw new IllegalStateException("Solution.getObjectiveValue(): no objective value");
    }
    return objectiveValue;
  }

  /** Returns the assigned values, sorted by kind then index. */
  public Map<VarRef, Double> getAssignment() {
    return assignment;
  }

  public boolean hasValue(VarRef ref) {
    return assignment.containsKey(ref);
  }

  /** Checks that ref has a value, and returns it. */
  public double getValue(VarRef ref) {
    Double value = assignment.get(ref);
    if (value == null) {
      throw new IllegalArgumentException("Solution.getValue(): no value for " + ref);
    }
    return value;
  }

  /** Builder for {@link Solution}. The status defaults to UNKNOWN. */
  public static final class Builder {
    private SolveStatus status = SolveStatus.UNKNOWN;
    private Double objectiveValue = null;
    private final Map<VarRef, Double> assignment = new TreeMap<>();

    private Builder() {}

    public Builder setStatus(SolveStatus status) {
      this.status = status;
      return this;
    }

    public Builder setObjectiveValue(double objectiveValue) {
      this.objectiveValue = objectiveValue;
      return this;
    }

    public Builder clearObjectiveValue() {
      this.objectiveValue = null;
      return this;
    }

    public Builder putValue(VarRef ref, double value) {
      assignment.put(ref, value);
      return this;
    }

    public Builder putAllValues(Map<VarRef, Double> values) {
      assignment.putAll(values);
      return this;
    }

    public Solution build() {
      return new Solution(status, objectiveValue, assignment);
    }
  }

  private final SolveStatus status;
  private final Double objectiveValue;
  private final Map<VarRef, Double> assignment;
}
