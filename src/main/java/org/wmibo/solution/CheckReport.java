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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Outcome of {@link SolutionChecker#check}. */
public final class CheckReport {
  /** How a reported objective value relates to the linear objective and the soft penalty. */
  public enum Convention {
    /** lin + penalty. */
    TOTAL_MIN,
    /** lin + penalty for min, -lin + penalty for max. */
    TOTAL_INTERNAL,
    /** lin - penalty. */
    TOTAL_MAX_ORIGINAL
  }

  CheckReport(
      List<String> failures,
      List<String> warnings,
      double linearObjective,
      double penalty,
      int softViolations,
      Convention bestMatch,
      double bestMatchValue) {
    this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    this.linearObjective = linearObjective;
    this.penalty = penalty;
    this.softViolations = softViolations;
    this.bestMatch = bestMatch;
    this.bestMatchValue = bestMatchValue;
  }

  /** Returns true if no failure was found. Warnings do not count. */
  public boolean isOk() {
    return failures.isEmpty();
  }

  public List<String> getFailures() {
    return failures;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  /** Returns sum(coef * value) over the objective terms, NaN if a value is missing. */
  public double getLinearObjective() {
    return linearObjective;
  }

  /** Returns the sum of the weights of the violated soft clauses. */
  public double getPenalty() {
    return penalty;
  }

  public int getSoftViolations() {
    return softViolations;
  }

  /** Returns linear objective + penalty. */
  public double getTotalObjective() {
    return linearObjective + penalty;
  }

  /** Returns the convention closest to the reported objective, or null if none was reported. */
  public Convention getBestMatch() {
    return bestMatch;
  }

  public double getBestMatchValue() {
    return bestMatchValue;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("lin_obj: %.12g%n", linearObjective));
    sb.append(String.format("penalty: %.12g (soft_violations=%d)%n", penalty, softViolations));
    sb.append(String.format("total:   %.12g%n", getTotalObjective()));
    if (bestMatch != null) {
      sb.append(String.format("best_match: %s value=%.12g%n", bestMatch, bestMatchValue));
    }
    if (!warnings.isEmpty()) {
      sb.append(String.format("%nWARNINGS:%n"));
      for (String warning : warnings) {
        sb.append("  - ").append(warning).append(String.format("%n"));
      }
    }
    if (!failures.isEmpty()) {
      sb.append(String.format("%nFAILURES:%n"));
      for (String failure : failures) {
        sb.append("  - ").append(failure).append(String.format("%n"));
      }
    }
    sb.append(String.format("%nRESULT: %s%n", isOk() ? "OK" : "FAIL"));
    return sb.toString();
  }

  private final List<String> failures;
  private final List<String> warnings;
  private final double linearObjective;
  private final double penalty;
  private final int softViolations;
  private final Convention bestMatch;
  private final double bestMatchValue;
}
