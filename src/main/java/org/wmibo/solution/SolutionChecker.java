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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.wmibo.model.Clause;
import org.wmibo.model.Domain;
import org.wmibo.model.Indicator;
import org.wmibo.model.Instance;
import org.wmibo.model.LinearConstraint;
import org.wmibo.model.LinearTerm;
import org.wmibo.model.Literal;
import org.wmibo.model.NormalizedConstraint;
import org.wmibo.model.Objective;
import org.wmibo.model.Options;
import org.wmibo.model.VarKind;
import org.wmibo.model.VarRef;
import org.wmibo.model.Variable;

/**
 * Checks a solver's solution against the instance it was computed for.
 *
 * <p>Checks variable domains, hard clauses and active linear constraints, computes the soft clause
 * penalty, and compares the reported objective value with the recomputed one. Tolerances come from
 * the {@code feas_tol} and {@code int_tol} options.
 */
public final class SolutionChecker {
  private static final Logger logger = Logger.getLogger(SolutionChecker.class.getName());

  public static final double DEFAULT_FEASIBILITY_TOLERANCE = 1e-8;
  public static final double DEFAULT_INTEGRALITY_TOLERANCE = 1e-6;
  public static final double OBJECTIVE_TOLERANCE = 1e-6;
  private static final double BOOLEAN_TOLERANCE = 1e-9;

  private SolutionChecker() {}

  public static CheckReport check(Instance instance, Solution solution) {
    Options options = instance.getOptions();
    double feasTol =
        options.getNumber(Options.FEASIBILITY_TOLERANCE, DEFAULT_FEASIBILITY_TOLERANCE);
    double intTol =
        options.getNumber(Options.INTEGRALITY_TOLERANCE, DEFAULT_INTEGRALITY_TOLERANCE);
    List<String> failures = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    Map<VarRef, Double> values = solution.getAssignment();

    if (!solution.getStatus().hasModel() && values.isEmpty()) {
      warnings.add(
          "status " + solution.getStatus().getLabel() + " carries no assignment, nothing to check");
      return new CheckReport(failures, warnings, 0.0, 0.0, 0, null, Double.NaN);
    }

    checkDomains(instance, values, intTol, feasTol, failures, warnings);

    for (Clause clause : instance.getClauses()) {
      if (!clause.isHard()) {
        continue;
      }
      if (!hasLiteralValues(clause.getLiterals(), values)) {
        failures.add("hard clause on line " + clause.getLine() + ": missing boolean value");
      } else if (!Instance.isSatisfied(clause, values)) {
        failures.add("hard clause on line " + clause.getLine() + " violated");
      }
    }

    double penalty = 0.0;
    int softViolations = 0;
    for (Clause clause : instance.getSoftClauses()) {
      if (!hasLiteralValues(clause.getLiterals(), values)) {
        failures.add("soft clause on line " + clause.getLine() + ": missing boolean value");
      } else if (!Instance.isSatisfied(clause, values)) {
        penalty += clause.getWeight();
        softViolations++;
      }
    }

    for (LinearConstraint constraint : instance.getLinearConstraints()) {
      checkLinear(instance, constraint, values, feasTol, failures);
    }

    double linear = 0.0;
    if (instance.hasObjective()) {
      if (hasTermValues(instance.getObjective().getTerms(), values)) {
        linear = instance.linearObjective(values);
      } else {
        failures.add("objective: missing variable value in linear objective");
        linear = Double.NaN;
      }
    }

    CheckReport.Convention bestMatch = null;
    double bestValue = Double.NaN;
    if (solution.hasObjectiveValue() && !Double.isNaN(solution.getObjectiveValue())) {
      double reported = solution.getObjectiveValue();
      boolean maximize =
          instance.hasObjective()
              && instance.getObjective().getSense() == Objective.Sense.MAXIMIZE;
      Map<CheckReport.Convention, Double> candidates = new EnumMap<>(CheckReport.Convention.class);
      candidates.put(CheckReport.Convention.TOTAL_MIN, linear + penalty);
      candidates.put(
          CheckReport.Convention.TOTAL_INTERNAL, maximize ? -linear + penalty : linear + penalty);
      candidates.put(CheckReport.Convention.TOTAL_MAX_ORIGINAL, linear - penalty);
      for (Map.Entry<CheckReport.Convention, Double> candidate : candidates.entrySet()) {
        double error = Math.abs(candidate.getValue() - reported);
        if (bestMatch == null || error < Math.abs(bestValue - reported)) {
          bestMatch = candidate.getKey();
          bestValue = candidate.getValue();
        }
      }
      double error = Math.abs(bestValue - reported);
      if (!(error <= OBJECTIVE_TOLERANCE)) {
        failures.add(
            String.format(
                "objective mismatch: reported o=%.12g best_match(%s)=%.12g |err|=%.3g > %s",
                reported, bestMatch, bestValue, error, OBJECTIVE_TOLERANCE));
      }
    }

    CheckReport report =
        new CheckReport(
            failures, warnings, linear, penalty, softViolations, bestMatch, bestValue);
    logger.fine(
        String.format(
            "checked solution: %d failure(s), %d warning(s)", failures.size(), warnings.size()));
    return report;
  }

  private static void checkDomains(
      Instance instance,
      Map<VarRef, Double> values,
      double intTol,
      double feasTol,
      List<String> failures,
      List<String> warnings) {
    for (VarKind kind : VarKind.values()) {
      for (int index = 1; index <= instance.numVariables(kind); ++index) {
        VarRef ref = new VarRef(kind, index);
        Double value = values.get(ref);
        if (value == null) {
          failures.add("missing assignment: " + ref);
          continue;
        }
        Variable variable = instance.getVariable(ref);
        switch (kind) {
          case BOOL:
            if (Math.abs(value) > BOOLEAN_TOLERANCE && Math.abs(value - 1.0) > BOOLEAN_TOLERANCE) {
              failures.add(ref + " not boolean (0/1): " + value);
            }
            break;
          case INT:
            if (Math.abs(value - Math.rint(value)) > intTol) {
              failures.add(ref + " not integral within int_tol=" + intTol + ": " + value);
            }
            checkBounds(ref, variable, value, intTol, failures, warnings);
            break;
          case REAL:
            checkBounds(ref, variable, value, feasTol, failures, warnings);
            break;
        }
      }
    }
  }

  private static void checkBounds(
      VarRef ref,
      Variable variable,
      double value,
      double tolerance,
      List<String> failures,
      List<String> warnings) {
    if (variable == null) {
      warnings.add(ref + " has no 'var' declaration; skipping bounds check");
      return;
    }
    Domain domain = variable.getDomain();
    if (!domain.contains(value, tolerance)) {
      failures.add(ref + " out of bounds " + domain + ": " + value);
    }
  }

  private static void checkLinear(
      Instance instance,
      LinearConstraint constraint,
      Map<VarRef, Double> values,
      double feasTol,
      List<String> failures) {
    String id = constraint.getId();
    Indicator indicator = instance.getIndicator(id);
    if (indicator != null) {
      if (!values.containsKey(indicator.getLiteral().getVar())) {
        failures.add(
            "missing indicator variable " + indicator.getLiteral().getVar() + " for " + id);
        return;
      }
      if (!Instance.isTrue(indicator.getLiteral(), values)) {
        return;
      }
    }
    if (!hasTermValues(constraint.getTerms(), values)) {
      failures.add("linear constraint " + id + ": missing variable value");
      return;
    }
    for (NormalizedConstraint fact : constraint.getNormalized()) {
      if (Instance.evaluate(fact.getTerms(), values) > fact.getUpperBound() + feasTol) {
        failures.add(
            String.format(
                "linear %s violated: lhs=%.12g %s rhs=%.12g (tol=%s)",
                id,
                Instance.evaluate(constraint.getTerms(), values),
                constraint.getRelation().getSymbol(),
                constraint.getRhs(),
                feasTol));
        return;
      }
    }
  }

  private static boolean hasLiteralValues(List<Literal> literals, Map<VarRef, Double> values) {
    for (Literal literal : literals) {
      if (!values.containsKey(literal.getVar())) {
        return false;
      }
    }
    return true;
  }

  private static boolean hasTermValues(List<LinearTerm> terms, Map<VarRef, Double> values) {
    for (LinearTerm term : terms) {
      if (!values.containsKey(term.getVar())) {
        return false;
      }
    }
    return true;
  }
}
