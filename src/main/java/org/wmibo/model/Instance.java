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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A loaded WMIBO instance.
 *
 * <p>Instances are immutable once built and can be shared between threads. Variables, clauses and
 * constraints are looked up by {@link VarRef} and constraint id.
 */
public final class Instance {
  public Instance(
      Header header,
      Map<VarRef, Variable> declaredVariables,
      List<Clause> clauses,
      Map<String, LinearConstraint> constraints,
      Map<String, Indicator> indicators,
      Objective objective,
      List<QueryDirective> queries,
      QueryDirective effectiveDirective,
      Options options,
      List<FormatWarning> warnings) {
    this.header = header;
    this.declaredVariables = Collections.unmodifiableMap(new TreeMap<>(declaredVariables));
    this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
    this.constraints = Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
    this.indicators = Collections.unmodifiableMap(new LinkedHashMap<>(indicators));
    this.objective = objective;
    this.queries = Collections.unmodifiableList(new ArrayList<>(queries));
    this.effectiveDirective = effectiveDirective;
    this.options = options;
    this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));

    List<Clause> soft = new ArrayList<>();
    boolean emptyHard = false;
    for (Clause clause : this.clauses) {
      if (clause.isSoft()) {
        soft.add(clause);
      } else if (clause.isEmpty()) {
        emptyHard = true;
      }
    }
    this.softClauses = Collections.unmodifiableList(soft);
    this.hasEmptyHardClause = emptyHard;
  }

  public Header getHeader() {
    return header;
  }

  /** Returns the header count B, I or R. */
  public int numVariables(VarKind kind) {
    return header.count(kind);
  }

  /**
   * Returns the variable for ref: its declaration, an implicit [0, 1] boolean, or null for an
   * undeclared integer or real variable or an index outside the header range.
   */
  public Variable getVariable(VarRef ref) {
    Variable declared = declaredVariables.get(ref);
    if (declared != null) {
      return declared;
    }
    if (ref.getKind() == VarKind.BOOL && header.inRange(ref)) {
      return Variable.implicitBool(ref.getIndex());
    }
    return null;
  }

  public boolean isDeclared(VarRef ref) {
    return declaredVariables.containsKey(ref);
  }

  /** Returns the variables that have a {@code var} line, sorted by kind then index. */
  public Collection<Variable> getDeclaredVariables() {
    return declaredVariables.values();
  }

  /** Returns all clauses in file order. */
  public List<Clause> getClauses() {
    return clauses;
  }

  /** Returns the soft clauses in file order. Each one contributes weight * violation. */
  public List<Clause> getSoftClauses() {
    return softClauses;
  }

  /** Returns true if a hard clause has no literal, which makes the instance infeasible. */
  public boolean hasEmptyHardClause() {
    return hasEmptyHardClause;
  }

  /** Returns the linear constraints in file order. */
  public Collection<LinearConstraint> getLinearConstraints() {
    return constraints.values();
  }

  /** Returns the constraint with the given id, or null. */
  public LinearConstraint getLinearConstraint(String id) {
    return constraints.get(id);
  }

  /** Returns every stored {@code <=} fact, in file order. */
  public List<NormalizedConstraint> getNormalizedConstraints() {
    List<NormalizedConstraint> result = new ArrayList<>();
    for (LinearConstraint constraint : constraints.values()) {
      result.addAll(constraint.getNormalized());
    }
    return result;
  }

  public Collection<Indicator> getIndicators() {
    return indicators.values();
  }

  /** Returns the indicator gating the constraint id, or null if the constraint always holds. */
  public Indicator getIndicator(String constraintId) {
    return indicators.get(constraintId);
  }

  public boolean hasObjective() {
    return objective != null;
  }

  /** Checks that an objective was given, and returns it. */
  public Objective getObjective() {
    if (objective == null) {
      throw new IllegalStateException("Instance.getObjective(): the instance has no objective");
    }
    return objective;
  }

  /** Returns the query directives in file order. */
  public List<QueryDirective> getQueries() {
    return queries;
  }

  /**
   * Returns the first {@code solve} directive, or the default: solve-opt when there is a non-empty
   * objective or a soft clause, solve-feas otherwise.
   */
  public QueryDirective effectiveDirective() {
    return effectiveDirective;
  }

  public Options getOptions() {
    return options;
  }

  /** Returns the advisory diagnostics collected while loading. */
  public List<FormatWarning> getWarnings() {
    return warnings;
  }

  /** Returns sum(coef * value) over the objective terms, 0 without objective. */
  public double linearObjective(Map<VarRef, Double> assignment) {
    if (objective == null) {
      return 0.0;
    }
    return evaluate(objective.getTerms(), assignment);
  }

  /** Returns the sum of the weights of the violated soft clauses. */
  public double softPenalty(Map<VarRef, Double> assignment) {
    double penalty = 0.0;
    for (Clause clause : softClauses) {
      if (!isSatisfied(clause, assignment)) {
        penalty += clause.getWeight();
      }
    }
    return penalty;
  }

  /** Returns linearObjective(assignment) + softPenalty(assignment). */
  public double totalObjective(Map<VarRef, Double> assignment) {
    return linearObjective(assignment) + softPenalty(assignment);
  }

  /** Returns sum(coef * value) over terms. */
  public static double evaluate(List<LinearTerm> terms, Map<VarRef, Double> assignment) {
    double sum = 0.0;
    for (LinearTerm term : terms) {
      sum += term.getCoefficient() * valueOf(term.getVar(), assignment);
    }
    return sum;
  }

  /** Returns whether the literal holds. Boolean values are rounded at 0.5. */
  public static boolean isTrue(Literal literal, Map<VarRef, Double> assignment) {
    return literal.isTrue(valueOf(literal.getVar(), assignment) >= 0.5);
  }

  /** Returns true if at least one literal of the clause holds. */
  public static boolean isSatisfied(Clause clause, Map<VarRef, Double> assignment) {
    for (Literal literal : clause.getLiterals()) {
      if (isTrue(literal, assignment)) {
        return true;
      }
    }
    return false;
  }

  private static double valueOf(VarRef ref, Map<VarRef, Double> assignment) {
    Double value = assignment.get(ref);
    if (value == null) {
      throw new IllegalArgumentException("no value assigned to " + ref);
    }
    return value;
  }

  @Override
  public String toString() {
    return String.format(
        "%s: %d clauses, %d linear constraints, %d indicators, %s",
        header,
        clauses.size(),
        constraints.size(),
        indicators.size(),
        effectiveDirective);
  }

  private final Header header;
  private final Map<VarRef, Variable> declaredVariables;
  private final List<Clause> clauses;
  private final List<Clause> softClauses;
  private final boolean hasEmptyHardClause;
  private final Map<String, LinearConstraint> constraints;
  private final Map<String, Indicator> indicators;
  private final Objective objective;
  private final List<QueryDirective> queries;
  private final QueryDirective effectiveDirective;
  private final Options options;
  private final List<FormatWarning> warnings;
}
