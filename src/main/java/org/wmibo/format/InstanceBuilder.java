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
import java.util.Map;
import org.wmibo.format.WmiboFormatException.DuplicateHeader;
import org.wmibo.format.WmiboFormatException.MissingHeader;
import org.wmibo.model.Clause;
import org.wmibo.model.FormatWarning;
import org.wmibo.model.Header;
import org.wmibo.model.Instance;
import org.wmibo.model.Options;

/**
 * Parse state of one load: the header, the block tracker and the registries.
 *
 * <p>Directives are routed to their registry as they arrive. {@link #build} runs the whole-file
 * checks and returns the instance. A builder is used for exactly one input.
 */
public final class InstanceBuilder {
  public InstanceBuilder() {
    this.tracker = new BlockTracker();
    this.clauses = new ArrayList<>();
    this.constraints = new ConstraintRegistry();
    this.indicators = new IndicatorTable();
    this.objective = new ObjectiveAssembler();
    this.queries = new QueryRegistry();
    this.options = Options.newBuilder();
    this.header = null;
    this.symbols = null;
  }

  /** Checks the placement of d and records its content. */
  public void accept(Directive d) {
    if (d.getType() == Directive.Type.HEADER) {
      if (header != null) {
        throw new DuplicateHeader(d.getLine(), header.getLine());
      }
      header = ((Directive.HeaderLine) d).getHeader();
      symbols = new SymbolTable(header);
      return;
    }
    if (header == null) {
      throw new MissingHeader(d.getLine());
    }
    tracker.accept(d);
    switch (d.getType()) {
      case BEGIN:
      case END:
        break;
      case VAR:
        symbols.declare((Directive.VarDecl) d);
        break;
      case CLAUSE:
      case WEIGHTED_CLAUSE:
        clauses.add(((Directive.ClauseLine) d).toClause());
        break;
      case LINEAR:
        constraints.insert((Directive.LinearLine) d);
        break;
      case INDICATOR:
        indicators.bind((Directive.IndicatorLine) d);
        break;
      case OBJECTIVE:
        objective.set((Directive.ObjectiveLine) d);
        break;
      case OPTION:
        Directive.OptionLine opt = (Directive.OptionLine) d;
        options.put(opt.getKey(), opt.getValue());
        break;
      case SOLVE:
      case QUERY:
        queries.add(((Directive.QueryLine) d).getQuery());
        break;
      default:
        throw new AssertionError(d.getType());
    }
  }

  /**
   * Validates everything read so far and returns the instance.
   *
   * @param lastLine the number of the last line read, used for end of input errors
   * @param overrides options replacing the ones given with {@code opt} lines
   */
  public Instance build(int lastLine, Map<String, String> overrides) {
    if (header == null) {
      throw new MissingHeader(lastLine);
    }
    options.putAll(overrides);
    boolean hasSoft = false;
    for (Clause clause : clauses) {
      hasSoft |= clause.isSoft();
    }
    Instance instance =
        new Instance(
            header,
            symbols.getDeclared(),
            clauses,
            constraints.getConstraints(),
            indicators.getBindings(),
            objective.get(),
            queries.getQueries(),
            queries.effectiveDirective(objective.hasTerms(), hasSoft),
            options.build(),
            checkCounters());
    Validator.validate(instance);
    tracker.finish(lastLine);
    return instance;
  }

  /** Compares the optional header counters with what was read. */
  private List<FormatWarning> checkCounters() {
    if (!header.hasCounters()) {
      return Collections.emptyList();
    }
    List<FormatWarning> warnings = new ArrayList<>();
    compare(warnings, "clauses", header.getNumClauses(), clauses.size());
    compare(warnings, "linear constraints", header.getNumLinear(), constraints.size());
    compare(warnings, "indicators", header.getNumIndicators(), indicators.size());
    return warnings;
  }

  private void compare(List<FormatWarning> warnings, String what, int announced, int actual) {
    if (announced != actual) {
      warnings.add(
          new FormatWarning(
              header.getLine(),
              String.format("header announces %d %s, found %d", announced, what, actual)));
    }
  }

  private final BlockTracker tracker;
  private final List<Clause> clauses;
  private final ConstraintRegistry constraints;
  private final IndicatorTable indicators;
  private final ObjectiveAssembler objective;
  private final QueryRegistry queries;
  private final Options.Builder options;
  private Header header;
  private SymbolTable symbols;
}
