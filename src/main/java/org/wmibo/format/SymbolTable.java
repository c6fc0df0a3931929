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
import org.wmibo.format.WmiboFormatException.DuplicateVariable;
import org.wmibo.format.WmiboFormatException.IndexOutOfRange;
import org.wmibo.format.WmiboFormatException.InvalidDomain;
import org.wmibo.model.Domain;
import org.wmibo.model.Header;
import org.wmibo.model.VarKind;
import org.wmibo.model.VarRef;
import org.wmibo.model.Variable;

/**
 * Registry of {@code var} declarations.
 *
 * <p>Booleans need no declaration. Integer and real variables must be declared before the instance
 * is valid, but the declaration may come after the first use.
 */
public final class SymbolTable {
  public SymbolTable(Header header) {
    this.header = header;
    this.declared = new LinkedHashMap<>();
  }

  /** Registers the variable of a {@code var} line. */
  public Variable declare(Directive.VarDecl decl) {
    VarRef ref = decl.getRef();
    int line = decl.getLine();
    checkRange(ref, line);
    Variable previous = declared.get(ref);
    if (previous != null) {
      throw new DuplicateVariable(line, ref.toString(), previous.getLine());
    }
    Variable variable = new Variable(ref, domainOf(decl), decl.getName(), true, line);
    declared.put(ref, variable);
    return variable;
  }

  /**
   * Returns the variable for ref, an implicit boolean, or null for an undeclared integer or real.
   * Throws if ref is outside the header range.
   */
  public Variable lookup(VarRef ref, int line) {
    checkRange(ref, line);
    Variable variable = declared.get(ref);
    if (variable == null && ref.getKind() == VarKind.BOOL) {
      return Variable.implicitBool(ref.getIndex());
    }
    return variable;
  }

  public boolean isDeclared(VarRef ref) {
    return declared.containsKey(ref);
  }

  /** Returns the declared variables in declaration order. */
  public Map<VarRef, Variable> getDeclared() {
    return Collections.unmodifiableMap(declared);
  }

  private void checkRange(VarRef ref, int line) {
    if (!header.inRange(ref)) {
      throw new IndexOutOfRange(line, ref.toString(), header.count(ref.getKind()));
    }
  }

  private static Domain domainOf(Directive.VarDecl decl) {
    int line = decl.getLine();
    VarRef ref = decl.getRef();
    if (decl.isBinary() && (decl.isBounded() || decl.isFree())) {
      throw new InvalidDomain(line, "'bin' cannot be combined with another domain for " + ref);
    }
    if (decl.isFree() && decl.isBounded()) {
      throw new InvalidDomain(line, "'free' cannot be combined with bounds for " + ref);
    }
    double lb = decl.getLowerBound();
    double ub = decl.getUpperBound();
    if (decl.isBounded() && lb > ub) {
      throw new InvalidDomain(line, String.format("inverted bounds [%s,%s] for %s", lb, ub, ref));
    }
    switch (ref.getKind()) {
      case BOOL:
        if (decl.isFree()) {
          throw new InvalidDomain(line, "boolean variable " + ref + " cannot be free");
        }
        if (decl.isBounded() && (lb != 0.0 || ub != 1.0)) {
          throw new InvalidDomain(line, "boolean variable " + ref + " must have domain [0,1]");
        }
        return decl.isBinary() ? Domain.binary() : Domain.bool();
      case INT:
        if (decl.isFree()) {
          throw new InvalidDomain(line, "'free' is only allowed for real variables, not " + ref);
        }
        if (decl.isBinary()) {
          return Domain.binary();
        }
        if (!isIntegralBound(lb) || !isIntegralBound(ub)) {
          throw new InvalidDomain(line, "integer variable " + ref + " needs integral bounds");
        }
        return Domain.bounded(lb, ub);
      case REAL:
        if (decl.isBinary()) {
          throw new InvalidDomain(line, "'bin' is not allowed for real variable " + ref);
        }
        return decl.isFree() ? Domain.free() : Domain.bounded(lb, ub);
    }
    throw new AssertionError(ref.getKind());
  }

  private static boolean isIntegralBound(double bound) {
    return Double.isInfinite(bound) || bound == Math.rint(bound);
  }

  private final Header header;
  private final Map<VarRef, Variable> declared;
}
