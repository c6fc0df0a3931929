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

/** A boolean, integer or real variable of the instance. */
public final class Variable {
  public Variable(VarRef ref, Domain domain, String name, boolean declared, int line) {
    this.ref = ref;
    this.domain = domain;
    this.name = name == null ? "" : name;
    this.declared = declared;
    this.line = line;
  }

  /** Returns the implicit [0, 1] boolean used when no {@code var b} line exists. */
  public static Variable implicitBool(int index) {
    return new Variable(VarRef.bool(index), Domain.bool(), "", false, 0);
  }

  public VarRef getRef() {
    return ref;
  }

  public VarKind getKind() {
    return ref.getKind();
  }

  public int getIndex() {
    return ref.getIndex();
  }

  public Domain getDomain() {
    return domain;
  }

  /** Returns true for integer and boolean variables. */
  public boolean isIntegral() {
    return ref.getKind() != VarKind.REAL;
  }

  /** Returns the name given with name=..., or the empty string. */
  public String getName() {
    return name;
  }

  /** Returns whether a {@code var} line declared this variable. */
  public boolean isDeclared() {
    return declared;
  }

  /** Returns the line of the declaration, or 0 for implicit variables. */
  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    if (name.isEmpty()) {
      return String.format("%s(%s)", ref, domain);
    }
    return String.format("%s:%s(%s)", ref, name, domain);
  }

  private final VarRef ref;
  private final Domain domain;
  private final String name;
  private final boolean declared;
  private final int line;
}
