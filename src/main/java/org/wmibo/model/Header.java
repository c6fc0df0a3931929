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

/**
 * The {@code p wmibo <ver> <B> <I> <R> [<NC> <NL> <NIND>]} line.
 *
 * <p>The optional counters are advisory and are -1 when absent.
 */
public final class Header {
  public static final int ABSENT = -1;

  public Header(
      int version,
      int numBools,
      int numInts,
      int numReals,
      int numClauses,
      int numLinear,
      int numIndicators,
      int line) {
    this.version = version;
    this.numBools = numBools;
    this.numInts = numInts;
    this.numReals = numReals;
    this.numClauses = numClauses;
    this.numLinear = numLinear;
    this.numIndicators = numIndicators;
    this.line = line;
  }

  public int getVersion() {
    return version;
  }

  /** Returns the declared number of variables of the given kind. */
  public int count(VarKind kind) {
    switch (kind) {
      case BOOL:
        return numBools;
      case INT:
        return numInts;
      case REAL:
        return numReals;
    }
    throw new AssertionError(kind);
  }

  /** Returns true if ref.getIndex() is in [1, count(ref.getKind())]. */
  public boolean inRange(VarRef ref) {
    return ref.getIndex() >= 1 && ref.getIndex() <= count(ref.getKind());
  }

  public boolean hasCounters() {
    return numClauses != ABSENT;
  }

  public int getNumClauses() {
    return numClauses;
  }

  public int getNumLinear() {
    return numLinear;
  }

  public int getNumIndicators() {
    return numIndicators;
  }

  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    String base = String.format("p wmibo %d %d %d %d", version, numBools, numInts, numReals);
    if (hasCounters()) {
      return base + String.format(" %d %d %d", numClauses, numLinear, numIndicators);
    }
    return base;
  }

  private final int version;
  private final int numBools;
  private final int numInts;
  private final int numReals;
  private final int numClauses;
  private final int numLinear;
  private final int numIndicators;
  private final int line;
}
