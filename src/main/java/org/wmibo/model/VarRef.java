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

import java.util.Comparator;
import java.util.Objects;

/** Reference to a variable by kind and 1-based index, e.g. i4. */
public final class VarRef implements Comparable<VarRef> {
  private static final Comparator<VarRef> ORDER =
      Comparator.comparing(VarRef::getKind).thenComparingInt(VarRef::getIndex);

  public VarRef(VarKind kind, int index) {
    this.kind = Objects.requireNonNull(kind);
    this.index = index;
  }

  public static VarRef bool(int index) {
    return new VarRef(VarKind.BOOL, index);
  }

  public static VarRef integer(int index) {
    return new VarRef(VarKind.INT, index);
  }

  public static VarRef real(int index) {
    return new VarRef(VarKind.REAL, index);
  }

  public VarKind getKind() {
    return kind;
  }

  /** Returns the 1-based index within the kind's namespace. */
  public int getIndex() {
    return index;
  }

  @Override
  public int compareTo(VarRef other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VarRef)) {
      return false;
    }
    VarRef other = (VarRef) o;
    return kind == other.kind && index == other.index;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, index);
  }

  @Override
  public String toString() {
    return kind.getPrefix() + Integer.toString(index);
  }

  private final VarKind kind;
  private final int index;
}
