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

import java.util.Objects;

/**
 * Inclusive value range of a variable.
 *
 * <p>Bounds may be infinite. The domain does not carry integrality; that follows from the kind of
 * the variable it is attached to.
 */
public final class Domain {
  /** How the domain was written in the source file. */
  public enum Form {
    BOUNDS,
    BIN,
    FREE
  }

  private static final Domain BOOL = new Domain(0.0, 1.0, Form.BOUNDS);
  private static final Domain BIN = new Domain(0.0, 1.0, Form.BIN);
  private static final Domain FREE =
      new Domain(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, Form.FREE);

  private Domain(double lowerBound, double upperBound, Form form) {
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.form = form;
  }

  /** The implicit domain of a boolean variable. */
  public static Domain bool() {
    return BOOL;
  }

  /** The {@code bin} alias, [0, 1]. */
  public static Domain binary() {
    return BIN;
  }

  /** The {@code free} domain, (-inf, +inf). */
  public static Domain free() {
    return FREE;
  }

  /** Creates [lb, ub]. The caller is responsible for rejecting lb > ub. */
  public static Domain bounded(double lb, double ub) {
    return new Domain(lb, ub, Form.BOUNDS);
  }

  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  public Form getForm() {
    return form;
  }

  /** Returns true if value lies in the domain, widened by tolerance on both sides. */
  public boolean contains(double value, double tolerance) {
    return value >= lowerBound - tolerance && value <= upperBound + tolerance;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Domain)) {
      return false;
    }
    Domain other = (Domain) o;
    return Double.compare(lowerBound, other.lowerBound) == 0
        && Double.compare(upperBound, other.upperBound) == 0
        && form == other.form;
  }

  @Override
  public int hashCode() {
    return Objects.hash(lowerBound, upperBound, form);
  }

  @Override
  public String toString() {
    switch (form) {
      case BIN:
        return "bin";
      case FREE:
        return "free";
      default:
        return "[" + displayBound(lowerBound) + "," + displayBound(upperBound) + "]";
    }
  }

  private static String displayBound(double bound) {
    if (bound == Double.POSITIVE_INFINITY) {
      return "inf";
    } else if (bound == Double.NEGATIVE_INFINITY) {
      return "-inf";
    } else if (bound == Math.rint(bound) && Math.abs(bound) < 1e15) {
      return Long.toString((long) bound);
    }
    return Double.toString(bound);
  }

  private final double lowerBound;
  private final double upperBound;
  private final Form form;
}
