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

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.wmibo.model.Instance;
import org.wmibo.model.VarKind;
import org.wmibo.model.VarRef;

/**
 * Renders a {@link Solution} as the WMIBO output contract.
 *
 * <pre>
 * s OPTIMUM FOUND
 * o 12.5
 * v b1=1 b2=0 i1=3 r1=0.25
 * </pre>
 *
 * <p>The {@code o} line is printed when an objective value is present, {@code v} lines when values
 * are present. Variables without a value are skipped. Never fails.
 */
public final class SolutionWriter {
  static final int VALUES_PER_LINE = 20;

  private SolutionWriter() {}

  /** Returns the output lines, without line terminators. */
  public static List<String> render(Instance instance, Solution solution) {
    List<String> lines = new ArrayList<>();
    lines.add("s " + solution.getStatus().getLabel());
    if (solution.hasObjectiveValue()) {
      lines.add("o " + formatNumber(solution.getObjectiveValue()));
    }
    StringBuilder current = new StringBuilder("v");
    int onLine = 0;
    for (VarKind kind : VarKind.values()) {
      for (int index = 1; index <= instance.numVariables(kind); ++index) {
        VarRef ref = new VarRef(kind, index);
        if (!solution.hasValue(ref)) {
          continue;
        }
        if (onLine == VALUES_PER_LINE) {
          lines.add(current.toString());
          current = new StringBuilder("v");
          onLine = 0;
        }
        String value = formatValue(kind, solution.getValue(ref));
        current.append(' ').append(ref).append('=').append(value);
        onLine++;
      }
    }
    if (onLine > 0) {
      lines.add(current.toString());
    }
    return lines;
  }

  /** Returns the rendered lines joined with '\n', with a trailing newline. */
  public static String toString(Instance instance, Solution solution) {
    StringBuilder sb = new StringBuilder();
    for (String line : render(instance, solution)) {
      sb.append(line).append('\n');
    }
    return sb.toString();
  }

  /** Writes the rendered lines to out. Does not close out. */
  public static void write(Instance instance, Solution solution, Writer out) throws IOException {
    out.write(toString(instance, solution));
    out.flush();
  }

  /** Formats booleans and integers without decimal point, reals without trailing zeros. */
  static String formatValue(VarKind kind, double value) {
    if (kind != VarKind.REAL && !Double.isInfinite(value) && !Double.isNaN(value)) {
      return Long.toString(Math.round(value));
    }
    return formatNumber(value);
  }

  static String formatNumber(double value) {
    if (Double.isNaN(value)) {
      return "nan";
    } else if (value == Double.POSITIVE_INFINITY) {
      return "inf";
    } else if (value == Double.NEGATIVE_INFINITY) {
      return "-inf";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
