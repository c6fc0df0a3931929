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

import static com.google.common.truth.Truth.assertThat;

import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.wmibo.format.WmiboLoader;
import org.wmibo.model.Instance;
import org.wmibo.model.VarKind;
import org.wmibo.model.VarRef;

public final class SolutionWriterTest {
  private static final Instance INSTANCE =
      WmiboLoader.parse("p wmibo 1 2 1 1\nvar i 1 [0,10]\nvar r 1 free\n");

  @Test
  public void testRender_fullSolution() throws Exception {
    final Solution solution =
        Solution.newBuilder()
            .setStatus(SolveStatus.OPTIMUM_FOUND)
            .setObjectiveValue(12.5)
            .putValue(VarRef.real(1), 0.25)
            .putValue(VarRef.bool(2), 0)
            .putValue(VarRef.integer(1), 3)
            .putValue(VarRef.bool(1), 1)
            .build();
    assertThat(SolutionWriter.render(INSTANCE, solution))
        .containsExactly("s OPTIMUM FOUND", "o 12.5", "v b1=1 b2=0 i1=3 r1=0.25")
        .inOrder();

    final StringWriter out = new StringWriter();
    SolutionWriter.write(INSTANCE, solution, out);
    assertThat(out.toString()).isEqualTo("s OPTIMUM FOUND\no 12.5\nv b1=1 b2=0 i1=3 r1=0.25\n");
  }

  @Test
  public void testRender_statusOnly() {
    final Solution solution = Solution.newBuilder().setStatus(SolveStatus.INFEASIBLE).build();
    assertThat(SolutionWriter.render(INSTANCE, solution)).containsExactly("s INFEASIBLE");
    assertThat(SolutionWriter.toString(INSTANCE, Solution.newBuilder().build()))
        .isEqualTo("s UNKNOWN\n");
  }

  @Test
  public void testRender_skipsMissingValues() {
    final Solution solution =
        Solution.newBuilder()
            .setStatus(SolveStatus.SATISFIABLE)
            .putValue(VarRef.bool(2), 1)
            .putValue(VarRef.bool(5), 1)
            .build();
    assertThat(SolutionWriter.render(INSTANCE, solution))
        .containsExactly("s SATISFIABLE", "v b2=1")
        .inOrder();
  }

  @Test
  public void testRender_wrapsLongAssignments() {
    final Instance wide = WmiboLoader.parse("p wmibo 1 45 0 0\n");
    final Solution.Builder builder = Solution.newBuilder().setStatus(SolveStatus.SATISFIABLE);
    for (int i = 1; i <= 45; ++i) {
      builder.putValue(VarRef.bool(i), i % 2);
    }
    final List<String> lines = SolutionWriter.render(wide, builder.build());
    assertThat(lines).hasSize(4);
    assertThat(lines.get(1).split(" ")).hasLength(SolutionWriter.VALUES_PER_LINE + 1);
    assertThat(lines.get(3)).isEqualTo("v b41=1 b42=0 b43=1 b44=0 b45=1");
  }

  @Test
  public void testFormatValue() {
    assertThat(SolutionWriter.formatValue(VarKind.INT, 3.0000001)).isEqualTo("3");
    assertThat(SolutionWriter.formatValue(VarKind.BOOL, 1.0)).isEqualTo("1");
    assertThat(SolutionWriter.formatValue(VarKind.REAL, 2.0)).isEqualTo("2");
    assertThat(SolutionWriter.formatValue(VarKind.REAL, -0.125)).isEqualTo("-0.125");
    assertThat(SolutionWriter.formatValue(VarKind.INT, Double.NEGATIVE_INFINITY))
        .isEqualTo("-inf");
    assertThat(SolutionWriter.formatNumber(Double.POSITIVE_INFINITY)).isEqualTo("inf");
    assertThat(SolutionWriter.formatNumber(Double.NaN)).isEqualTo("nan");
  }
}
