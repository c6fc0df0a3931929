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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public final class BlockTrackerTest {
  private static void feed(BlockTracker tracker, int line, String text) {
    tracker.accept(DirectiveParser.parse(Tokenizer.tokenize(text), line));
  }

  @Test
  public void testAccept_blockLifecycle() {
    final BlockTracker tracker = new BlockTracker();
    assertThat(tracker.getCurrent()).isEqualTo(Block.NONE);
    feed(tracker, 1, "begin cnf");
    assertThat(tracker.getCurrent()).isEqualTo(Block.CNF);
    feed(tracker, 2, "cl hard b1 0");
    feed(tracker, 3, "end");
    assertThat(tracker.getCurrent()).isEqualTo(Block.NONE);
    tracker.finish(3);
  }

  @Test
  public void testAccept_nestedBlock() {
    final BlockTracker tracker = new BlockTracker();
    feed(tracker, 1, "begin lin");
    final WmiboFormatException e =
        assertThrows(WmiboFormatException.NestedBlock.class, () -> feed(tracker, 2, "begin ind"));
    assertThat(e.getLine()).isEqualTo(2);
  }

  @Test
  public void testAccept_unmatchedEnd() {
    final BlockTracker tracker = new BlockTracker();
    assertThrows(WmiboFormatException.UnmatchedEnd.class, () -> feed(tracker, 4, "end"));
  }

  @Test
  public void testAccept_directiveOutsideItsBlock() {
    final BlockTracker tracker = new BlockTracker();
    assertThrows(
        WmiboFormatException.MisplacedDirective.class, () -> feed(tracker, 1, "cl hard b1 0"));
    feed(tracker, 2, "begin wcnf");
    assertThrows(
        WmiboFormatException.MisplacedDirective.class, () -> feed(tracker, 3, "cl soft b1 0"));
    feed(tracker, 4, "wcl 3 soft b1 0");
  }

  @Test
  public void testAccept_optionAnywhere() {
    final BlockTracker tracker = new BlockTracker();
    feed(tracker, 1, "opt time_limit 10");
    feed(tracker, 2, "begin opt");
    feed(tracker, 3, "opt seed 7");
    feed(tracker, 4, "end");
    feed(tracker, 5, "begin lin");
    feed(tracker, 6, "opt time_limit 3");
    assertThat(tracker.getCurrent()).isEqualTo(Block.LIN);
    feed(tracker, 7, "lc C <= 1 : 1 r1");
  }

  @Test
  public void testAccept_varAnywhere() {
    final BlockTracker tracker = new BlockTracker();
    feed(tracker, 1, "var r 1 free");
    feed(tracker, 2, "begin lin");
    feed(tracker, 3, "var i 1 [0,5]");
    feed(tracker, 4, "lc C <= 1 : 1 i1");
    feed(tracker, 5, "end");
    feed(tracker, 6, "begin query");
    feed(tracker, 7, "var r 2 free");
    feed(tracker, 8, "solve opt");
    feed(tracker, 9, "end");
    tracker.finish(9);
  }

  @Test
  public void testFinish_unterminatedBlock() {
    final BlockTracker tracker = new BlockTracker();
    feed(tracker, 2, "begin ind");
    final WmiboFormatException.UnterminatedBlock e =
        assertThrows(WmiboFormatException.UnterminatedBlock.class, () -> tracker.finish(9));
    assertThat(e.getLine()).isEqualTo(9);
    assertThat(e).hasMessageThat().contains("ind");
  }
}
