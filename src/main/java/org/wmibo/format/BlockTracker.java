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

import org.wmibo.format.WmiboFormatException.MisplacedDirective;
import org.wmibo.format.WmiboFormatException.NestedBlock;
import org.wmibo.format.WmiboFormatException.UnmatchedEnd;
import org.wmibo.format.WmiboFormatException.UnterminatedBlock;

/**
 * Tracks the current {@code begin X ... end} block.
 *
 * <p>Blocks do not nest. {@code var} and {@code opt} lines are accepted anywhere, inside or
 * outside a block. Every other directive lives in its own block.
 */
public final class BlockTracker {
  public BlockTracker() {
    this.current = Block.NONE;
    this.openedOn = 0;
  }

  public Block getCurrent() {
    return current;
  }

  /** Updates the state for d, or throws if d is not allowed here. */
  public void accept(Directive d) {
    switch (d.getType()) {
      case HEADER:
        return;
      case BEGIN:
        Block block = ((Directive.Begin) d).getBlock();
        if (current != Block.NONE) {
          throw new NestedBlock(d.getLine(), block.getKeyword(), current.getKeyword());
        }
        current = block;
        openedOn = d.getLine();
        return;
      case END:
        if (current == Block.NONE) {
          throw new UnmatchedEnd(d.getLine());
        }
        current = Block.NONE;
        openedOn = 0;
        return;
      case VAR:
      case OPTION:
        return;
      case CLAUSE:
      case WEIGHTED_CLAUSE:
      case LINEAR:
      case INDICATOR:
      case OBJECTIVE:
      case SOLVE:
      case QUERY:
        if (current != d.getType().getHome()) {
          throw misplaced(d);
        }
        return;
    }
    throw new AssertionError(d.getType());
  }

  /** Checks that no block is left open when the input ends at lastLine. */
  public void finish(int lastLine) {
    if (current != Block.NONE) {
      throw new UnterminatedBlock(lastLine, current.getKeyword(), openedOn);
    }
  }

  private MisplacedDirective misplaced(Directive d) {
    String keyword = d.getType().getKeyword();
    if (current == Block.NONE) {
      String home = d.getType().getHome().getKeyword();
      return new MisplacedDirective(
          d.getLine(), keyword, "outside a block, expected inside 'begin " + home + "'");
    }
    return new MisplacedDirective(
        d.getLine(), keyword, "inside block '" + current.getKeyword() + "'");
  }

  private Block current;
  private int openedOn;
}
