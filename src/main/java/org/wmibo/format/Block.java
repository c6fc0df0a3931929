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

/** Blocks opened by {@code begin <name>}. NONE is the top level. */
public enum Block {
  NONE(""),
  CNF("cnf"),
  WCNF("wcnf"),
  LIN("lin"),
  IND("ind"),
  OBJ("obj"),
  OPT("opt"),
  QUERY("query");

  Block(String keyword) {
    this.keyword = keyword;
  }

  public String getKeyword() {
    return keyword;
  }

  /** Returns the block named keyword, or null. NONE has no name. */
  public static Block fromKeyword(String keyword) {
    for (Block block : values()) {
      if (block != NONE && block.keyword.equals(keyword)) {
        return block;
      }
    }
    return null;
  }

  private final String keyword;
}
