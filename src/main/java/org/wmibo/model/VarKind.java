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

/** The three variable namespaces of a WMIBO instance. */
public enum VarKind {
  BOOL('b'),
  INT('i'),
  REAL('r');

  VarKind(char prefix) {
    this.prefix = prefix;
  }

  /** Returns the one letter prefix used in variable tokens, e.g. 'b' for b3. */
  public char getPrefix() {
    return prefix;
  }

  /** Returns the kind for the given prefix, or null if the prefix is not a variable prefix. */
  public static VarKind fromPrefix(char prefix) {
    for (VarKind kind : values()) {
      if (kind.prefix == prefix) {
        return kind;
      }
    }
    return null;
  }

  private final char prefix;
}
