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

/** A non-fatal diagnostic attached to a loaded instance. */
public final class FormatWarning {
  public FormatWarning(int line, String message) {
    this.line = line;
    this.message = message;
  }

  public int getLine() {
    return line;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return "line " + line + ": " + message;
  }

  private final int line;
  private final String message;
}
