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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a line into whitespace separated tokens.
 *
 * <p>Blank lines and comment lines (first token {@code c} or starting with {@code #}) give no
 * token. A token starting with {@code #} ends the line. Never fails.
 */
public final class Tokenizer {
  private Tokenizer() {}

  public static List<String> tokenize(String line) {
    List<String> tokens = new ArrayList<>();
    int length = line.length();
    int i = 0;
    while (i < length) {
      while (i < length && Character.isWhitespace(line.charAt(i))) {
        i++;
      }
      if (i >= length || line.charAt(i) == '#') {
        break;
      }
      int start = i;
      while (i < length && !Character.isWhitespace(line.charAt(i))) {
        i++;
      }
      tokens.add(line.substring(start, i));
    }
    if (!tokens.isEmpty() && tokens.get(0).equals("c")) {
      return Collections.emptyList();
    }
    return tokens;
  }
}
