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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.wmibo.format.Tokenizer;
import org.wmibo.format.WmiboFormatException.InvalidSyntax;
import org.wmibo.model.VarKind;
import org.wmibo.model.VarRef;

/**
 * Reads solver output written in the {@code s}/{@code o}/{@code v} contract.
 *
 * <p>Comment lines and lines with another leading token are skipped. Malformed {@code s}, {@code o}
 * or {@code v} lines throw {@link InvalidSyntax}.
 */
public final class SolutionReader {
  private static final Logger logger = Logger.getLogger(SolutionReader.class.getName());

  private static final Pattern ASSIGNMENT =
      Pattern.compile("([bir])(\\d+)=([+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|[+-]?inf)");

  private SolutionReader() {}

  public static Solution read(Reader reader) {
    BufferedReader lines =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    Solution.Builder solution = Solution.newBuilder();
    int lineNumber = 0;
    try {
      String line;
      while ((line = lines.readLine()) != null) {
        lineNumber++;
        List<String> tokens = Tokenizer.tokenize(line);
        if (tokens.isEmpty()) {
          continue;
        }
        switch (tokens.get(0)) {
          case "s":
            solution.setStatus(parseStatus(tokens, lineNumber));
            break;
          case "o":
            if (tokens.size() != 2) {
              throw new InvalidSyntax(lineNumber, "expected 'o <value>'");
            }
            solution.setObjectiveValue(parseValue(tokens.get(1), lineNumber));
            break;
          case "v":
            for (String token : tokens.subList(1, tokens.size())) {
              parseAssignment(token, lineNumber, solution);
            }
            break;
          default:
            logger.fine("skipping solver output line " + lineNumber + ": " + line);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read solution at line " + (lineNumber + 1), e);
    }
    return solution.build();
  }

  public static Solution parse(String text) {
    return read(new StringReader(text));
  }

  private static SolveStatus parseStatus(List<String> tokens, int line) {
    String label = String.join(" ", tokens.subList(1, tokens.size()));
    SolveStatus status = SolveStatus.fromLabel(label);
    if (status == null) {
      throw new InvalidSyntax(line, "unknown status '" + label + "'");
    }
    return status;
  }

  private static void parseAssignment(String token, int line, Solution.Builder solution) {
    Matcher m = ASSIGNMENT.matcher(token);
    if (!m.matches()) {
      throw new InvalidSyntax(line, "invalid assignment '" + token + "', expected <var>=<value>");
    }
    int index;
    try {
      index = Integer.parseInt(m.group(2));
    } catch (NumberFormatException e) {
      throw new InvalidSyntax(line, "variable index in '" + token + "' is too large");
    }
    VarRef ref = new VarRef(VarKind.fromPrefix(m.group(1).charAt(0)), index);
    solution.putValue(ref, parseValue(m.group(3), line));
  }

  private static double parseValue(String token, int line) {
    switch (token) {
      case "inf":
      case "+inf":
        return Double.POSITIVE_INFINITY;
      case "-inf":
        return Double.NEGATIVE_INFINITY;
      default:
        try {
          return Double.parseDouble(token);
        } catch (NumberFormatException e) {
          throw new InvalidSyntax(line, "'" + token + "' is not a number");
        }
    }
  }
}
