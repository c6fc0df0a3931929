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

/**
 * Error raised while loading a WMIBO file.
 *
 * <p>Loading stops at the first error. Each subclass names one kind of failure; all of them carry
 * the 1-based source line (0 when the error is not tied to a line) and a reason.
 */
public class WmiboFormatException extends RuntimeException {
  public WmiboFormatException(int line, String reason) {
    // Call constructor of parent Exception
    super("line " + line + ": " + reason);
    this.line = line;
    this.reason = reason;
  }

  /** Returns the 1-based line number, or 0. */
  public int getLine() {
    return line;
  }

  /** Returns the message without the line prefix. */
  public String getReason() {
    return reason;
  }

  /** Wrong arity, bad number, bad literal or unknown directive. */
  public static class InvalidSyntax extends WmiboFormatException {
    public InvalidSyntax(int line, String reason) {
      super(line, reason);
    }
  }

  /** Header version other than 1. */
  public static class UnsupportedVersion extends WmiboFormatException {
    public UnsupportedVersion(int line, String version) {
      super(line, "unsupported WMIBO version '" + version + "', expected 1");
    }
  }

  /** A second {@code p} line. */
  public static class DuplicateHeader extends WmiboFormatException {
    public DuplicateHeader(int line, int firstLine) {
      super(line, "duplicate header, first header is on line " + firstLine);
    }
  }

  /** The input has no {@code p wmibo} line. */
  public static class MissingHeader extends WmiboFormatException {
    public MissingHeader(int line) {
      super(line, "missing header 'p wmibo ...'");
    }
  }

  /** {@code begin} inside another block. */
  public static class NestedBlock extends WmiboFormatException {
    public NestedBlock(int line, String opened, String current) {
      super(line, "cannot begin block '" + opened + "' inside block '" + current + "'");
    }
  }

  /** {@code end} outside any block. */
  public static class UnmatchedEnd extends WmiboFormatException {
    public UnmatchedEnd(int line) {
      super(line, "'end' without matching 'begin'");
    }
  }

  /** A directive in a block of another family, or outside any block. */
  public static class MisplacedDirective extends WmiboFormatException {
    public MisplacedDirective(int line, String directive, String where) {
      super(line, "directive '" + directive + "' is not allowed " + where);
    }
  }

  /** End of input inside a block. */
  public static class UnterminatedBlock extends WmiboFormatException {
    public UnterminatedBlock(int line, String block, int openedOn) {
      super(line, "block '" + block + "' opened on line " + openedOn + " is never closed");
    }
  }

  /** A second {@code var} line for the same variable. */
  public static class DuplicateVariable extends WmiboFormatException {
    public DuplicateVariable(int line, String var, int firstLine) {
      super(line, "variable " + var + " already declared on line " + firstLine);
    }
  }

  /** Inverted bounds or a domain that does not fit the variable kind. */
  public static class InvalidDomain extends WmiboFormatException {
    public InvalidDomain(int line, String reason) {
      super(line, reason);
    }
  }

  /** Variable index outside [1, count] from the header. */
  public static class IndexOutOfRange extends WmiboFormatException {
    public IndexOutOfRange(int line, String var, int count) {
      super(line, "variable " + var + " is out of range [1, " + count + "]");
    }
  }

  /** Constraint id used twice. */
  public static class DuplicateConstraintId extends WmiboFormatException {
    public DuplicateConstraintId(int line, String id, int firstLine) {
      super(line, "constraint id '" + id + "' already used on line " + firstLine);
    }
  }

  /** Indicator on a constraint id that does not exist. */
  public static class UnknownConstraintId extends WmiboFormatException {
    public UnknownConstraintId(int line, String id) {
      super(line, "indicator refers to unknown constraint id '" + id + "'");
    }
  }

  /** Two different literals bound to the same constraint id. */
  public static class IndicatorConflict extends WmiboFormatException {
    public IndicatorConflict(
        int line, String id, String existing, String requested, int firstLine) {
      super(
          line,
          String.format(
              "constraint '%s' is already gated by %s (line %d), cannot gate it by %s",
              id, existing, firstLine, requested));
    }
  }

  /** A second {@code obj} line. */
  public static class DuplicateObjective extends WmiboFormatException {
    public DuplicateObjective(int line, int firstLine) {
      super(line, "objective already defined on line " + firstLine);
    }
  }

  /** Integer or real variable used in a linear expression without a {@code var} line. */
  public static class UndeclaredVariable extends WmiboFormatException {
    public UndeclaredVariable(int line, String var) {
      super(line, "variable " + var + " is used but never declared with 'var'");
    }
  }

  private final int line;
  private final String reason;
}
