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

package org.wmibo.tools;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.logging.Logger;
import org.wmibo.format.WmiboFormatException;
import org.wmibo.format.WmiboLoader;
import org.wmibo.model.Instance;
import org.wmibo.solution.CheckReport;
import org.wmibo.solution.Solution;
import org.wmibo.solution.SolutionChecker;
import org.wmibo.solution.SolutionReader;

/**
 * Checks solver output against a WMIBO instance.
 *
 * <pre>
 * CheckSolution instance.wmibo --sol out.txt
 * solver instance.wmibo | CheckSolution instance.wmibo
 * </pre>
 *
 * <p>Exit code 0 when the solution is valid, 1 when a check fails, 2 on a parse error.
 */
public final class CheckSolution {
  private static final Logger logger = Logger.getLogger(CheckSolution.class.getName());

  static final int OK = 0;
  static final int INVALID = 1;
  static final int PARSE_ERROR = 2;

  private CheckSolution() {}

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }

  /** Runs the check, reading the solution from in when no {@code --sol} file is given. */
  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    String instancePath = null;
    String solutionPath = null;
    for (int i = 0; i < args.length; ++i) {
      if (args[i].equals("--sol") && i + 1 < args.length) {
        solutionPath = args[++i];
      } else if (instancePath == null && !args[i].startsWith("--")) {
        instancePath = args[i];
      } else {
        err.println("usage: CheckSolution <instance.wmibo> [--sol <solution.txt>]");
        return PARSE_ERROR;
      }
    }
    if (instancePath == null) {
      err.println("usage: CheckSolution <instance.wmibo> [--sol <solution.txt>]");
      return PARSE_ERROR;
    }

    Instance instance;
    try (Reader reader = Files.newBufferedReader(Paths.get(instancePath), StandardCharsets.UTF_8)) {
      instance = WmiboLoader.load(reader);
    } catch (WmiboFormatException e) {
      err.println("PARSE ERROR (instance): " + e.getMessage());
      return PARSE_ERROR;
    } catch (IOException | UncheckedIOException e) {
      err.println("PARSE ERROR (instance): " + e.getMessage());
      return PARSE_ERROR;
    }

    Solution solution;
    try {
      if (solutionPath == null) {
        // in is owned by the caller and stays open.
        solution = SolutionReader.read(new InputStreamReader(in, StandardCharsets.UTF_8));
      } else {
        try (Reader reader =
            Files.newBufferedReader(Paths.get(solutionPath), StandardCharsets.UTF_8)) {
          solution = SolutionReader.read(reader);
        }
      }
    } catch (WmiboFormatException e) {
      err.println("PARSE ERROR (solution): " + e.getMessage());
      return PARSE_ERROR;
    } catch (IOException | UncheckedIOException e) {
      err.println("PARSE ERROR (solution): " + e.getMessage());
      return PARSE_ERROR;
    }

    CheckReport report = SolutionChecker.check(instance, solution);
    logger.fine("checked " + instancePath + " against " + solution.getStatus());
    out.println("WMIBO VALIDATION REPORT");
    out.println("  instance: " + instancePath);
    out.println("  status:   " + solution.getStatus().getLabel());
    if (solution.hasObjectiveValue()) {
      out.println(String.format("  o(reported): %.12g", solution.getObjectiveValue()));
    }
    out.print(report);
    return report.isOk() ? OK : INVALID;
  }
}
