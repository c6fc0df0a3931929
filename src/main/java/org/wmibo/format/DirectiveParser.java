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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.wmibo.format.WmiboFormatException.InvalidSyntax;
import org.wmibo.format.WmiboFormatException.UnsupportedVersion;
import org.wmibo.model.Clause;
import org.wmibo.model.Header;
import org.wmibo.model.LinearTerm;
import org.wmibo.model.Literal;
import org.wmibo.model.Objective;
import org.wmibo.model.QueryDirective;
import org.wmibo.model.Relation;
import org.wmibo.model.VarKind;
import org.wmibo.model.VarRef;

/**
 * Turns the tokens of one line into a {@link Directive}.
 *
 * <p>Only the shape of the line is checked here: arity, numbers, literal and identifier syntax.
 * Block membership, uniqueness and cross references are checked later.
 */
public final class DirectiveParser {
  private static final Pattern NUMBER =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern UNSIGNED = Pattern.compile("\\d+");
  private static final Pattern LITERAL = Pattern.compile("(~?)([bir])(\\d+)");
  private static final Pattern VARIABLE = Pattern.compile("([bir])(\\d+)");
  private static final Pattern IDENTIFIER = Pattern.compile("\\w+");
  private static final Pattern BOUNDS = Pattern.compile("\\[([^,\\[\\]]+),([^,\\[\\]]+)\\]");

  private static final String NAME_PREFIX = "name=";
  private static final String CLAUSE_END = "0";

  private DirectiveParser() {}

  /** Parses a non-empty token list read from the given 1-based line. */
  public static Directive parse(List<String> tokens, int line) {
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("DirectiveParser.parse(): no token on line " + line);
    }
    String first = tokens.get(0);
    switch (first) {
      case "p":
        return parseHeader(tokens, line);
      case "begin":
        return parseBegin(tokens, line);
      case "end":
        expectArity(tokens, 1, line);
        return new Directive.End(line);
      case "var":
        return parseVar(tokens, line);
      case "cl":
        return parseClause(tokens, line);
      case "wcl":
        return parseWeightedClause(tokens, line);
      case "lc":
        return parseLinear(splitOff(tokens, ":"), line);
      case "ind":
        return parseIndicator(splitOff(tokens, "=>"), line);
      case "obj":
        return parseObjective(splitOff(tokens, ":"), line);
      case "opt":
        return parseOption(tokens, line);
      case "solve":
        return parseSolve(tokens, line);
      case "query":
        return parseQuery(tokens, line);
      default:
        throw new InvalidSyntax(line, "unknown directive '" + first + "'");
    }
  }

  private static Directive parseHeader(List<String> tokens, int line) {
    if (tokens.size() != 6 && tokens.size() != 9) {
      throw new InvalidSyntax(
          line, "header must be 'p wmibo <ver> <B> <I> <R> [<NC> <NL> <NIND>]'");
    }
    if (!tokens.get(1).equals("wmibo")) {
      throw new InvalidSyntax(line, "unknown format '" + tokens.get(1) + "', expected 'wmibo'");
    }
    String version = tokens.get(2);
    if (!NUMBER.matcher(version).matches()) {
      throw new InvalidSyntax(line, "header version '" + version + "' is not a number");
    }
    if (Double.parseDouble(version) != 1.0) {
      throw new UnsupportedVersion(line, version);
    }
    int numClauses = Header.ABSENT;
    int numLinear = Header.ABSENT;
    int numIndicators = Header.ABSENT;
    if (tokens.size() == 9) {
      numClauses = parseCount(tokens.get(6), line);
      numLinear = parseCount(tokens.get(7), line);
      numIndicators = parseCount(tokens.get(8), line);
    }
    Header header =
        new Header(
            1,
            parseCount(tokens.get(3), line),
            parseCount(tokens.get(4), line),
            parseCount(tokens.get(5), line),
            numClauses,
            numLinear,
            numIndicators,
            line);
    return new Directive.HeaderLine(header, line);
  }

  private static Directive parseBegin(List<String> tokens, int line) {
    expectArity(tokens, 2, line);
    Block block = Block.fromKeyword(tokens.get(1));
    if (block == null) {
      throw new InvalidSyntax(line, "unknown block '" + tokens.get(1) + "'");
    }
    return new Directive.Begin(block, line);
  }

  private static Directive parseVar(List<String> tokens, int line) {
    if (tokens.size() < 4) {
      throw new InvalidSyntax(line, "expected 'var b|i|r <k> <domain> [name=<id>]'");
    }
    String kindToken = tokens.get(1);
    VarKind kind = kindToken.length() == 1 ? VarKind.fromPrefix(kindToken.charAt(0)) : null;
    if (kind == null) {
      throw new InvalidSyntax(line, "unknown variable kind '" + kindToken + "'");
    }
    VarRef ref = new VarRef(kind, parseIndex(tokens.get(2), line));

    int end = tokens.size();
    String name = "";
    if (tokens.get(end - 1).startsWith(NAME_PREFIX)) {
      name = tokens.get(end - 1).substring(NAME_PREFIX.length());
      if (!IDENTIFIER.matcher(name).matches()) {
        throw new InvalidSyntax(line, "invalid variable name '" + name + "'");
      }
      end--;
    }

    boolean binary = false;
    boolean free = false;
    StringBuilder bounds = new StringBuilder();
    for (int i = 3; i < end; ++i) {
      String token = tokens.get(i);
      if (token.equals("bin") && !binary) {
        binary = true;
      } else if (token.equals("free") && !free) {
        free = true;
      } else {
        bounds.append(token);
      }
    }
    boolean bounded = bounds.length() > 0;
    double lb = 0.0;
    double ub = 0.0;
    if (bounded) {
      Matcher m = BOUNDS.matcher(bounds);
      if (!m.matches()) {
        throw new InvalidSyntax(line, "invalid domain '" + bounds + "', expected [L,U]");
      }
      lb = parseBound(m.group(1), line);
      ub = parseBound(m.group(2), line);
    } else if (!binary && !free) {
      throw new InvalidSyntax(line, "missing domain for " + ref);
    }
    return new Directive.VarDecl(ref, binary, free, bounded, lb, ub, name, line);
  }

  private static Directive parseClause(List<String> tokens, int line) {
    if (tokens.size() < 3) {
      throw new InvalidSyntax(line, "expected 'cl hard|soft <lit>... 0'");
    }
    Clause.Kind kind = parseClauseKind(tokens.get(1), line);
    List<Literal> literals = parseLiterals(tokens, 2, line);
    return new Directive.ClauseLine(Directive.Type.CLAUSE, kind, 1, literals, line);
  }

  private static Directive parseWeightedClause(List<String> tokens, int line) {
    if (tokens.size() < 4) {
      throw new InvalidSyntax(line, "expected 'wcl <w> hard|soft <lit>... 0'");
    }
    String weightToken = tokens.get(1);
    if (!UNSIGNED.matcher(weightToken).matches()) {
      throw new InvalidSyntax(line, "clause weight '" + weightToken + "' is not an integer >= 0");
    }
    long weight;
    try {
      weight = Long.parseLong(weightToken);
    } catch (NumberFormatException e) {
      throw new InvalidSyntax(line, "clause weight '" + weightToken + "' is too large");
    }
    Clause.Kind kind = parseClauseKind(tokens.get(2), line);
    List<Literal> literals = parseLiterals(tokens, 3, line);
    return new Directive.ClauseLine(Directive.Type.WEIGHTED_CLAUSE, kind, weight, literals, line);
  }

  private static Directive parseLinear(List<String> tokens, int line) {
    if (tokens.size() < 5 || !tokens.get(4).equals(":")) {
      throw new InvalidSyntax(line, "expected 'lc <id> <=|>=|= <rhs> : <coef> <var> ...'");
    }
    String id = parseIdentifier(tokens.get(1), line);
    Relation relation = Relation.fromSymbol(tokens.get(2));
    if (relation == null) {
      throw new InvalidSyntax(line, "unknown relation '" + tokens.get(2) + "'");
    }
    double rhs = parseNumber(tokens.get(3), line);
    List<LinearTerm> terms = parseTerms(tokens, 5, line);
    return new Directive.LinearLine(id, relation, rhs, terms, line);
  }

  private static Directive parseIndicator(List<String> tokens, int line) {
    if (tokens.size() != 4 || !tokens.get(2).equals("=>")) {
      throw new InvalidSyntax(line, "expected 'ind <lit> => <id>'");
    }
    Literal literal = parseLiteral(tokens.get(1), line);
    String id = parseIdentifier(tokens.get(3), line);
    return new Directive.IndicatorLine(literal, id, line);
  }

  private static Directive parseObjective(List<String> tokens, int line) {
    if (tokens.size() < 4 || !tokens.get(2).equals(":") || !tokens.get(3).equals("lin")) {
      throw new InvalidSyntax(line, "expected 'obj min|max : lin <coef> <var> ...'");
    }
    Objective.Sense sense;
    switch (tokens.get(1)) {
      case "min":
        sense = Objective.Sense.MINIMIZE;
        break;
      case "max":
        sense = Objective.Sense.MAXIMIZE;
        break;
      default:
        throw new InvalidSyntax(
            line, "objective sense must be min or max, got '" + tokens.get(1) + "'");
    }
    return new Directive.ObjectiveLine(sense, parseTerms(tokens, 4, line), line);
  }

  private static Directive parseOption(List<String> tokens, int line) {
    if (tokens.size() < 3) {
      throw new InvalidSyntax(line, "expected 'opt <key> <value>'");
    }
    String value = String.join(" ", tokens.subList(2, tokens.size()));
    return new Directive.OptionLine(tokens.get(1), value, line);
  }

  private static Directive parseSolve(List<String> tokens, int line) {
    expectArity(tokens, 2, line);
    QueryDirective.Kind kind;
    switch (tokens.get(1)) {
      case "feas":
        kind = QueryDirective.Kind.SOLVE_FEAS;
        break;
      case "opt":
        kind = QueryDirective.Kind.SOLVE_OPT;
        break;
      default:
        throw new InvalidSyntax(line, "expected 'solve feas|opt', got '" + tokens.get(1) + "'");
    }
    return new Directive.QueryLine(Directive.Type.SOLVE, QueryDirective.of(kind, line), line);
  }

  private static Directive parseQuery(List<String> tokens, int line) {
    if (tokens.size() >= 4 && tokens.get(1).equals("count") && tokens.get(2).equals("proj")) {
      List<VarRef> projection = new ArrayList<>();
      for (String token : tokens.subList(3, tokens.size())) {
        projection.add(parseVariable(token, line));
      }
      QueryDirective query =
          new QueryDirective(QueryDirective.Kind.COUNT_PROJ, projection, line);
      return new Directive.QueryLine(Directive.Type.QUERY, query, line);
    }
    if (tokens.size() == 3 && tokens.get(1).equals("explain") && tokens.get(2).equals("mus")) {
      QueryDirective query = QueryDirective.of(QueryDirective.Kind.EXPLAIN_MUS, line);
      return new Directive.QueryLine(Directive.Type.QUERY, query, line);
    }
    throw new InvalidSyntax(line, "expected 'query count proj <vars>' or 'query explain mus'");
  }

  private static Clause.Kind parseClauseKind(String token, int line) {
    switch (token) {
      case "hard":
        return Clause.Kind.HARD;
      case "soft":
        return Clause.Kind.SOFT;
      default:
        throw new InvalidSyntax(line, "clause kind must be hard or soft, got '" + token + "'");
    }
  }

  /** Reads literals from tokens[from] up to the terminating 0, which must be the last token. */
  private static List<Literal> parseLiterals(List<String> tokens, int from, int line) {
    List<Literal> literals = new ArrayList<>();
    for (int i = from; i < tokens.size(); ++i) {
      String token = tokens.get(i);
      if (token.equals(CLAUSE_END)) {
        if (i != tokens.size() - 1) {
          throw new InvalidSyntax(line, "unexpected token '" + tokens.get(i + 1) + "' after 0");
        }
        return literals;
      }
      literals.add(parseLiteral(token, line));
    }
    throw new InvalidSyntax(line, "clause is missing its terminating 0");
  }

  private static List<LinearTerm> parseTerms(List<String> tokens, int from, int line) {
    if ((tokens.size() - from) % 2 != 0) {
      throw new InvalidSyntax(line, "linear expression must be a list of '<coef> <var>' pairs");
    }
    List<LinearTerm> terms = new ArrayList<>();
    for (int i = from; i < tokens.size(); i += 2) {
      double coefficient = parseNumber(tokens.get(i), line);
      terms.add(new LinearTerm(coefficient, parseVariable(tokens.get(i + 1), line)));
    }
    return terms;
  }

  static Literal parseLiteral(String token, int line) {
    Matcher m = LITERAL.matcher(token);
    if (!m.matches()) {
      throw new InvalidSyntax(line, "invalid literal '" + token + "'");
    }
    VarKind kind = VarKind.fromPrefix(m.group(2).charAt(0));
    return new Literal(new VarRef(kind, parseIndex(m.group(3), line)), !m.group(1).isEmpty());
  }

  static VarRef parseVariable(String token, int line) {
    Matcher m = VARIABLE.matcher(token);
    if (!m.matches()) {
      throw new InvalidSyntax(line, "invalid variable '" + token + "'");
    }
    return new VarRef(VarKind.fromPrefix(m.group(1).charAt(0)), parseIndex(m.group(2), line));
  }

  static double parseNumber(String token, int line) {
    if (!NUMBER.matcher(token).matches()) {
      throw new InvalidSyntax(line, "'" + token + "' is not a number");
    }
    double value = Double.parseDouble(token);
    if (Double.isInfinite(value)) {
      throw new InvalidSyntax(line, "number '" + token + "' is out of range");
    }
    return value;
  }

  private static double parseBound(String token, int line) {
    switch (token) {
      case "inf":
      case "+inf":
        return Double.POSITIVE_INFINITY;
      case "-inf":
        return Double.NEGATIVE_INFINITY;
      default:
        return parseNumber(token, line);
    }
  }

  private static int parseIndex(String token, int line) {
    if (!UNSIGNED.matcher(token).matches()) {
      throw new InvalidSyntax(line, "'" + token + "' is not a variable index");
    }
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new InvalidSyntax(line, "variable index '" + token + "' is too large");
    }
  }

  private static int parseCount(String token, int line) {
    if (!UNSIGNED.matcher(token).matches()) {
      throw new InvalidSyntax(line, "header count '" + token + "' is not an integer >= 0");
    }
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new InvalidSyntax(line, "header count '" + token + "' is too large");
    }
  }

  private static String parseIdentifier(String token, int line) {
    if (!IDENTIFIER.matcher(token).matches()) {
      throw new InvalidSyntax(line, "invalid constraint id '" + token + "'");
    }
    return token;
  }

  private static void expectArity(List<String> tokens, int arity, int line) {
    if (tokens.size() != arity) {
      throw new InvalidSyntax(
          line,
          String.format("'%s' expects %d token(s), got %d", tokens.get(0), arity, tokens.size()));
    }
  }

  /** Splits separator off the tokens it is glued to, e.g. "4:" becomes "4", ":". */
  static List<String> splitOff(List<String> tokens, String separator) {
    List<String> result = new ArrayList<>(tokens.size() + 2);
    for (String token : tokens) {
      int start = 0;
      int at = token.indexOf(separator);
      while (at >= 0) {
        if (at > start) {
          result.add(token.substring(start, at));
        }
        result.add(separator);
        start = at + separator.length();
        at = token.indexOf(separator, start);
      }
      if (start < token.length()) {
        result.add(token.substring(start));
      }
    }
    return result;
  }
}
