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
import org.wmibo.model.Clause;
import org.wmibo.model.Header;
import org.wmibo.model.LinearTerm;
import org.wmibo.model.Literal;
import org.wmibo.model.Objective;
import org.wmibo.model.QueryDirective;
import org.wmibo.model.Relation;
import org.wmibo.model.VarRef;

/**
 * One parsed line of a WMIBO file.
 *
 * <p>Consumers switch on {@link #getType()} and cast to the matching nested class.
 */
public abstract class Directive {
  /** Directive shapes, with the block each one belongs to. */
  public enum Type {
    HEADER("p", null),
    BEGIN("begin", null),
    END("end", null),
    VAR("var", null),
    CLAUSE("cl", Block.CNF),
    WEIGHTED_CLAUSE("wcl", Block.WCNF),
    LINEAR("lc", Block.LIN),
    INDICATOR("ind", Block.IND),
    OBJECTIVE("obj", Block.OBJ),
    OPTION("opt", null),
    SOLVE("solve", Block.QUERY),
    QUERY("query", Block.QUERY);

    Type(String keyword, Block home) {
      this.keyword = keyword;
      this.home = home;
    }

    public String getKeyword() {
      return keyword;
    }

    /** Returns the block this directive must appear in, or null if it is not tied to a block. */
    public Block getHome() {
      return home;
    }

    private final String keyword;
    private final Block home;
  }

  Directive(Type type, int line) {
    this.type = type;
    this.line = line;
  }

  public Type getType() {
    return type;
  }

  public int getLine() {
    return line;
  }

  private final Type type;
  private final int line;

  /** {@code p wmibo ...} */
  public static final class HeaderLine extends Directive {
    HeaderLine(Header header, int line) {
      super(Type.HEADER, line);
      this.header = header;
    }

    public Header getHeader() {
      return header;
    }

    private final Header header;
  }

  /** {@code begin <block>} */
  public static final class Begin extends Directive {
    Begin(Block block, int line) {
      super(Type.BEGIN, line);
      this.block = block;
    }

    public Block getBlock() {
      return block;
    }

    private final Block block;
  }

  /** {@code end} */
  public static final class End extends Directive {
    End(int line) {
      super(Type.END, line);
    }
  }

  /**
   * {@code var b|i|r <k> <domain> [name=<id>]}, with the domain as written. The symbol table checks
   * that the domain fits the kind.
   */
  public static final class VarDecl extends Directive {
    VarDecl(
        VarRef ref,
        boolean binary,
        boolean free,
        boolean bounded,
        double lowerBound,
        double upperBound,
        String name,
        int line) {
      super(Type.VAR, line);
      this.ref = ref;
      this.binary = binary;
      this.free = free;
      this.bounded = bounded;
      this.lowerBound = lowerBound;
      this.upperBound = upperBound;
      this.name = name;
    }

    public VarRef getRef() {
      return ref;
    }

    /** Returns true if the {@code bin} keyword was given. */
    public boolean isBinary() {
      return binary;
    }

    /** Returns true if the {@code free} keyword was given. */
    public boolean isFree() {
      return free;
    }

    /** Returns true if explicit {@code [L,U]} bounds were given. */
    public boolean isBounded() {
      return bounded;
    }

    public double getLowerBound() {
      return lowerBound;
    }

    public double getUpperBound() {
      return upperBound;
    }

    /** Returns the name, or the empty string. */
    public String getName() {
      return name;
    }

    private final VarRef ref;
    private final boolean binary;
    private final boolean free;
    private final boolean bounded;
    private final double lowerBound;
    private final double upperBound;
    private final String name;
  }

  /** {@code cl hard|soft <lit>... 0} and {@code wcl <w> hard|soft <lit>... 0}. */
  public static final class ClauseLine extends Directive {
    ClauseLine(Type type, Clause.Kind kind, long weight, List<Literal> literals, int line) {
      super(type, line);
      this.kind = kind;
      this.weight = weight;
      this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
    }

    public Clause.Kind getKind() {
      return kind;
    }

    public long getWeight() {
      return weight;
    }

    public List<Literal> getLiterals() {
      return literals;
    }

    public Clause toClause() {
      return new Clause(kind, weight, literals, getType() == Type.WEIGHTED_CLAUSE, getLine());
    }

    private final Clause.Kind kind;
    private final long weight;
    private final List<Literal> literals;
  }

  /** {@code lc <id> <rel> <rhs> : <coef> <var> ...} */
  public static final class LinearLine extends Directive {
    LinearLine(String id, Relation relation, double rhs, List<LinearTerm> terms, int line) {
      super(Type.LINEAR, line);
      this.id = id;
      this.relation = relation;
      this.rhs = rhs;
      this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    public String getId() {
      return id;
    }

    public Relation getRelation() {
      return relation;
    }

    public double getRhs() {
      return rhs;
    }

    public List<LinearTerm> getTerms() {
      return terms;
    }

    private final String id;
    private final Relation relation;
    private final double rhs;
    private final List<LinearTerm> terms;
  }

  /** {@code ind <lit> => <id>} */
  public static final class IndicatorLine extends Directive {
    IndicatorLine(Literal literal, String constraintId, int line) {
      super(Type.INDICATOR, line);
      this.literal = literal;
      this.constraintId = constraintId;
    }

    public Literal getLiteral() {
      return literal;
    }

    public String getConstraintId() {
      return constraintId;
    }

    private final Literal literal;
    private final String constraintId;
  }

  /** {@code obj min|max : lin <coef> <var> ...} */
  public static final class ObjectiveLine extends Directive {
    ObjectiveLine(Objective.Sense sense, List<LinearTerm> terms, int line) {
      super(Type.OBJECTIVE, line);
      this.sense = sense;
      this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    public Objective.Sense getSense() {
      return sense;
    }

    public List<LinearTerm> getTerms() {
      return terms;
    }

    private final Objective.Sense sense;
    private final List<LinearTerm> terms;
  }

  /** {@code opt <key> <value>} */
  public static final class OptionLine extends Directive {
    OptionLine(String key, String value, int line) {
      super(Type.OPTION, line);
      this.key = key;
      this.value = value;
    }

    public String getKey() {
      return key;
    }

    /** Returns the raw value text. */
    public String getValue() {
      return value;
    }

    private final String key;
    private final String value;
  }

  /** {@code solve feas|opt}, {@code query count proj <vars>}, {@code query explain mus}. */
  public static final class QueryLine extends Directive {
    QueryLine(Type type, QueryDirective query, int line) {
      super(type, line);
      this.query = query;
    }

    public QueryDirective getQuery() {
      return query;
    }

    private final QueryDirective query;
  }
}
