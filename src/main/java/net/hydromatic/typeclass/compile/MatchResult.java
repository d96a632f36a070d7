/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.typeclass.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeVar;

/**
 * Result of matching an instance head against the arguments of a
 * constraint.
 *
 * <p>There are three outcomes. {@link Kind#MATCHED} carries a substitution
 * from head variables to constraint types. {@link Kind#NO_MATCH} means the
 * instance can never apply. {@link Kind#AMBIGUOUS} means it would apply only
 * for some instantiations of the constraint's existential variables.
 */
public final class MatchResult {
  public static final MatchResult NO_MATCH =
      new MatchResult(Kind.NO_MATCH, ImmutableMap.of(), ImmutableMap.of());

  public static final MatchResult AMBIGUOUS =
      new MatchResult(Kind.AMBIGUOUS, ImmutableMap.of(), ImmutableMap.of());

  public final Kind kind;
  /** Binding of each head variable; empty unless matched. */
  public final ImmutableMap<TypeVar, Type> substitution;
  /**
   * Existential variables of the constraint that functional dependencies
   * have determined; empty unless matched.
   */
  public final ImmutableMap<ExistentialVar, Type> improvements;

  private MatchResult(
      Kind kind,
      ImmutableMap<TypeVar, Type> substitution,
      ImmutableMap<ExistentialVar, Type> improvements) {
    this.kind = requireNonNull(kind);
    this.substitution = substitution;
    this.improvements = improvements;
  }

  /** Creates a successful result. */
  public static MatchResult matched(Map<TypeVar, Type> substitution) {
    return matched(substitution, ImmutableMap.of());
  }

  /** Creates a successful result that also improves existential variables. */
  public static MatchResult matched(
      Map<TypeVar, Type> substitution,
      Map<ExistentialVar, Type> improvements) {
    return new MatchResult(Kind.MATCHED, ImmutableMap.copyOf(substitution),
        ImmutableMap.copyOf(improvements));
  }

  public boolean isMatched() {
    return kind == Kind.MATCHED;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, substitution, improvements);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof MatchResult
            && kind == ((MatchResult) obj).kind
            && substitution.equals(((MatchResult) obj).substitution)
            && improvements.equals(((MatchResult) obj).improvements);
  }

  /** Returns e.g. "matched['a := String]", "ambiguous". */
  @Override
  public String toString() {
    final StringBuilder buf =
        new StringBuilder(kind.name().toLowerCase(Locale.ROOT));
    if (kind == Kind.MATCHED) {
      buf.append('[');
      int i = 0;
      for (Map.Entry<TypeVar, Type> e : substitution.entrySet()) {
        append(buf, i++, e.getKey(), e.getValue());
      }
      for (Map.Entry<ExistentialVar, Type> e : improvements.entrySet()) {
        append(buf, i++, e.getKey(), e.getValue());
      }
      buf.append(']');
    }
    return buf.toString();
  }

  private static void append(StringBuilder buf, int i, Type v, Type t) {
    buf.append(i > 0 ? ", " : "").append(v).append(" := ");
    t.describe(buf, false);
  }

  /**
   * Kind of match result.
   *
   * <p>Declared in increasing order of dominance: when results for several
   * argument positions are combined, the greatest wins.
   */
  public enum Kind {
    MATCHED,
    AMBIGUOUS,
    NO_MATCH;

    /** Combines two kinds; NO_MATCH beats AMBIGUOUS beats MATCHED. */
    public Kind combine(Kind other) {
      return compareTo(other) >= 0 ? this : other;
    }
  }
}

// End MatchResult.java
