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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.typeclass.util.Static.allMatch;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import net.hydromatic.typeclass.compile.MatchResult.Kind;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.NamedType;
import net.hydromatic.typeclass.type.Op;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeShuttle;
import net.hydromatic.typeclass.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matches the head of an instance against the arguments of a constraint.
 *
 * <p>Matching is one-way. Variables in the head bind to parts of the
 * constraint; existential variables in the constraint are never bound,
 * except in argument positions that functional dependencies determine (see
 * {@link #matchInstance}).
 *
 * <p>A matcher accumulates bindings, so use a new one for each instance.
 */
public class TypeMatcher {
  private final @Nullable Supplier<ExistentialVar> existentials;
  private final Map<TypeVar, Type> bindings = new LinkedHashMap<>();
  private final Map<ExistentialVar, Type> improvements = new LinkedHashMap<>();

  /**
   * Creates a matcher.
   *
   * @param existentials Source of fresh existential variables; required
   *     only when there are positions determined by functional dependencies
   */
  TypeMatcher(@Nullable Supplier<ExistentialVar> existentials) {
    this.existentials = existentials;
  }

  /** Matches an instance head against the arguments of a constraint. */
  public static MatchResult match(
      List<? extends Type> head, List<? extends Type> args) {
    return new TypeMatcher(null).matchInstance(head, args, ImmutableSet.of());
  }

  /**
   * Matches an instance head against the arguments of a constraint,
   * treating some positions as outputs.
   *
   * <p>Positions in {@code outputs} take no part in selecting the instance.
   * If the other positions match, each output position is unified with the
   * instantiated head, and any existential variable bound in doing so is
   * reported as an improvement. A conflict in an output position is a
   * {@link MatchResult#NO_MATCH}.
   */
  MatchResult matchInstance(
      List<? extends Type> head,
      List<? extends Type> args,
      Set<Integer> outputs) {
    checkArgument(
        head.size() == args.size(),
        "head has %s types but constraint has %s",
        head.size(),
        args.size());
    Kind kind = Kind.MATCHED;
    for (int i = 0; i < head.size(); i++) {
      if (!outputs.contains(i)) {
        kind = kind.combine(match(head.get(i), args.get(i)));
        if (kind == Kind.NO_MATCH) {
          return MatchResult.NO_MATCH;
        }
      }
    }
    if (kind == Kind.AMBIGUOUS) {
      return MatchResult.AMBIGUOUS;
    }
    for (int i : outputs) {
      if (!improve(head.get(i), args.get(i))) {
        return MatchResult.NO_MATCH;
      }
    }
    final Map<TypeVar, Type> substitution = new LinkedHashMap<>();
    bindings.forEach((v, t) -> substitution.put(v, resolveDeep(t)));
    final Map<ExistentialVar, Type> improved = new LinkedHashMap<>();
    improvements.forEach((v, t) -> improved.put(v, resolveDeep(t)));
    return MatchResult.matched(substitution, improved);
  }

  /** Matches one head type against one constraint type. */
  Kind match(Type head, Type arg) {
    switch (head.op()) {
      case TY_VAR:
        final TypeVar typeVar = (TypeVar) head;
        final Type bound = bindings.get(typeVar);
        if (bound == null) {
          bindings.put(typeVar, arg);
          return Kind.MATCHED;
        }
        // The variable occurs more than once in the head.
        return compare(bound, arg);

      case NAMED:
        final NamedType namedHead = (NamedType) head;
        switch (arg.op()) {
          case NAMED:
            final NamedType namedArg = (NamedType) arg;
            if (!namedHead.name.equals(namedArg.name)
                || namedHead.args.size() != namedArg.args.size()) {
              return Kind.NO_MATCH;
            }
            Kind kind = Kind.MATCHED;
            for (int i = 0; i < namedHead.args.size(); i++) {
              kind =
                  kind.combine(
                      match(namedHead.args.get(i), namedArg.args.get(i)));
              if (kind == Kind.NO_MATCH) {
                break;
              }
            }
            return kind;

          case EXISTENTIAL:
            // Would match if the variable were to become this constructor.
            return Kind.AMBIGUOUS;

          default:
            return Kind.NO_MATCH;
        }

      default:
        throw new IllegalArgumentException(
            "not valid in an instance head: " + head);
    }
  }

  /**
   * Compares two constraint-side types that are bound to the same head
   * variable.
   */
  static Kind compare(Type t1, Type t2) {
    if (t1.equals(t2)) {
      return Kind.MATCHED;
    }
    if (t1.op() == Op.EXISTENTIAL || t2.op() == Op.EXISTENTIAL) {
      return Kind.AMBIGUOUS;
    }
    if (t1.op() == Op.NAMED && t2.op() == Op.NAMED) {
      final NamedType n1 = (NamedType) t1;
      final NamedType n2 = (NamedType) t2;
      if (!n1.name.equals(n2.name) || n1.args.size() != n2.args.size()) {
        return Kind.NO_MATCH;
      }
      Kind kind = Kind.MATCHED;
      for (int i = 0; i < n1.args.size() && kind != Kind.NO_MATCH; i++) {
        kind = kind.combine(compare(n1.args.get(i), n2.args.get(i)));
      }
      return kind;
    }
    return Kind.NO_MATCH;
  }

  /**
   * Unifies a head type with a constraint type in a position determined by
   * a functional dependency. Returns whether they are consistent.
   */
  boolean improve(Type head, Type arg) {
    switch (head.op()) {
      case TY_VAR:
        final TypeVar typeVar = (TypeVar) head;
        final Type bound = bindings.get(typeVar);
        if (bound == null) {
          bindings.put(typeVar, arg);
          return true;
        }
        return unify(bound, arg);

      case NAMED:
        final Type arg2 = resolve(arg);
        switch (arg2.op()) {
          case NAMED:
            final NamedType namedHead = (NamedType) head;
            final NamedType namedArg = (NamedType) arg2;
            return namedHead.name.equals(namedArg.name)
                && allMatch(namedHead.args, namedArg.args, this::improve);

          case EXISTENTIAL:
            return unify(instantiate(head), arg2);

          default:
            return false;
        }

      default:
        throw new IllegalArgumentException(
            "not valid in an instance head: " + head);
    }
  }

  /**
   * Replaces head variables in a type with their bindings, binding each
   * unbound variable to a fresh existential variable.
   */
  private Type instantiate(Type head) {
    return head.accept(
        new TypeShuttle() {
          @Override
          public Type visit(TypeVar typeVar) {
            return bindings.computeIfAbsent(
                typeVar,
                v -> requireNonNull(existentials, "existentials").get());
          }
        });
  }

  /** Unifies two constraint-side types, binding existential variables. */
  private boolean unify(Type t1, Type t2) {
    final Type u1 = resolve(t1);
    final Type u2 = resolve(t2);
    if (u1.equals(u2)) {
      return true;
    }
    if (u1.op() == Op.EXISTENTIAL) {
      return bind((ExistentialVar) u1, u2);
    }
    if (u2.op() == Op.EXISTENTIAL) {
      return bind((ExistentialVar) u2, u1);
    }
    if (u1.op() == Op.NAMED && u2.op() == Op.NAMED) {
      final NamedType n1 = (NamedType) u1;
      final NamedType n2 = (NamedType) u2;
      return n1.name.equals(n2.name) && allMatch(n1.args, n2.args, this::unify);
    }
    return false;
  }

  private boolean bind(ExistentialVar variable, Type type) {
    if (resolveDeep(type).references(variable)) {
      // Occurs check; binding would create an infinite type.
      return false;
    }
    improvements.put(variable, type);
    return true;
  }

  /** Follows improvements of a type's outermost existential variable. */
  private Type resolve(Type type) {
    Type t = type;
    while (t.op() == Op.EXISTENTIAL) {
      final Type t2 = improvements.get((ExistentialVar) t);
      if (t2 == null) {
        break;
      }
      t = t2;
    }
    return t;
  }

  /** Applies improvements throughout a type until nothing changes. */
  private Type resolveDeep(Type type) {
    Type previous;
    Type current = type;
    do {
      previous = current;
      current = current.substitute(improvements);
    } while (!current.equals(previous));
    return current;
  }
}

// End TypeMatcher.java
