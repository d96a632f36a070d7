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
import static net.hydromatic.typeclass.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceDecl;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.Op;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeVar;
import net.hydromatic.typeclass.type.TypeVisitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solves constraints, producing evidence.
 *
 * <p>A wanted constraint is first resolved against its class's instance
 * chains (see {@link ChainResolver}). If an instance is selected, its
 * prerequisites are solved recursively, to a limited depth. If no instance
 * is found, given constraints (those of the enclosing signature) may
 * discharge the wanted constraint directly or through superclasses. If an
 * instance matched ambiguously, the constraint is not discharged at all.
 *
 * <p>A solver is immutable. Each call to {@link #solve} has its own state,
 * so a failure does not affect other calls.
 */
public class ConstraintSolver {
  private final InstanceStore store;
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;
  private final ChainResolver chainResolver;

  public ConstraintSolver(InstanceStore store, Map<Prop, Object> props,
      Tracer tracer) {
    this.store = requireNonNull(store);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    this.chainResolver = new ChainResolver(store, this.props, tracer);
  }

  /** Creates a solver with default properties. */
  public static ConstraintSolver create(InstanceStore store) {
    return new ConstraintSolver(store, ImmutableMap.of(), Tracers.empty());
  }

  /** Solves a constraint with no givens. */
  public Solution solve(Constraint wanted) {
    return solve(wanted, ImmutableList.of());
  }

  /**
   * Solves a constraint.
   *
   * @param wanted Constraint to solve; may contain existential and rigid
   *   type variables, but not instance type variables
   * @param givens Constraints that hold at the use site
   * @throws ResolveException if the constraint cannot be solved
   */
  public Solution solve(Constraint wanted, List<Constraint> givens) {
    checkConstraint(wanted);
    givens.forEach(this::checkConstraint);
    return new Search(wanted, givens).solve();
  }

  private void checkConstraint(Constraint constraint) {
    checkArgument(!constraint.contains(Op.TY_VAR),
        "constraint %s contains an instance type variable", constraint);
    final ClassDecl classDecl = store.lookupClass(constraint.className);
    if (classDecl == null) {
      throw new ResolveException.UnknownClass(constraint);
    }
    checkArgument(constraint.args.size() == classDecl.arity(),
        "class %s has %s parameters, but constraint %s has %s arguments",
        classDecl.name, classDecl.arity(), constraint,
        constraint.args.size());
  }

  /** State of a call to {@link #solve}. */
  private class Search {
    final Constraint wanted;
    final List<Constraint> givens;
    final int maxDepth = Prop.RESOLUTION_DEPTH.intValue(props);
    final boolean superclassDischarge =
        Prop.SUPERCLASS_DISCHARGE.booleanValue(props);
    final boolean overlapCheck = Prop.OVERLAP_CHECK.booleanValue(props);
    /** Types determined so far for existential variables. */
    final Map<ExistentialVar, Type> improvements = new LinkedHashMap<>();

    Search(Constraint wanted, List<Constraint> givens) {
      this.wanted = wanted;
      this.givens = ImmutableList.copyOf(givens);
    }

    Solution solve() {
      final Evidence evidence = solve(wanted, 1);
      final Map<ExistentialVar, Type> wantedImprovements =
          new LinkedHashMap<>();
      improvements.forEach((v, t) -> {
        if (wanted.args.stream().anyMatch(arg -> arg.references(v))) {
          wantedImprovements.put(v, improveType(t));
        }
      });
      return new Solution(improve(wanted), evidence, wantedImprovements);
    }

    Evidence solve(Constraint goal, int depth) {
      if (depth > maxDepth) {
        throw new ResolveException.ResolutionDepthExceeded(wanted, maxDepth);
      }
      final Constraint constraint = improve(goal);
      final ClassDecl classDecl = store.classDecl(constraint.className);
      final ChainResult result =
          chainResolver.resolve(classDecl, constraint, overlapCheck);
      switch (result.kind) {
        case RESOLVED:
          improvements.putAll(result.improvements);
          return instanceEvidence(constraint, result, depth);

        case AMBIGUOUS_STOP:
          throw new ResolveException.AmbiguousInstance(constraint,
              result.instance());

        default:
          final Evidence evidence = discharge(constraint);
          if (evidence == null) {
            throw new ResolveException.NoInstanceFound(constraint);
          }
          return evidence;
      }
    }

    private Evidence instanceEvidence(Constraint constraint,
        ChainResult result, int depth) {
      final InstanceDecl instance = result.instance();
      // Variables that occur only in prerequisites become unknowns.
      final Map<TypeVar, Type> substitution =
          new LinkedHashMap<>(result.substitution);
      for (Constraint prerequisite : instance.constraints) {
        for (Type arg : prerequisite.args) {
          arg.accept(
              new TypeVisitor<Void>() {
                @Override
                public Void visit(TypeVar typeVar) {
                  substitution.computeIfAbsent(typeVar,
                      v -> store.existential());
                  return null;
                }
              });
        }
      }
      final List<Evidence> args = new ArrayList<>();
      for (Constraint prerequisite : instance.constraints) {
        args.add(solve(prerequisite.substitute(substitution), depth + 1));
      }
      return new Evidence.InstanceEvidence(constraint, instance,
          substitution, args);
    }

    /**
     * Tries to discharge a constraint using the givens; returns null if
     * none applies.
     */
    private @Nullable Evidence discharge(Constraint constraint) {
      if (!superclassDischarge) {
        return null;
      }
      for (Constraint given : givens) {
        final Constraint given2 = improve(given);
        if (given2.equals(constraint)) {
          final List<String> path = ImmutableList.of(given2.className);
          tracer.onDischarge(constraint, given2, path);
          return new Evidence.GivenEvidence(constraint, given2, path);
        }
        if (!store.superclassGraph.isSuperclass(constraint.className,
            given2.className)) {
          continue;
        }
        for (SuperclassGraph.Implied implied
            : store.superclassGraph.implied(given2)) {
          if (implied.constraint.equals(constraint)) {
            tracer.onDischarge(constraint, given2, implied.path);
            return new Evidence.GivenEvidence(constraint, given2,
                implied.path);
          }
        }
      }
      return null;
    }

    /** Applies the improvements found so far to a constraint. */
    Constraint improve(Constraint constraint) {
      return Constraint.of(constraint.className,
          transformEager(constraint.args, this::improveType));
    }

    /** Applies the improvements found so far to a type. */
    Type improveType(Type type) {
      Type previous;
      Type current = type;
      do {
        previous = current;
        current = current.substitute(improvements);
      } while (!current.equals(previous));
      return current;
    }
  }
}

// End ConstraintSolver.java
