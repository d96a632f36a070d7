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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Sets;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.FunDep;

/**
 * Propagates functional dependencies.
 *
 * <p>Decides which argument positions of a constraint must be concrete
 * before an instance can be selected, and which are determined by the
 * others and therefore become outputs of resolution.
 */
public class FunDeps {
  private FunDeps() {}

  /**
   * Returns the closure of a set of parameters that are known to be
   * concrete, under a class's functional dependencies.
   *
   * <p>For each dependency whose determiners are all in the set, adds its
   * determined parameters, and repeats until nothing changes. Every pass
   * that changes the set grows it, so there are at most {@code arity + 1}
   * passes.
   */
  public static ImmutableSortedSet<Integer> requiredConcrete(
      ClassDecl classDecl, Set<Integer> knownConcrete) {
    final SortedSet<Integer> set = new TreeSet<>(knownConcrete);
    boolean changed;
    do {
      changed = false;
      for (FunDep funDep : classDecl.funDeps) {
        if (set.containsAll(funDep.determiners)
            && set.addAll(funDep.determined)) {
          changed = true;
        }
      }
    } while (changed);
    return ImmutableSortedSet.copyOf(set);
  }

  /** Returns the positions of a constraint whose argument is concrete. */
  public static ImmutableSortedSet<Integer> concretePositions(
      Constraint constraint) {
    final ImmutableSortedSet.Builder<Integer> b =
        ImmutableSortedSet.naturalOrder();
    for (int i = 0; i < constraint.args.size(); i++) {
      if (constraint.args.get(i).isConcrete()) {
        b.add(i);
      }
    }
    return b.build();
  }

  /**
   * Returns the positions of a constraint that are outputs: not concrete,
   * but determined by functional dependencies from concrete positions.
   */
  public static ImmutableSortedSet<Integer> outputs(
      ClassDecl classDecl, Constraint constraint) {
    if (classDecl.funDeps.isEmpty()) {
      return ImmutableSortedSet.of();
    }
    final Set<Integer> known = concretePositions(constraint);
    return ImmutableSortedSet.copyOf(
        Sets.difference(requiredConcrete(classDecl, known), known));
  }

  /**
   * Checks a class's functional dependencies.
   *
   * @throws LoadException.InvalidDeclaration if a dependency refers to a
   *     parameter that does not exist, or determines nothing
   * @throws LoadException.FunctionalDependencyCycle if a dependency
   *     determines one of its own determiners
   * @throws LoadException.FunctionalDependencyConflict if two dependencies
   *     determine the same parameter and neither one's determiners include
   *     the other's
   */
  public static void validate(ClassDecl classDecl) {
    final ListMultimap<Integer, FunDep> determinedBy =
        ArrayListMultimap.create();
    for (FunDep funDep : classDecl.funDeps) {
      final String description =
          funDep.describe(new StringBuilder(), classDecl.parameters).toString();
      for (int i : Sets.union(funDep.determiners, funDep.determined)) {
        if (i < 0 || i >= classDecl.arity()) {
          throw new LoadException.InvalidDeclaration("Functional dependency "
              + description + " of class " + classDecl.name
              + " refers to parameter #" + i + ", but the class has "
              + classDecl.arity() + " parameters");
        }
      }
      if (funDep.determined.isEmpty()) {
        throw new LoadException.InvalidDeclaration("Functional dependency "
            + description + " of class " + classDecl.name
            + " determines no parameters");
      }
      if (!Collections.disjoint(funDep.determiners, funDep.determined)) {
        throw new LoadException.FunctionalDependencyCycle(
            classDecl.name, description);
      }
      for (int i : funDep.determined) {
        for (FunDep previous : determinedBy.get(i)) {
          // "a -> c" implies "a b -> c"; only incomparable determiner
          // sets can disagree.
          if (!previous.determiners.containsAll(funDep.determiners)
              && !funDep.determiners.containsAll(previous.determiners)) {
            throw new LoadException.FunctionalDependencyConflict(
                classDecl.name,
                classDecl.parameters.get(i),
                previous,
                funDep);
          }
        }
        determinedBy.put(i, funDep);
      }
    }
  }
}

// End FunDeps.java
