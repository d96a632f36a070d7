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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.Superclass;

/**
 * Directed graph from each class to its superclasses.
 *
 * <p>Used to discharge a constraint using evidence for a subclass: evidence
 * for {@code Monad m} is also evidence for {@code Applicative m}, because
 * {@code Applicative} is a superclass of {@code Monad}.
 *
 * <p>The graph is acyclic; {@link #create} rejects cycles.
 */
public class SuperclassGraph {
  private final ImmutableMap<String, ClassDecl> classes;
  /** Transitive superclasses of each class, nearest first. */
  private final ImmutableSetMultimap<String, String> closure;

  private SuperclassGraph(ImmutableMap<String, ClassDecl> classes) {
    this.classes = classes;
    checkCycles();
    final ImmutableSetMultimap.Builder<String, String> b =
        ImmutableSetMultimap.builder();
    classes.keySet().forEach(c -> b.putAll(c, reachable(c)));
    this.closure = b.build();
  }

  /**
   * Creates a graph over a set of classes.
   *
   * @throws LoadException.InvalidDeclaration if a superclass is unknown, or
   *     is applied to the wrong number of arguments or to a parameter that
   *     does not exist
   * @throws LoadException.SuperclassCycle if a class is its own transitive
   *     superclass
   */
  public static SuperclassGraph create(Map<String, ClassDecl> classes) {
    for (ClassDecl classDecl : classes.values()) {
      for (Superclass superclass : classDecl.superclasses) {
        final ClassDecl superDecl = classes.get(superclass.className);
        if (superDecl == null) {
          throw new LoadException.InvalidDeclaration("Class "
              + classDecl.name + " has unknown superclass "
              + superclass.className);
        }
        if (superclass.paramIndexes.size() != superDecl.arity()) {
          throw new LoadException.InvalidDeclaration("Superclass "
              + superclass.className + " of class " + classDecl.name
              + " expects " + superDecl.arity() + " arguments, got "
              + superclass.paramIndexes.size());
        }
        for (int i : superclass.paramIndexes) {
          if (i < 0 || i >= classDecl.arity()) {
            throw new LoadException.InvalidDeclaration("Superclass "
                + superclass.className + " of class " + classDecl.name
                + " refers to parameter #" + i);
          }
        }
      }
    }
    return new SuperclassGraph(ImmutableMap.copyOf(classes));
  }

  /** Depth-first search that throws on the first back edge. */
  private void checkCycles() {
    final Map<String, Boolean> finished = new HashMap<>();
    final Deque<String> path = new ArrayDeque<>();
    for (String className : classes.keySet()) {
      visit(className, finished, path);
    }
  }

  private void visit(
      String className, Map<String, Boolean> finished, Deque<String> path) {
    final Boolean done = finished.get(className);
    if (done != null) {
      if (!done) {
        // Back edge: className is on the current path.
        final List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String c : ImmutableList.copyOf(path.descendingIterator())) {
          inCycle |= c.equals(className);
          if (inCycle) {
            cycle.add(c);
          }
        }
        cycle.add(className);
        throw new LoadException.SuperclassCycle(cycle);
      }
      return;
    }
    finished.put(className, false);
    path.push(className);
    for (Superclass superclass : classDecl(className).superclasses) {
      visit(superclass.className, finished, path);
    }
    path.pop();
    finished.put(className, true);
  }

  private ClassDecl classDecl(String className) {
    final ClassDecl classDecl = classes.get(className);
    if (classDecl == null) {
      throw new IllegalArgumentException("unknown class " + className);
    }
    return classDecl;
  }

  /** Breadth-first search from a class along superclass edges. */
  private Set<String> reachable(String className) {
    final Set<String> result = new LinkedHashSet<>();
    final Deque<String> queue = new ArrayDeque<>();
    queue.add(className);
    while (!queue.isEmpty()) {
      for (Superclass superclass : classDecl(queue.remove()).superclasses) {
        if (result.add(superclass.className)) {
          queue.add(superclass.className);
        }
      }
    }
    return result;
  }

  /**
   * Returns the classes reachable from a class by following one or more
   * superclass edges, nearest first.
   */
  public ImmutableSet<String> superclasses(String className) {
    checkArgument(classes.containsKey(className), "unknown class %s",
        className);
    return closure.get(className);
  }

  /**
   * Returns the classes that have a given class as a transitive superclass,
   * in declaration order.
   */
  public ImmutableSet<String> subclasses(String className) {
    return closure.inverse().get(className);
  }

  /** Returns whether {@code sup} is a transitive superclass of {@code sub}. */
  public boolean isSuperclass(String sup, String sub) {
    return closure.containsEntry(sub, sup);
  }

  /**
   * Returns every constraint implied by a given constraint through one or
   * more superclass edges, each with the path of classes that leads to it.
   *
   * <p>For example, given {@code MonadFail m}, the result includes {@code
   * Applicative m} with path [MonadFail, Monad, Applicative]. If a
   * constraint is reachable by several paths, the first found (depth-first,
   * in declaration order) is kept.
   */
  public List<Implied> implied(Constraint given) {
    final Map<Constraint, Implied> map = new LinkedHashMap<>();
    final Deque<String> path = new ArrayDeque<>();
    path.add(given.className);
    collect(given, path, map);
    return ImmutableList.copyOf(map.values());
  }

  private void collect(
      Constraint constraint, Deque<String> path, Map<Constraint, Implied> map) {
    for (Superclass superclass :
        classDecl(constraint.className).superclasses) {
      final Constraint implied = superclass.instantiate(constraint);
      path.addLast(implied.className);
      if (!map.containsKey(implied)) {
        map.put(implied, new Implied(implied, ImmutableList.copyOf(path)));
        collect(implied, path, map);
      }
      path.removeLast();
    }
  }

  /** A constraint implied by a given constraint, and how. */
  public static class Implied {
    public final Constraint constraint;
    /** Classes from the given's class to the implied class, inclusive. */
    public final List<String> path;

    Implied(Constraint constraint, List<String> path) {
      this.constraint = requireNonNull(constraint);
      this.path = ImmutableList.copyOf(path);
    }

    @Override
    public String toString() {
      return constraint + " via " + String.join(" => ", path);
    }
  }
}

// End SuperclassGraph.java
