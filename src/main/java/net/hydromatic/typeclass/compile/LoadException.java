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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.typeclass.decl.FunDep;
import net.hydromatic.typeclass.decl.InstanceDecl;

/**
 * Error found while loading declarations into an {@link InstanceStore}.
 *
 * <p>Load-time errors are fatal: the program is rejected before any
 * constraint is resolved.
 */
public class LoadException extends CompileException {
  protected LoadException(String message) {
    super(message);
  }

  /**
   * Instance declared in a module that defines neither its class nor any
   * type in its head.
   */
  public static class OrphanInstance extends LoadException {
    private final InstanceDecl instance;

    public OrphanInstance(InstanceDecl instance, String reason) {
      super("Orphan instance " + instance.name + " found for "
          + instance.headConstraint() + ": " + reason);
      this.instance = requireNonNull(instance);
    }

    public InstanceDecl instance() {
      return instance;
    }
  }

  /** Class that is, directly or transitively, its own superclass. */
  public static class SuperclassCycle extends LoadException {
    private final List<String> cycle;

    public SuperclassCycle(List<String> cycle) {
      super("Cycle in superclasses of class " + cycle.get(0) + ": "
          + String.join(" => ", cycle));
      this.cycle = ImmutableList.copyOf(cycle);
    }

    /** Classes in the cycle; the first and last elements are the same. */
    public List<String> cycle() {
      return cycle;
    }
  }

  /**
   * Functional dependency whose determined parameters include one of its own
   * determiners.
   */
  public static class FunctionalDependencyCycle extends LoadException {
    public final String className;

    public FunctionalDependencyCycle(String className, String funDep) {
      super("Functional dependency " + funDep + " of class " + className
          + " determines one of its own determining parameters");
      this.className = className;
    }
  }

  /**
   * Parameter of a class determined by two functional dependencies with
   * different determiners.
   */
  public static class FunctionalDependencyConflict extends LoadException {
    public final String className;

    public FunctionalDependencyConflict(
        String className, String parameter, FunDep funDep0, FunDep funDep1) {
      super("Parameter " + parameter + " of class " + className
          + " is determined by conflicting functional dependencies "
          + funDep0 + " and " + funDep1);
      this.className = className;
    }
  }

  /**
   * Declaration that is malformed: refers to an unknown class, has the wrong
   * number of arguments, has a duplicate name, and so forth.
   */
  public static class InvalidDeclaration extends LoadException {
    public InvalidDeclaration(String message) {
      super(message);
    }
  }
}

// End LoadException.java
