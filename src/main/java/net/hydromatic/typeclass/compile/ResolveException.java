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
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceDecl;

/**
 * Error resolving a constraint.
 *
 * <p>Resolution errors are local to a use site. They do not change the
 * {@link InstanceStore}, and other constraints can still be resolved.
 */
public class ResolveException extends CompileException {
  private final Constraint constraint;

  protected ResolveException(String message, Constraint constraint) {
    super(message);
    this.constraint = requireNonNull(constraint);
  }

  /** Returns the constraint that could not be resolved. */
  public Constraint constraint() {
    return constraint;
  }

  /** No instance matched, and no given evidence implies the constraint. */
  public static class NoInstanceFound extends ResolveException {
    public NoInstanceFound(Constraint constraint) {
      super("No type class instance was found for " + constraint, constraint);
    }
  }

  /**
   * An instance matched only for some instantiations of the constraint's
   * existential variables, and so stopped the search through its chain.
   *
   * <p>The message is the same as for {@link NoInstanceFound}, of which this
   * is a subclass; use {@link #blockingInstance()} to tell them apart.
   */
  public static class AmbiguousInstance extends NoInstanceFound {
    private final InstanceDecl blockingInstance;

    public AmbiguousInstance(
        Constraint constraint, InstanceDecl blockingInstance) {
      super(constraint);
      this.blockingInstance = requireNonNull(blockingInstance);
    }

    public InstanceDecl blockingInstance() {
      return blockingInstance;
    }
  }

  /** Recursive resolution of prerequisites did not terminate. */
  public static class ResolutionDepthExceeded extends ResolveException {
    public ResolutionDepthExceeded(Constraint constraint, int depth) {
      super("Constraint resolution did not terminate for " + constraint
          + " (depth limit " + depth + ")", constraint);
    }
  }

  /** Instances in different chains both resolve the constraint. */
  public static class OverlappingInstances extends ResolveException {
    private final List<InstanceDecl> instances;

    public OverlappingInstances(
        Constraint constraint, InstanceDecl instance0, InstanceDecl instance1) {
      super("Overlapping type class instances found for " + constraint
          + ": " + instance0.name + ", " + instance1.name, constraint);
      this.instances = ImmutableList.of(instance0, instance1);
    }

    public List<InstanceDecl> instances() {
      return instances;
    }
  }

  /** The constraint's class has not been declared. */
  public static class UnknownClass extends ResolveException {
    public UnknownClass(Constraint constraint) {
      super("Unknown type class " + constraint.className, constraint);
    }
  }
}

// End ResolveException.java
