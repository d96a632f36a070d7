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
package net.hydromatic.typeclass.decl;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.typeclass.type.Type;

/**
 * Superclass of a class, applied to some of the subclass's parameters.
 *
 * <p>In {@code class (Applicative m, Bind m) <= Monad m}, class {@code Monad}
 * has two superclasses, each with parameter indexes [0].
 */
public class Superclass {
  public final String className;
  /** Index, among the subclass's parameters, of each superclass argument. */
  public final List<Integer> paramIndexes;

  private Superclass(String className, List<Integer> paramIndexes) {
    this.className = requireNonNull(className);
    this.paramIndexes = ImmutableList.copyOf(paramIndexes);
  }

  /** Creates a superclass reference. */
  public static Superclass of(String className, List<Integer> paramIndexes) {
    return new Superclass(className, paramIndexes);
  }

  /**
   * Returns the superclass constraint implied by a constraint on the
   * subclass. For example, given {@code Monad m}, returns {@code Applicative
   * m}.
   */
  public Constraint instantiate(Constraint subclassConstraint) {
    final ImmutableList.Builder<Type> args = ImmutableList.builder();
    for (int i : paramIndexes) {
      args.add(subclassConstraint.args.get(i));
    }
    return Constraint.of(className, args.build());
  }

  @Override
  public String toString() {
    return className + " " + paramIndexes;
  }
}

// End Superclass.java
