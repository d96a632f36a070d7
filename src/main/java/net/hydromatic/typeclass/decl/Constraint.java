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
import static net.hydromatic.typeclass.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.typeclass.type.Op;
import net.hydromatic.typeclass.type.Type;

/**
 * A class applied to argument types, e.g. {@code Show (Array ?t0)}.
 *
 * <p>A constraint is the obligation that an instance of the class exists for
 * those types. Constraints also appear as the prerequisites of instances
 * (the {@code Show 'a} in {@code Show 'a => Show (Array 'a)}) and as given
 * evidence available at a use site.
 */
public class Constraint {
  public final String className;
  public final List<Type> args;

  private Constraint(String className, List<? extends Type> args) {
    this.className = requireNonNull(className);
    this.args = ImmutableList.copyOf(args);
  }

  /** Creates a constraint. */
  public static Constraint of(String className, List<? extends Type> args) {
    return new Constraint(className, args);
  }

  /** Creates a constraint. */
  public static Constraint of(String className, Type... args) {
    return new Constraint(className, ImmutableList.copyOf(args));
  }

  /** Returns a copy of this constraint with variables substituted. */
  public Constraint substitute(Map<? extends Type, ? extends Type> map) {
    if (map.isEmpty()) {
      return this;
    }
    final List<Type> args = transformEager(this.args, t -> t.substitute(map));
    if (args.equals(this.args)) {
      return this;
    }
    return new Constraint(className, args);
  }

  /** Returns whether any argument contains a variable of a given kind. */
  public boolean contains(Op op) {
    for (Type arg : args) {
      if (arg.contains(op)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(className, args);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Constraint
            && className.equals(((Constraint) obj).className)
            && args.equals(((Constraint) obj).args);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  public StringBuilder describe(StringBuilder buf) {
    buf.append(className);
    for (Type arg : args) {
      arg.describe(buf.append(' '), true);
    }
    return buf;
  }
}

// End Constraint.java
