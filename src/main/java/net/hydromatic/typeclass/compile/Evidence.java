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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceDecl;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeVar;

/**
 * Proof that a constraint holds, from which an elaborator generates
 * dictionary-passing code.
 *
 * <p>Either an instance applied to evidence for each of its prerequisites,
 * or a given constraint, possibly projected through superclasses.
 */
public abstract class Evidence {
  /** The constraint that this evidence proves. */
  public final Constraint constraint;

  protected Evidence(Constraint constraint) {
    this.constraint = requireNonNull(constraint);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Writes this evidence as a term, e.g. "showArray(showString)". */
  public abstract StringBuilder describe(StringBuilder buf);

  /** Evidence that comes from an instance. */
  public static class InstanceEvidence extends Evidence {
    public final InstanceDecl instance;
    public final ImmutableMap<TypeVar, Type> substitution;
    /** Evidence for each prerequisite of the instance, in order. */
    public final List<Evidence> args;

    InstanceEvidence(Constraint constraint, InstanceDecl instance,
        Map<TypeVar, Type> substitution, List<Evidence> args) {
      super(constraint);
      this.instance = requireNonNull(instance);
      this.substitution = ImmutableMap.copyOf(substitution);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public StringBuilder describe(StringBuilder buf) {
      buf.append(instance.name);
      if (!args.isEmpty()) {
        buf.append('(');
        for (int i = 0; i < args.size(); i++) {
          args.get(i).describe(buf.append(i > 0 ? ", " : ""));
        }
        buf.append(')');
      }
      return buf;
    }
  }

  /** Evidence that comes from a given constraint. */
  public static class GivenEvidence extends Evidence {
    public final Constraint given;
    /**
     * Classes from the given's class to the proven constraint's class. Has
     * one element if the given proves the constraint directly.
     */
    public final List<String> path;

    GivenEvidence(Constraint constraint, Constraint given, List<String> path) {
      super(constraint);
      this.given = requireNonNull(given);
      this.path = ImmutableList.copyOf(path);
    }

    @Override
    public StringBuilder describe(StringBuilder buf) {
      buf.append("given(");
      given.describe(buf);
      for (String className : path.subList(1, path.size())) {
        buf.append(" => ").append(className);
      }
      return buf.append(')');
    }
  }
}

// End Evidence.java
