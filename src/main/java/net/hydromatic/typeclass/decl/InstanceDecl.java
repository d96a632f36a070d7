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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.typeclass.type.Type;

/**
 * Declaration of an instance.
 *
 * <p>An instance belongs to exactly one position of one {@link
 * InstanceChain}. Its head is a list of types, one per class parameter,
 * possibly containing {@link net.hydromatic.typeclass.type.TypeVar}s. Its
 * constraints (prerequisites) do not take part in selecting the instance;
 * once it is selected they become new goals.
 */
public class InstanceDecl {
  public final String moduleName;
  public final String name;
  public final String className;
  public final List<Type> head;
  public final List<Constraint> constraints;
  public final Origin origin;
  /** Name of the chain; the name of the chain's first instance. */
  public final String chainName;
  /** Position in the chain; 0 for the first instance. */
  public final int chainIndex;

  InstanceDecl(
      String moduleName,
      String name,
      String className,
      List<? extends Type> head,
      List<Constraint> constraints,
      Origin origin,
      String chainName,
      int chainIndex) {
    this.moduleName = requireNonNull(moduleName);
    this.name = requireNonNull(name);
    this.className = requireNonNull(className);
    this.head = ImmutableList.copyOf(head);
    this.constraints = ImmutableList.copyOf(constraints);
    this.origin = requireNonNull(origin);
    this.chainName = requireNonNull(chainName);
    checkArgument(chainIndex >= 0);
    this.chainIndex = chainIndex;
  }

  /** Returns the head as a constraint, e.g. {@code Show (Array 'a)}. */
  public Constraint headConstraint() {
    return Constraint.of(className, head);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /**
   * Writes the declaration, e.g. "else instance showArray :: Show 'a =&gt;
   * Show (Array 'a)".
   */
  public StringBuilder describe(StringBuilder buf) {
    switch (origin) {
      case DERIVED:
        buf.append("derive ");
        break;
      case DERIVED_NEWTYPE:
        buf.append("derive newtype ");
        break;
      default:
        if (chainIndex > 0) {
          buf.append("else ");
        }
    }
    buf.append("instance ").append(name).append(" :: ");
    if (!constraints.isEmpty()) {
      if (constraints.size() > 1) {
        buf.append('(');
      }
      for (int i = 0; i < constraints.size(); i++) {
        constraints.get(i).describe(buf.append(i > 0 ? ", " : ""));
      }
      if (constraints.size() > 1) {
        buf.append(')');
      }
      buf.append(" => ");
    }
    return headConstraint().describe(buf);
  }

  /** How an instance was declared. */
  public enum Origin {
    /** Declared by {@code instance} or {@code else instance}. */
    DECLARED,
    /** Declared by {@code derive instance}. */
    DERIVED,
    /** Declared by {@code derive newtype instance}. */
    DERIVED_NEWTYPE
  }
}

// End InstanceDecl.java
