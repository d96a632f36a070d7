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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.typeclass.decl.InstanceDecl;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of resolving a constraint against one or more instance chains. */
public final class ChainResult {
  private static final ChainResult NOT_FOUND =
      new ChainResult(Kind.NOT_FOUND, null, ImmutableMap.of(),
          ImmutableMap.of());

  public final Kind kind;
  /**
   * The instance that resolved the constraint or that stopped the chain;
   * null if not found.
   */
  public final @Nullable InstanceDecl instance;
  public final ImmutableMap<TypeVar, Type> substitution;
  public final ImmutableMap<ExistentialVar, Type> improvements;

  private ChainResult(Kind kind, @Nullable InstanceDecl instance,
      ImmutableMap<TypeVar, Type> substitution,
      ImmutableMap<ExistentialVar, Type> improvements) {
    this.kind = requireNonNull(kind);
    this.instance = instance;
    this.substitution = requireNonNull(substitution);
    this.improvements = requireNonNull(improvements);
  }

  static ChainResult resolved(InstanceDecl instance, MatchResult result) {
    return new ChainResult(Kind.RESOLVED, requireNonNull(instance),
        result.substitution, result.improvements);
  }

  static ChainResult notFound() {
    return NOT_FOUND;
  }

  static ChainResult ambiguousStop(InstanceDecl blockingInstance) {
    return new ChainResult(Kind.AMBIGUOUS_STOP,
        requireNonNull(blockingInstance), ImmutableMap.of(),
        ImmutableMap.of());
  }

  /** Returns the instance; throws if there is none. */
  public InstanceDecl instance() {
    return requireNonNull(instance, "instance");
  }

  @Override
  public String toString() {
    switch (kind) {
      case RESOLVED:
        return "resolved " + instance().name + " " + substitution;
      case AMBIGUOUS_STOP:
        return "ambiguous at " + instance().name;
      default:
        return "not found";
    }
  }

  /** Kind of outcome. */
  public enum Kind {
    /** An instance matched. */
    RESOLVED,
    /** Every instance of every chain failed to match. */
    NOT_FOUND,
    /** An instance matched ambiguously, and the search stopped there. */
    AMBIGUOUS_STOP
  }
}

// End ChainResult.java
