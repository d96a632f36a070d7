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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceChain;
import net.hydromatic.typeclass.decl.InstanceDecl;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Selects the instance that satisfies a constraint.
 *
 * <p>Within a chain, instances are tried in order. The first that matches
 * is selected, and later instances are not consulted. If an instance
 * matches ambiguously (it would match for some values of the constraint's
 * unknown types, but not others) the chain stops there without a result,
 * even if a later instance would have matched: selecting a later instance
 * could become wrong once the unknown types are known.
 *
 * <p>Prerequisites of an instance ({@code Show 'a} in {@code Show 'a =>
 * Show (Array 'a)}) take no part in selection.
 */
public class ChainResolver {
  private final InstanceStore store;
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;

  public ChainResolver(InstanceStore store, Map<Prop, Object> props,
      Tracer tracer) {
    this.store = requireNonNull(store);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a resolver with default properties. */
  public ChainResolver(InstanceStore store, Tracer tracer) {
    this(store, ImmutableMap.of(), tracer);
  }

  /**
   * Resolves a constraint against all chains of its class, checking for
   * overlap if the {@link Prop#OVERLAP_CHECK} property is set.
   */
  public ChainResult resolve(Constraint constraint) {
    final ClassDecl classDecl = store.lookupClass(constraint.className);
    if (classDecl == null) {
      throw new ResolveException.UnknownClass(constraint);
    }
    return resolve(classDecl, constraint,
        Prop.OVERLAP_CHECK.booleanValue(props));
  }

  /**
   * Resolves a constraint against all chains of its class.
   *
   * <p>Chains are independent. The first chain that resolves the
   * constraint wins. If none resolves, the result is the first chain that
   * stopped on an ambiguous instance, if any.
   *
   * @param overlapCheck Whether to consult every chain, and fail if more
   *     than one resolves the constraint
   * @throws ResolveException.OverlappingInstances if two chains resolve the
   *     constraint and {@code overlapCheck} is true
   */
  public ChainResult resolve(ClassDecl classDecl, Constraint constraint,
      boolean overlapCheck) {
    checkArgument(classDecl.name.equals(constraint.className),
        "constraint %s is not for class %s", constraint, classDecl.name);
    checkArgument(constraint.args.size() == classDecl.arity(),
        "class %s has %s parameters, but constraint %s has %s arguments",
        classDecl.name, classDecl.arity(), constraint,
        constraint.args.size());
    @Nullable ChainResult resolved = null;
    @Nullable ChainResult ambiguous = null;
    for (InstanceChain chain : store.chains(classDecl.name)) {
      final ChainResult result = resolve(chain, classDecl, constraint);
      switch (result.kind) {
        case RESOLVED:
          if (resolved != null) {
            throw new ResolveException.OverlappingInstances(constraint,
                resolved.instance(), result.instance());
          }
          resolved = result;
          if (!overlapCheck) {
            return resolved;
          }
          break;
        case AMBIGUOUS_STOP:
          if (ambiguous == null) {
            ambiguous = result;
          }
          break;
        default:
          break;
      }
    }
    if (resolved != null) {
      return resolved;
    }
    if (ambiguous != null) {
      return ambiguous;
    }
    return ChainResult.notFound();
  }

  /** Resolves a constraint against one chain. */
  public ChainResult resolve(InstanceChain chain, ClassDecl classDecl,
      Constraint constraint) {
    final Set<Integer> outputs = FunDeps.outputs(classDecl, constraint);
    for (InstanceDecl instance : chain.instances) {
      final MatchResult result =
          new TypeMatcher(store::existential)
              .matchInstance(instance.head, constraint.args, outputs);
      tracer.onCandidate(constraint, instance, result);
      switch (result.kind) {
        case MATCHED:
          tracer.onResolved(constraint, instance);
          return ChainResult.resolved(instance, result);
        case AMBIGUOUS:
          tracer.onChainStop(constraint, instance);
          return ChainResult.ambiguousStop(instance);
        default:
          break;
      }
    }
    return ChainResult.notFound();
  }
}

// End ChainResolver.java
