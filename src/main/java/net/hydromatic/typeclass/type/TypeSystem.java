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
package net.hydromatic.typeclass.type;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.typeclass.compile.LoadException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A table of all nominal types, indexed by name, and a source of fresh
 * existential variables.
 *
 * <p>Types are defined while modules are being loaded. After loading, the
 * {@link net.hydromatic.typeclass.compile.InstanceStore} takes a {@link
 * #snapshot()}; resolution only reads the snapshot, and only calls {@link
 * #existential()} on this object, which is thread-safe.
 */
public class TypeSystem {
  private final Map<String, TypeDef> typeDefByName = new LinkedHashMap<>();

  /** Number of existential variables created so far. */
  private final AtomicInteger existentialCount = new AtomicInteger();

  /**
   * Defines a nominal type.
   *
   * @throws LoadException.InvalidDeclaration if a type of the same name
   *     already exists
   */
  public TypeDef define(String moduleName, String name, int arity) {
    final TypeDef typeDef = new TypeDef(moduleName, name, arity);
    final TypeDef previous = typeDefByName.putIfAbsent(name, typeDef);
    if (previous != null) {
      throw new LoadException.InvalidDeclaration(
          "type " + name + " is defined in module " + moduleName
              + " and in module " + previous.moduleName);
    }
    return typeDef;
  }

  /** Looks up a type definition by name, returning null if not found. */
  public @Nullable TypeDef lookupOpt(String name) {
    return typeDefByName.get(name);
  }

  /** Looks up a type definition by name. Throws if not found. */
  public TypeDef lookup(String name) {
    final TypeDef typeDef = typeDefByName.get(name);
    if (typeDef == null) {
      throw new IllegalArgumentException("unknown type: " + name);
    }
    return typeDef;
  }

  /** Returns an immutable copy of the type definitions, keyed by name. */
  public ImmutableMap<String, TypeDef> snapshot() {
    return ImmutableMap.copyOf(typeDefByName);
  }

  /** Creates a type by applying a constructor to arguments. */
  public NamedType apply(String name, Type... args) {
    return apply(name, ImmutableList.copyOf(args));
  }

  /** Creates a type by applying a constructor to a list of arguments. */
  public NamedType apply(String name, List<? extends Type> args) {
    final TypeDef typeDef = lookup(name);
    checkArgument(
        typeDef.arity == args.size(),
        "type %s expects %s arguments, got %s",
        name,
        typeDef.arity,
        args.size());
    return new NamedType(name, args);
  }

  /** Returns the instance-head variable with a given ordinal. */
  public TypeVar typeVar(int ordinal) {
    return new TypeVar(ordinal);
  }

  /** Creates an existential variable that has never been seen before. */
  public ExistentialVar existential() {
    return new ExistentialVar(existentialCount.getAndIncrement());
  }

  /** Creates a rigid type variable. */
  public Skolem skolem(String name) {
    return new Skolem(name);
  }
}

// End TypeSystem.java
