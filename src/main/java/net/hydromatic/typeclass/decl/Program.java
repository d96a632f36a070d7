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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typeclass.type.TypeSystem;

/**
 * Immutable snapshot of every module of a program, as produced by the
 * declaration-collection pass.
 *
 * <p>Load-time checks (see {@link
 * net.hydromatic.typeclass.compile.InstanceStore#load}) run over a complete
 * snapshot, never over a partially assembled program.
 */
public class Program {
  public final TypeSystem typeSystem;
  public final List<ModuleDecl> modules;

  private Program(TypeSystem typeSystem, List<ModuleDecl> modules) {
    this.typeSystem = requireNonNull(typeSystem);
    this.modules = ImmutableList.copyOf(modules);
  }

  /** Creates a builder. */
  public static Builder builder(TypeSystem typeSystem) {
    return new Builder(typeSystem);
  }

  /** Returns every instance chain in the program, in declaration order. */
  public List<InstanceChain> chains() {
    final ImmutableList.Builder<InstanceChain> b = ImmutableList.builder();
    modules.forEach(module -> b.addAll(module.chains));
    return b.build();
  }

  /** Builder for {@link Program}. */
  public static class Builder {
    private final TypeSystem typeSystem;
    private final Map<String, ModuleDecl.Builder> moduleBuilders =
        new LinkedHashMap<>();

    private Builder(TypeSystem typeSystem) {
      this.typeSystem = requireNonNull(typeSystem);
    }

    /** Starts a module; modules are kept in the order they are started. */
    public ModuleDecl.Builder module(String name) {
      checkArgument(
          !moduleBuilders.containsKey(name), "duplicate module %s", name);
      final ModuleDecl.Builder moduleBuilder =
          new ModuleDecl.Builder(typeSystem, name);
      moduleBuilders.put(name, moduleBuilder);
      return moduleBuilder;
    }

    public Program build() {
      final ImmutableList.Builder<ModuleDecl> modules = ImmutableList.builder();
      moduleBuilders.values().forEach(b -> modules.add(b.build()));
      return new Program(typeSystem, modules.build());
    }
  }
}

// End Program.java
