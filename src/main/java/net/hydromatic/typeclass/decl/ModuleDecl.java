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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.typeclass.type.TypeDef;
import net.hydromatic.typeclass.type.TypeSystem;

/**
 * Module: a named unit that owns nominal types, classes and instance chains.
 *
 * <p>The import graph between modules does not matter to resolution; the
 * orphan check only needs to know which module defines each type and class.
 */
public class ModuleDecl {
  public final String name;
  public final List<TypeDef> types;
  public final List<ClassDecl> classes;
  public final List<InstanceChain> chains;

  private ModuleDecl(
      String name,
      List<TypeDef> types,
      List<ClassDecl> classes,
      List<InstanceChain> chains) {
    this.name = requireNonNull(name);
    this.types = ImmutableList.copyOf(types);
    this.classes = ImmutableList.copyOf(classes);
    this.chains = ImmutableList.copyOf(chains);
  }

  /** Returns all instances declared in this module, in declaration order. */
  public List<InstanceDecl> instances() {
    final ImmutableList.Builder<InstanceDecl> b = ImmutableList.builder();
    chains.forEach(chain -> b.addAll(chain.instances));
    return b.build();
  }

  @Override
  public String toString() {
    return "module " + name;
  }

  /** Builder for {@link ModuleDecl}. */
  public static class Builder {
    private final TypeSystem typeSystem;
    final String name;
    private final List<TypeDef> types = new ArrayList<>();
    private final List<ClassDecl> classes = new ArrayList<>();
    private final List<InstanceChain> chains = new ArrayList<>();

    Builder(TypeSystem typeSystem, String name) {
      this.typeSystem = requireNonNull(typeSystem);
      this.name = requireNonNull(name);
    }

    /** Defines a type with no parameters. */
    public Builder type(String typeName) {
      return type(typeName, 0);
    }

    /** Defines a type with a given number of parameters. */
    public Builder type(String typeName, int arity) {
      types.add(typeSystem.define(name, typeName, arity));
      return this;
    }

    /** Declares a class in this module. */
    public Builder addClass(ClassDecl.Builder classBuilder) {
      classes.add(classBuilder.build(name));
      return this;
    }

    /** Declares an instance chain in this module. */
    public Builder addChain(InstanceChain.Builder chainBuilder) {
      chains.add(chainBuilder.build(name));
      return this;
    }

    public ModuleDecl build() {
      return new ModuleDecl(name, types, classes, chains);
    }
  }
}

// End ModuleDecl.java
