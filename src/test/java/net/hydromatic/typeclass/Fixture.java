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
package net.hydromatic.typeclass;

import com.google.common.collect.ImmutableList;
import net.hydromatic.typeclass.compile.InstanceStore;
import net.hydromatic.typeclass.compile.Tracer;
import net.hydromatic.typeclass.compile.Tracers;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceChain;
import net.hydromatic.typeclass.decl.ModuleDecl;
import net.hydromatic.typeclass.decl.Program;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.NamedType;
import net.hydromatic.typeclass.type.Skolem;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeSystem;
import net.hydromatic.typeclass.type.TypeVar;

/**
 * Assembles programs for tests.
 *
 * <p>{@link #prelude()} contains the modules that most tests need:
 *
 * <ul>
 *   <li>{@code Prim}: types {@code Int}, {@code String}, {@code Boolean},
 *       {@code Array a}
 *   <li>{@code Data.Tuple}: type {@code Tuple a b}
 *   <li>{@code Data.Show}: class {@code Show a} with instances for the
 *       above
 *   <li>{@code Control.Monad}: classes from {@code Functor} up to
 *       {@code MonadFail}
 *   <li>{@code Effect}: type {@code Effect}, which is a {@code Monad} but
 *       not a {@code MonadFail}
 *   <li>{@code Type.Equality}: class {@code TypeEquals a b | a -> b, b ->
 *       a}
 *   <li>{@code Data.MyShow}: class {@code MyShow a}, with a chain for
 *       {@code String}, then {@code Boolean}, then any type
 *   <li>{@code Data.Custom}: type {@code CustomType}, which has no instances
 * </ul>
 *
 * <p>Tests may add modules before calling {@link #load()}.
 */
public class Fixture {
  public final TypeSystem typeSystem = new TypeSystem();
  private final Program.Builder programBuilder = Program.builder(typeSystem);

  private Fixture() {}

  /** Creates a fixture with no modules. */
  public static Fixture empty() {
    return new Fixture();
  }

  /** Creates a fixture with the prelude modules. */
  public static Fixture prelude() {
    final Fixture f = new Fixture();
    f.module("Prim")
        .type("Int")
        .type("String")
        .type("Boolean")
        .type("Array", 1);
    f.module("Data.Tuple").type("Tuple", 2);

    final TypeVar a = f.var(0);
    final TypeVar b = f.var(1);
    f.module("Data.Show")
        .addClass(ClassDecl.builder("Show", "a"))
        .addChain(f.instance("Show", "showInt", f.type("Int")))
        .addChain(f.instance("Show", "showString", f.type("String")))
        .addChain(f.instance("Show", "showBoolean", f.type("Boolean")))
        .addChain(
            InstanceChain.builder("Show")
                .instance("showArray", ImmutableList.of(f.type("Array", a)),
                    constraint("Show", a)))
        .addChain(
            InstanceChain.builder("Show")
                .instance("showTuple",
                    ImmutableList.of(f.type("Tuple", a, b)),
                    constraint("Show", a), constraint("Show", b)));

    f.module("Control.Monad")
        .addClass(ClassDecl.builder("Functor", "f"))
        .addClass(ClassDecl.builder("Apply", "f").superclass("Functor", "f"))
        .addClass(
            ClassDecl.builder("Applicative", "f").superclass("Apply", "f"))
        .addClass(ClassDecl.builder("Bind", "m").superclass("Apply", "m"))
        .addClass(
            ClassDecl.builder("Monad", "m")
                .superclass("Applicative", "m")
                .superclass("Bind", "m"))
        .addClass(ClassDecl.builder("MonadFail", "m").superclass("Monad", "m"));

    final ModuleDecl.Builder effect = f.module("Effect").type("Effect");
    for (String className
        : ImmutableList.of("Functor", "Apply", "Applicative", "Bind",
            "Monad")) {
      effect.addChain(
          f.instance(className, lower(className) + "Effect",
              f.type("Effect")));
    }

    f.module("Type.Equality")
        .addClass(
            ClassDecl.builder("TypeEquals", "a", "b")
                .funDep(ImmutableList.of("a"), ImmutableList.of("b"))
                .funDep(ImmutableList.of("b"), ImmutableList.of("a")))
        .addChain(
            InstanceChain.builder("TypeEquals")
                .instance("refl", ImmutableList.of(a, a)));

    f.module("Data.MyShow")
        .addClass(ClassDecl.builder("MyShow", "a"))
        .addChain(
            InstanceChain.builder("MyShow")
                .instance("myShowString", ImmutableList.of(f.type("String")))
                .elseInstance("myShowBoolean",
                    ImmutableList.of(f.type("Boolean")))
                .elseInstance("myShowOther", ImmutableList.of(a)));

    f.module("Data.Custom").type("CustomType");
    return f;
  }

  private static String lower(String s) {
    return Character.toLowerCase(s.charAt(0)) + s.substring(1);
  }

  /** Starts a module. */
  public ModuleDecl.Builder module(String name) {
    return programBuilder.module(name);
  }

  /** Creates a chain containing one instance with no prerequisites. */
  public InstanceChain.Builder instance(String className, String name,
      Type... head) {
    return InstanceChain.builder(className)
        .instance(name, ImmutableList.copyOf(head));
  }

  /** Builds the program. */
  public Program program() {
    return programBuilder.build();
  }

  /** Builds and loads the program. */
  public InstanceStore load() {
    return load(Tracers.empty());
  }

  /** Builds and loads the program, with a tracer. */
  public InstanceStore load(Tracer tracer) {
    return InstanceStore.load(program(), tracer);
  }

  /** Creates a type, e.g. {@code type("Array", type("Int"))}. */
  public NamedType type(String name, Type... args) {
    return typeSystem.apply(name, args);
  }

  /** Returns an instance-head type variable: 0 is 'a, 1 is 'b, etc. */
  public TypeVar var(int ordinal) {
    return typeSystem.typeVar(ordinal);
  }

  /** Creates an existential variable. */
  public ExistentialVar unknown() {
    return typeSystem.existential();
  }

  /** Creates a rigid type variable. */
  public Skolem rigid(String name) {
    return typeSystem.skolem(name);
  }

  /** Creates a constraint. */
  public static Constraint constraint(String className, Type... args) {
    return Constraint.of(className, args);
  }
}

// End Fixture.java
