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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typeclass.decl.ClassDecl;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceChain;
import net.hydromatic.typeclass.decl.InstanceDecl;
import net.hydromatic.typeclass.decl.ModuleDecl;
import net.hydromatic.typeclass.decl.Program;
import net.hydromatic.typeclass.type.ExistentialVar;
import net.hydromatic.typeclass.type.Op;
import net.hydromatic.typeclass.type.Type;
import net.hydromatic.typeclass.type.TypeDef;
import net.hydromatic.typeclass.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Registry of the classes and instance chains of a program.
 *
 * <p>Created by {@link #load}, which checks the whole program before
 * admitting anything; after that the store is immutable, and may be shared
 * by concurrent resolutions.
 */
public class InstanceStore {
  /** Used only to create existential variables. */
  private final TypeSystem typeSystem;
  public final SuperclassGraph superclassGraph;
  private final ImmutableMap<String, TypeDef> typeDefs;
  private final ImmutableMap<String, ModuleDecl> modules;
  private final ImmutableMap<String, ClassDecl> classes;
  private final ImmutableListMultimap<String, InstanceChain> chains;
  private final ImmutableMap<String, InstanceDecl> instances;

  private InstanceStore(
      TypeSystem typeSystem,
      SuperclassGraph superclassGraph,
      ImmutableMap<String, TypeDef> typeDefs,
      ImmutableMap<String, ModuleDecl> modules,
      ImmutableMap<String, ClassDecl> classes,
      ImmutableListMultimap<String, InstanceChain> chains,
      ImmutableMap<String, InstanceDecl> instances) {
    this.typeSystem = requireNonNull(typeSystem);
    this.superclassGraph = requireNonNull(superclassGraph);
    this.typeDefs = requireNonNull(typeDefs);
    this.modules = requireNonNull(modules);
    this.classes = requireNonNull(classes);
    this.chains = requireNonNull(chains);
    this.instances = requireNonNull(instances);
  }

  /** Loads a program. */
  public static InstanceStore load(Program program) {
    return load(program, Tracers.empty());
  }

  /**
   * Loads a program, reporting each rejected declaration to a tracer.
   *
   * @throws LoadException if the program is not well-formed
   */
  public static InstanceStore load(Program program, Tracer tracer) {
    final Loader loader = new Loader(program, tracer);
    try {
      return loader.load();
    } catch (LoadException e) {
      if (!loader.reported) {
        tracer.onReject(e);
      }
      throw e;
    }
  }

  /** Returns the class with a given name, or null. */
  public @Nullable ClassDecl lookupClass(String className) {
    return classes.get(className);
  }

  /** Returns the class with a given name; throws if not found. */
  public ClassDecl classDecl(String className) {
    final ClassDecl classDecl = classes.get(className);
    if (classDecl == null) {
      throw new IllegalArgumentException("unknown class " + className);
    }
    return classDecl;
  }

  /** Returns the classes, in declaration order. */
  public List<ClassDecl> classes() {
    return classes.values().asList();
  }

  /**
   * Returns the chains of a class, ordered by module (in program order)
   * and then by declaration within the module.
   */
  public List<InstanceChain> chains(String className) {
    return chains.get(className);
  }

  /** Returns the instance with a given name, or null. */
  public @Nullable InstanceDecl instance(String name) {
    return instances.get(name);
  }

  /** Returns the module with a given name, or null. */
  public @Nullable ModuleDecl module(String name) {
    return modules.get(name);
  }

  /**
   * Returns the definition of a type, or null. Only types defined before
   * the program was loaded are known.
   */
  public @Nullable TypeDef typeDef(String name) {
    return typeDefs.get(name);
  }

  /** Creates an existential variable that has never been seen before. */
  public ExistentialVar existential() {
    return typeSystem.existential();
  }

  @Override
  public String toString() {
    return "InstanceStore{classes=" + classes.keySet()
        + ", instances=" + instances.keySet() + "}";
  }

  /** Returns all instances, in load order. */
  public List<InstanceDecl> instances() {
    return ImmutableList.copyOf(instances.values());
  }

  /** Performs the load-time checks, in order. */
  private static class Loader {
    final Program program;
    final Tracer tracer;
    final Map<String, ModuleDecl> modules = new LinkedHashMap<>();
    final Map<String, ClassDecl> classes = new LinkedHashMap<>();
    final Map<String, InstanceDecl> instances = new LinkedHashMap<>();
    /** Whether the exception being thrown has already been reported. */
    boolean reported;

    Loader(Program program, Tracer tracer) {
      this.program = requireNonNull(program);
      this.tracer = requireNonNull(tracer);
    }

    InstanceStore load() {
      // 1. Collect modules and classes.
      for (ModuleDecl module : program.modules) {
        modules.put(module.name, module);
        for (ClassDecl classDecl : module.classes) {
          if (classes.putIfAbsent(classDecl.name, classDecl) != null) {
            throw new LoadException.InvalidDeclaration("Class "
                + classDecl.name + " is declared more than once");
          }
        }
      }

      // 2. Functional dependencies of each class.
      classes.values().forEach(FunDeps::validate);

      // 3. Superclasses.
      final SuperclassGraph superclassGraph = SuperclassGraph.create(classes);

      // 4. Instances.
      final ImmutableListMultimap.Builder<String, InstanceChain> chains =
          ImmutableListMultimap.builder();
      for (ModuleDecl module : program.modules) {
        for (InstanceChain chain : module.chains) {
          for (InstanceDecl instance : chain.instances) {
            validate(instance);
          }
          chains.put(chain.className, chain);
        }
      }

      // 5. Orphans. Report every orphan, then fail on the first.
      final ImmutableMap<String, TypeDef> typeDefs =
          program.typeSystem.snapshot();
      final List<LoadException.OrphanInstance> orphans =
          OrphanChecker.create(program, typeDefs).check(program);
      if (!orphans.isEmpty()) {
        orphans.forEach(tracer::onReject);
        reported = true;
        throw orphans.get(0);
      }

      return new InstanceStore(program.typeSystem, superclassGraph, typeDefs,
          ImmutableMap.copyOf(modules), ImmutableMap.copyOf(classes),
          chains.build(), ImmutableMap.copyOf(instances));
    }

    private void validate(InstanceDecl instance) {
      if (instances.putIfAbsent(instance.name, instance) != null) {
        throw new LoadException.InvalidDeclaration("Instance "
            + instance.name + " is declared more than once");
      }
      final ClassDecl classDecl = classes.get(instance.className);
      if (classDecl == null) {
        throw new LoadException.InvalidDeclaration("Instance "
            + instance.name + " is for unknown class " + instance.className);
      }
      if (instance.head.size() != classDecl.arity()) {
        throw new LoadException.InvalidDeclaration("Instance "
            + instance.name + " has " + instance.head.size()
            + " types in its head, but class " + classDecl.name + " has "
            + classDecl.arity() + " parameters");
      }
      for (Type type : instance.head) {
        if (type.contains(Op.EXISTENTIAL) || type.contains(Op.SKOLEM)) {
          throw new LoadException.InvalidDeclaration("Instance "
              + instance.name + " has a type in its head that is not a "
              + "type constructor or a type variable: " + type);
        }
      }
      for (Constraint constraint : instance.constraints) {
        final ClassDecl prerequisite = classes.get(constraint.className);
        if (prerequisite == null) {
          throw new LoadException.InvalidDeclaration("Instance "
              + instance.name + " requires unknown class "
              + constraint.className);
        }
        if (constraint.args.size() != prerequisite.arity()) {
          throw new LoadException.InvalidDeclaration("Instance "
              + instance.name + " requires " + constraint + ", but class "
              + prerequisite.name + " has " + prerequisite.arity()
              + " parameters");
        }
        if (constraint.contains(Op.EXISTENTIAL)
            || constraint.contains(Op.SKOLEM)) {
          throw new LoadException.InvalidDeclaration("Instance "
              + instance.name + " has a prerequisite that is not a "
              + "type constructor or a type variable: " + constraint);
        }
      }
    }
  }
}

// End InstanceStore.java
